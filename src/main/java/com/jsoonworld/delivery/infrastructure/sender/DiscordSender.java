package com.jsoonworld.delivery.infrastructure.sender;

import com.jsoonworld.delivery.application.port.out.NotificationSender;
import com.jsoonworld.delivery.domain.exception.DeliveryException;
import com.jsoonworld.delivery.domain.model.DeliveryErrorKind;
import com.jsoonworld.delivery.domain.model.NotificationChannel;
import com.jsoonworld.delivery.domain.model.NotificationContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

// recipient id is the Discord channel id
@Component
@ConditionalOnProperty(name = "delivery.discord.enabled", havingValue = "true")
public class DiscordSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(DiscordSender.class);

    private final WebClient webClient;

    public DiscordSender(WebClient.Builder webClientBuilder,
                         @Value("${delivery.discord.base-url:https://discord.com/api/v10}") String baseUrl,
                         @Value("${delivery.discord.bot-token}") String botToken) {
        this.webClient = webClientBuilder
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bot " + botToken)
            .build();
    }

    @Override
    public Mono<Void> deliver(String recipientId, NotificationContent content) {
        Map<String, Object> payload = Map.of(
            "embeds", List.of(Map.of(
                "title", content.title(),
                "description", content.message()
            ))
        );

        return webClient.post()
            .uri("/channels/{channelId}/messages", recipientId)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .toBodilessEntity()
            .doOnSuccess(response -> log.debug("Discord message accepted: channelId={}", recipientId))
            .then()
            .onErrorMap(WebClientResponseException.TooManyRequests.class, e -> {
                String retryAfter = e.getHeaders().getFirst("Retry-After");
                log.warn("Discord rate limited (429): channelId={}, retryAfter={}", recipientId, retryAfter);
                return new DeliveryException(DeliveryErrorKind.RETRYABLE,
                    "Discord rate limited (429), Retry-After=" + retryAfter, e);
            })
            .onErrorMap(WebClientResponseException.class, e -> {
                if (e.getStatusCode().is5xxServerError()) {
                    log.warn("Discord server error (5xx): channelId={}, status={}", recipientId, e.getStatusCode());
                    return DeliveryException.retryable("Discord server error " + e.getStatusCode().value());
                }
                log.error("Discord client error (4xx): channelId={}, status={}, body={}",
                    recipientId, e.getStatusCode(), e.getResponseBodyAsString());
                return DeliveryException.fatal("Discord client error " + e.getStatusCode().value());
            })
            .onErrorMap(WebClientRequestException.class, e -> {
                log.warn("Discord network error: channelId={}, error={}", recipientId, e.getMessage());
                return DeliveryException.retryable("Discord network error - " + e.getMessage());
            });
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.DISCORD;
    }
}
