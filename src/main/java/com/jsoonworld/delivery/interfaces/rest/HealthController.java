package com.jsoonworld.delivery.interfaces.rest;

import com.jsoonworld.delivery.application.port.in.QueryDeliveryStatsUseCase;
import com.jsoonworld.delivery.application.port.out.NotificationSender;
import com.jsoonworld.delivery.domain.model.EngineStats;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private static final Duration SENDER_CHECK_TIMEOUT = Duration.ofSeconds(2);

    private final QueryDeliveryStatsUseCase queryDeliveryStatsUseCase;
    private final NotificationSender notificationSender;

    public HealthController(QueryDeliveryStatsUseCase queryDeliveryStatsUseCase,
                            NotificationSender notificationSender) {
        this.queryDeliveryStatsUseCase = queryDeliveryStatsUseCase;
        this.notificationSender = notificationSender;
    }

    @GetMapping
    public Mono<Map<String, Object>> health() {
        return checkSender()
            .map(senderStatus -> {
                String engineStatus = queryDeliveryStatsUseCase.isRunning() ? "UP" : "DOWN";
                EngineStats stats = queryDeliveryStatsUseCase.stats();

                Map<String, String> components = new LinkedHashMap<>();
                components.put("engine", engineStatus);
                components.put(notificationSender.channel().name().toLowerCase(Locale.ROOT), senderStatus);

                boolean allUp = components.values().stream().allMatch("UP"::equals);

                Map<String, Object> queues = new LinkedHashMap<>();
                queues.put("queued", stats.totalQueued());
                queues.put("retrying", stats.totalRetrying());
                queues.put("scheduledJobs", stats.scheduledJobs());

                Map<String, Object> data = new LinkedHashMap<>();
                data.put("status", allUp ? "UP" : "DEGRADED");
                data.put("components", components);
                data.put("queues", queues);

                Map<String, Object> response = new LinkedHashMap<>();
                response.put("success", true);
                response.put("data", data);
                return response;
            });
    }

    private Mono<String> checkSender() {
        return notificationSender.isAvailable()
            .timeout(SENDER_CHECK_TIMEOUT)
            .map(available -> available ? "UP" : "DOWN")
            .defaultIfEmpty("DOWN")
            .onErrorReturn("DOWN");
    }
}
