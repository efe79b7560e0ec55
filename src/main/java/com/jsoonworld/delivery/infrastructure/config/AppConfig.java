package com.jsoonworld.delivery.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jsoonworld.delivery.application.port.out.NotificationSender;
import com.jsoonworld.delivery.application.service.NotificationDispatcher;
import com.jsoonworld.delivery.application.service.PriorityScheduler;
import com.jsoonworld.delivery.domain.model.BatchConfig;
import com.jsoonworld.delivery.domain.model.RateLimitConfig;
import com.jsoonworld.delivery.domain.service.DeliveryErrorClassifier;
import com.jsoonworld.delivery.domain.service.NotificationEventBus;
import com.jsoonworld.delivery.domain.service.NotificationValidator;
import com.jsoonworld.delivery.domain.service.RateLimiter;
import com.jsoonworld.delivery.domain.service.RetryQueue;
import com.jsoonworld.delivery.domain.service.ScopeLock;
import jakarta.validation.Validator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimitConfig rateLimitConfig(
            @Value("${delivery.rate-limit.requests-per-second:50}") int requestsPerSecond,
            @Value("${delivery.rate-limit.window-ms:1000}") long windowMs) {
        return new RateLimitConfig(requestsPerSecond, windowMs);
    }

    @Bean
    public BatchConfig batchConfig(
            @Value("${delivery.batch.max-size:10}") int maxBatchSize,
            @Value("${delivery.batch.processing-interval-ms:1000}") long processingIntervalMs) {
        return new BatchConfig(maxBatchSize, processingIntervalMs);
    }

    @Bean
    public NotificationEventBus notificationEventBus() {
        return new NotificationEventBus();
    }

    @Bean
    public RateLimiter rateLimiter(RateLimitConfig rateLimitConfig, Clock clock) {
        return new RateLimiter(rateLimitConfig, clock);
    }

    @Bean
    public RetryQueue retryQueue(NotificationEventBus eventBus) {
        return new RetryQueue(eventBus);
    }

    @Bean
    public ScopeLock scopeLock() {
        return new ScopeLock();
    }

    @Bean
    public DeliveryErrorClassifier deliveryErrorClassifier() {
        return new DeliveryErrorClassifier();
    }

    @Bean
    public NotificationValidator notificationValidator(Validator validator) {
        return new NotificationValidator(validator);
    }

    @Bean
    public ThreadPoolTaskScheduler notificationTaskScheduler(
            @Value("${delivery.scheduler.pool-size:2}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("notification-cron-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(
            NotificationSender notificationSender,
            RateLimiter rateLimiter,
            RetryQueue retryQueue,
            ScopeLock scopeLock,
            DeliveryErrorClassifier deliveryErrorClassifier,
            NotificationValidator notificationValidator,
            NotificationEventBus eventBus,
            Clock clock,
            @Value("${delivery.delivery-timeout-ms:5000}") long deliveryTimeoutMs) {
        return new NotificationDispatcher(notificationSender, rateLimiter, retryQueue, scopeLock,
            deliveryErrorClassifier, notificationValidator, eventBus, clock,
            Duration.ofMillis(deliveryTimeoutMs));
    }

    @Bean
    public PriorityScheduler priorityScheduler(NotificationDispatcher notificationDispatcher,
                                               NotificationValidator notificationValidator,
                                               NotificationEventBus eventBus,
                                               TaskScheduler notificationTaskScheduler,
                                               BatchConfig batchConfig,
                                               Clock clock) {
        return new PriorityScheduler(notificationDispatcher, notificationValidator, eventBus,
            notificationTaskScheduler, batchConfig, clock);
    }
}
