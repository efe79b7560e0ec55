package com.jsoonworld.delivery.interfaces.rest;

import com.jsoonworld.delivery.application.port.in.QueryDeliveryStatsUseCase;
import com.jsoonworld.delivery.application.port.in.ScheduleNotificationUseCase;
import com.jsoonworld.delivery.application.port.in.SendNotificationUseCase;
import com.jsoonworld.delivery.interfaces.rest.dto.request.ScheduleNotificationRequest;
import com.jsoonworld.delivery.interfaces.rest.dto.request.SendNotificationRequest;
import com.jsoonworld.delivery.interfaces.rest.dto.response.DeliveryResponse;
import com.jsoonworld.delivery.interfaces.rest.dto.response.NotificationEventResponse;
import com.jsoonworld.delivery.interfaces.rest.dto.response.NotificationResponse;
import com.jsoonworld.delivery.interfaces.rest.dto.response.StatsResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/notifications")
public class NotificationController {

    private final SendNotificationUseCase sendNotificationUseCase;
    private final ScheduleNotificationUseCase scheduleNotificationUseCase;
    private final QueryDeliveryStatsUseCase queryDeliveryStatsUseCase;

    public NotificationController(SendNotificationUseCase sendNotificationUseCase,
                                  ScheduleNotificationUseCase scheduleNotificationUseCase,
                                  QueryDeliveryStatsUseCase queryDeliveryStatsUseCase) {
        this.sendNotificationUseCase = sendNotificationUseCase;
        this.scheduleNotificationUseCase = scheduleNotificationUseCase;
        this.queryDeliveryStatsUseCase = queryDeliveryStatsUseCase;
    }

    @PostMapping
    public Mono<DeliveryResponse> send(@Valid @RequestBody SendNotificationRequest request) {
        return Mono.defer(() -> sendNotificationUseCase.sendNow(request.toDomain()))
                .map(DeliveryResponse::from);
    }

    @PostMapping("/queue")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<NotificationResponse> queue(@Valid @RequestBody SendNotificationRequest request) {
        return Mono.fromCallable(() -> sendNotificationUseCase.queue(request.toDomain()))
                .map(NotificationResponse::from);
    }

    @PostMapping("/schedules")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<NotificationResponse> schedule(@Valid @RequestBody ScheduleNotificationRequest request) {
        return Mono.fromCallable(() -> scheduleNotificationUseCase.scheduleRecurring(
                        request.notification().toDomain(), request.cronExpression()))
                .map(NotificationResponse::from);
    }

    @DeleteMapping("/schedules/{notificationId}")
    public Mono<ResponseEntity<Void>> cancel(@PathVariable String notificationId) {
        return Mono.fromCallable(() -> scheduleNotificationUseCase.cancel(notificationId))
                .map(cancelled -> cancelled
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }

    @GetMapping("/stats")
    public Mono<StatsResponse> stats() {
        return Mono.fromCallable(() -> StatsResponse.from(
                queryDeliveryStatsUseCase.stats(), queryDeliveryStatsUseCase.isRunning()));
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<NotificationEventResponse> events() {
        return queryDeliveryStatsUseCase.events()
                .map(NotificationEventResponse::from);
    }
}
