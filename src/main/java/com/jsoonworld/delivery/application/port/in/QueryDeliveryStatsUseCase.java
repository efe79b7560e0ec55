package com.jsoonworld.delivery.application.port.in;

import com.jsoonworld.delivery.domain.model.EngineStats;
import com.jsoonworld.delivery.domain.model.NotificationEvent;
import reactor.core.publisher.Flux;

public interface QueryDeliveryStatsUseCase {

    EngineStats stats();

    Flux<NotificationEvent> events();

    boolean isRunning();
}
