package com.flagship.coin_ledger.notification;

import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for user-visible notifications.
 *
 * Emitting only publishes an application event. The notification is stored by
 * {@link NotificationListener} after the surrounding transaction commits, so a
 * rolled-back unit never notifies and a failed write never undoes a committed one.
 */
@Component
@RequiredArgsConstructor
public class NotificationEmitter {

    private final ApplicationEventPublisher eventPublisher;

    public void emit(UUID accountId, NotificationKind kind, Map<String, Object> payload) {
        eventPublisher.publishEvent(new NotificationRequested(
            accountId, kind, payload != null ? new LinkedHashMap<>(payload) : Map.of()));
    }
}
