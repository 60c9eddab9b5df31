package com.flagship.coin_ledger.notification;

import com.flagship.coin_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Stores notifications once the emitting transaction has committed.
 * Without a surrounding transaction the event is handled immediately.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationListener {

    private final NotificationService notificationService;
    private final LedgerMetrics metrics;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onNotificationRequested(NotificationRequested event) {
        try {
            notificationService.store(event.getAccountId(), event.getKind(), event.getPayload());
            metrics.recordNotification("stored");
        } catch (RuntimeException e) {
            // Delivery is best effort; the committed state change stands.
            metrics.recordNotification("failed");
            log.error("Failed to store notification: accountId={}, kind={}, error={}",
                    event.getAccountId(), event.getKind(), e.getMessage(), e);
        }
    }
}
