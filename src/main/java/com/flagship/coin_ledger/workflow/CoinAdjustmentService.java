package com.flagship.coin_ledger.workflow;

import com.flagship.coin_ledger.account.AccountService;
import com.flagship.coin_ledger.audit.AuditAction;
import com.flagship.coin_ledger.audit.AuditEmitter;
import com.flagship.coin_ledger.ledger.LedgerEntry;
import com.flagship.coin_ledger.ledger.LedgerReason;
import com.flagship.coin_ledger.ledger.LedgerStore;
import com.flagship.coin_ledger.notification.NotificationEmitter;
import com.flagship.coin_ledger.notification.NotificationKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Manual balance corrections by an admin. Each one is an ADJUST entry plus an audit record;
 * a negative adjustment cannot overdraw the account.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CoinAdjustmentService {

    static final String REFERENCE_KIND = "ADMIN_ADJUSTMENT";

    private final AccountService accountService;
    private final LedgerStore ledgerStore;
    private final AuditEmitter auditEmitter;
    private final NotificationEmitter notificationEmitter;

    @Transactional
    public LedgerEntry adjust(UUID adminId, UUID accountId, long delta, String description) {
        accountService.requireAdmin(adminId);

        // Each adjustment is its own reference, so the ledger's uniqueness rule never merges two of them.
        UUID adjustmentId = UUID.randomUUID();
        LedgerEntry entry = ledgerStore.append(accountId, delta, LedgerReason.ADJUST, REFERENCE_KIND, adjustmentId,
            description != null && !description.isBlank() ? description : "Admin adjustment");

        auditEmitter.record(adminId, AuditAction.COINS_ADJUSTED, "users", accountId,
            AuditEmitter.meta("delta", delta, "description", description, "entryId", entry.getId()));
        notificationEmitter.emit(accountId,
            delta > 0 ? NotificationKind.COINS_ADDED : NotificationKind.COINS_REMOVED,
            AuditEmitter.meta("delta", delta, "description", description));

        log.info("Coins adjusted: accountId={}, delta={}, admin={}", accountId, delta, adminId);
        return entry;
    }
}
