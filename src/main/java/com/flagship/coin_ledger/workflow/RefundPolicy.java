package com.flagship.coin_ledger.workflow;

import com.flagship.coin_ledger.config.CoinSettings;
import com.flagship.coin_ledger.exception.LedgerIntegrityException;
import com.flagship.coin_ledger.ledger.LedgerEntry;
import com.flagship.coin_ledger.ledger.LedgerReason;
import com.flagship.coin_ledger.ledger.LedgerStore;
import com.flagship.coin_ledger.observability.LedgerMetrics;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import com.flagship.coin_ledger.subject.SubjectPersistenceService;
import com.flagship.coin_ledger.subject.SubjectStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Returns the coins spent on a subject that ended REJECTED or CANCELLED.
 *
 * Exactly once per subject: the refundApplied flag is read under the subject's row
 * lock and set in the same transaction as the REFUND entry. The unique index on
 * (reference_kind, reference_id, reason) backs this up at the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RefundPolicy {

    private final LedgerStore ledgerStore;
    private final SubjectPersistenceService subjectPersistence;
    private final CoinSettings settings;
    private final LedgerMetrics metrics;

    /**
     * Must run inside the transaction that changed the subject's status. Subjects that
     * are not REJECTED or CANCELLED are never refunded.
     *
     * @return the REFUND entry, or empty when nothing was owed
     * @throws LedgerIntegrityException if a refund for this subject already exists in the ledger
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<LedgerEntry> apply(ModeratedSubject subject) {
        ModeratedSubject current = subjectPersistence.lockForUpdate(subject.getId());

        if (current.getStatus() != SubjectStatus.REJECTED && current.getStatus() != SubjectStatus.CANCELLED) {
            metrics.recordRefund("skipped_not_refundable");
            log.warn("Refund requested for subject {} in status {}, nothing refunded",
                    current.getId(), current.getStatus());
            return Optional.empty();
        }
        if (current.getCoinCost() == 0) {
            metrics.recordRefund("skipped_free");
            return Optional.empty();
        }
        if (current.isRefundApplied()) {
            metrics.recordRefund("skipped_already_applied");
            log.debug("Refund already applied for subject {}", current.getId());
            return Optional.empty();
        }
        if (!settings.isAllowRefunds()) {
            metrics.recordRefund("skipped_disabled");
            log.info("Refunds disabled, keeping {} coins for subject {}", current.getCoinCost(), current.getId());
            return Optional.empty();
        }

        LedgerEntry refund;
        try {
            refund = ledgerStore.append(
                current.getOwnerAccountId(),
                current.getCoinCost(),
                LedgerReason.REFUND,
                current.getKind().referenceKind(),
                current.getId(),
                "Refund for " + current.getKind().name().toLowerCase() + " " + current.getStatus().name().toLowerCase());
        } catch (LedgerIntegrityException e) {
            // The flag said no refund yet but the ledger has one; already reported by the store.
            metrics.recordRefund("integrity_fault");
            log.error("Refund for subject {} already in the ledger while refundApplied is false", current.getId());
            throw e;
        }

        subjectPersistence.markRefundApplied(current.getId());
        metrics.recordRefund("applied");
        log.info("Refunded {} coins to {} for subject {}", refund.getDelta(), refund.getAccountId(), current.getId());
        return Optional.of(refund);
    }
}
