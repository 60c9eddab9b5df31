package com.flagship.coin_ledger.workflow;

import com.flagship.coin_ledger.audit.AuditAction;
import com.flagship.coin_ledger.audit.AuditEmitter;
import com.flagship.coin_ledger.config.CoinSettings;
import com.flagship.coin_ledger.exception.AlreadyDecidedException;
import com.flagship.coin_ledger.exception.NotEligibleException;
import com.flagship.coin_ledger.exception.NotOwnerException;
import com.flagship.coin_ledger.exception.SubjectNotFoundException;
import com.flagship.coin_ledger.ledger.LedgerEntry;
import com.flagship.coin_ledger.ledger.LedgerReason;
import com.flagship.coin_ledger.ledger.LedgerStore;
import com.flagship.coin_ledger.notification.NotificationEmitter;
import com.flagship.coin_ledger.notification.NotificationKind;
import com.flagship.coin_ledger.observability.CorrelationContext;
import com.flagship.coin_ledger.observability.LedgerMetrics;
import com.flagship.coin_ledger.outbox.OutboxService;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import com.flagship.coin_ledger.subject.SubjectKind;
import com.flagship.coin_ledger.subject.SubjectPersistenceService;
import com.flagship.coin_ledger.subject.SubjectStatus;
import com.flagship.coin_ledger.subject.TargetResponse;
import com.flagship.coin_ledger.subject.event.ConnectionAnsweredEvent;
import com.flagship.coin_ledger.subject.event.SubjectCancelledEvent;
import com.flagship.coin_ledger.subject.event.SubjectDecidedEvent;
import com.flagship.coin_ledger.subject.event.SubjectSubmittedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * State machine for every moderated subject kind.
 *
 * Each operation is one transaction that starts by locking the subject row, so
 * concurrent transitions on the same subject are serialized and the loser sees the
 * winner's result (typically AlreadyDecided). Ledger side effects (refund, top-up
 * credit) lock the owner's account afterwards, keeping lock order subject -> account.
 *
 * Audit records and subject events go through the outbox in the same transaction;
 * notifications are stored after commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalWorkflow {

    private final SubjectPersistenceService subjectPersistence;
    private final RefundPolicy refundPolicy;
    private final LedgerStore ledgerStore;
    private final AuditEmitter auditEmitter;
    private final OutboxService outboxService;
    private final NotificationEmitter notificationEmitter;
    private final CoinSettings settings;
    private final LedgerMetrics metrics;

    /**
     * Applies an admin decision.
     *
     * @throws SubjectNotFoundException if the subject does not exist
     * @throws AlreadyDecidedException if the kind's transition table does not allow the move
     */
    @Transactional
    public ModeratedSubject decide(UUID subjectId, SubjectStatus outcome, UUID adminId, String note) {
        if (outcome != SubjectStatus.APPROVED && outcome != SubjectStatus.REJECTED) {
            throw new IllegalArgumentException("Decision must be APPROVED or REJECTED, got " + outcome);
        }
        long start = System.currentTimeMillis();
        CorrelationContext.putSubject(subjectId);

        ModeratedSubject current = subjectPersistence.lockForUpdate(subjectId);
        ModeratedSubject next = current.decide(outcome, adminId, note);

        long credited = 0;
        if (outcome == SubjectStatus.APPROVED) {
            if (current.getKind() == SubjectKind.TOPUP_REQUEST) {
                credited = creditTopup(current);
                next = next.toBuilder().computedCoins(credited).build();
            } else if (current.getKind() == SubjectKind.CONNECTION_REQUEST && !settings.isRequireTargetAccept()) {
                next = next.toBuilder().targetResponse(TargetResponse.ACCEPTED).build();
            }
        }

        ModeratedSubject saved = subjectPersistence.applyTransition(next);

        long refunded = 0;
        if (outcome == SubjectStatus.REJECTED && current.getKind().isCoinBearing()) {
            refunded = refundPolicy.apply(saved).map(LedgerEntry::getDelta).orElse(0L);
            saved = reload(subjectId);
        }

        auditEmitter.record(adminId, AuditAction.forDecision(saved.getKind(), outcome),
            saved.getKind().auditEntity(), subjectId,
            AuditEmitter.meta("note", note, "coins", credited > 0 ? credited : null,
                "refunded", refunded > 0 ? refunded : null, "previousStatus", current.getStatus().name()));
        outboxService.saveEvent(OutboxService.AGGREGATE_SUBJECT, subjectId, SubjectDecidedEvent.EVENT_TYPE,
            SubjectDecidedEvent.from(saved, refunded, credited));

        notifyDecision(saved, note, credited, refunded);

        metrics.recordDecision(saved.getKind().name(), outcome.name());
        metrics.recordLatency("decide", System.currentTimeMillis() - start);
        log.info("Subject decided: kind={}, outcome={}, admin={}, refunded={}, credited={}",
                saved.getKind(), outcome, adminId, refunded, credited);
        return saved;
    }

    /**
     * Withdraws a pending subject on behalf of its owner. Refunds like a rejection.
     *
     * @throws SubjectNotFoundException if the subject does not exist
     * @throws NotOwnerException if the requester does not own the subject
     * @throws NotEligibleException if the kind cannot be cancelled
     * @throws AlreadyDecidedException if the subject is no longer PENDING
     */
    @Transactional
    public ModeratedSubject cancel(UUID subjectId, UUID requesterId) {
        CorrelationContext.putSubject(subjectId);

        ModeratedSubject current = subjectPersistence.lockForUpdate(subjectId);
        if (!current.isOwnedBy(requesterId)) {
            throw new NotOwnerException(subjectId, requesterId);
        }
        ModeratedSubject saved = subjectPersistence.applyTransition(current.cancel());

        long refunded = refundPolicy.apply(saved).map(LedgerEntry::getDelta).orElse(0L);
        saved = reload(subjectId);

        auditEmitter.record(requesterId, AuditAction.forCancel(saved.getKind()),
            saved.getKind().auditEntity(), subjectId,
            AuditEmitter.meta("refunded", refunded > 0 ? refunded : null));
        outboxService.saveEvent(OutboxService.AGGREGATE_SUBJECT, subjectId, SubjectCancelledEvent.EVENT_TYPE,
            SubjectCancelledEvent.from(saved, refunded));
        notificationEmitter.emit(saved.getOwnerAccountId(), NotificationKind.CONNECTION_CANCELLED,
            AuditEmitter.meta("subjectId", subjectId, "refunded", refunded));

        metrics.recordDecision(saved.getKind().name(), SubjectStatus.CANCELLED.name());
        log.info("Subject cancelled: kind={}, requester={}, refunded={}", saved.getKind(), requesterId, refunded);
        return saved;
    }

    /**
     * Replaces a profile's content. Any edit sends the profile back to PENDING,
     * whatever its previous decision.
     */
    @Transactional
    public ModeratedSubject resubmitProfile(UUID accountId, String displayName, String bio) {
        CorrelationContext.putAccount(accountId);

        ModeratedSubject current = subjectPersistence.lockForUpdate(accountId);
        ModeratedSubject saved = subjectPersistence.applyTransition(current.resubmit(displayName, bio));

        outboxService.saveEvent(OutboxService.AGGREGATE_SUBJECT, saved.getId(), SubjectSubmittedEvent.EVENT_TYPE,
            SubjectSubmittedEvent.from(saved));
        notificationEmitter.emit(accountId, NotificationKind.PROFILE_SUBMITTED,
            AuditEmitter.meta("subjectId", accountId, "previousStatus", current.getStatus().name()));

        log.info("Profile resubmitted: accountId={}, previousStatus={}", accountId, current.getStatus());
        return saved;
    }

    /**
     * The target's answer to an approved connection request.
     *
     * @throws NotOwnerException if the caller is not the request's target
     * @throws NotEligibleException if the request is not APPROVED or was already answered
     */
    @Transactional
    public ModeratedSubject respondToConnection(UUID subjectId, UUID targetAccountId, boolean accept) {
        CorrelationContext.putSubject(subjectId);

        ModeratedSubject current = subjectPersistence.lockForUpdate(subjectId);
        if (current.getKind() != SubjectKind.CONNECTION_REQUEST) {
            throw new NotEligibleException(current.getKind() + " cannot be answered");
        }
        if (!targetAccountId.equals(current.getTargetAccountId())) {
            throw new NotOwnerException(subjectId, targetAccountId);
        }

        TargetResponse response = accept ? TargetResponse.ACCEPTED : TargetResponse.DECLINED;
        ModeratedSubject saved = subjectPersistence.applyTransition(current.respond(response));

        outboxService.saveEvent(OutboxService.AGGREGATE_SUBJECT, subjectId, ConnectionAnsweredEvent.EVENT_TYPE,
            ConnectionAnsweredEvent.from(saved));
        notificationEmitter.emit(saved.getOwnerAccountId(),
            accept ? NotificationKind.CONNECTION_ACCEPTED : NotificationKind.CONNECTION_DECLINED,
            AuditEmitter.meta("subjectId", subjectId, "targetAccountId", targetAccountId));

        log.info("Connection request answered: subjectId={}, response={}", subjectId, response);
        return saved;
    }

    private long creditTopup(ModeratedSubject topup) {
        long coins = topup.coinsForTopup();
        if (coins <= 0) {
            log.warn("Approved top-up {} converts to 0 coins (amount={}, pricePerCoin={}), nothing credited",
                    topup.getId(), topup.getAmountMvr(), topup.getPricePerCoin());
            return 0;
        }
        ledgerStore.append(topup.getOwnerAccountId(), coins, LedgerReason.TOPUP,
            topup.getKind().referenceKind(), topup.getId(),
            "Coin topup approved - MVR " + topup.getAmountMvr().toPlainString());
        return coins;
    }

    private void notifyDecision(ModeratedSubject subject, String note, long credited, long refunded) {
        notificationEmitter.emit(subject.getOwnerAccountId(),
            NotificationKind.forDecision(subject.getKind(), subject.getStatus()),
            AuditEmitter.meta("subjectId", subject.getId(), "note", note,
                "coins", credited > 0 ? credited : null, "refunded", refunded > 0 ? refunded : null));

        if (subject.getKind() == SubjectKind.CONNECTION_REQUEST && subject.getStatus() == SubjectStatus.APPROVED) {
            notificationEmitter.emit(subject.getTargetAccountId(), NotificationKind.CONNECTION_REQUEST_RECEIVED,
                AuditEmitter.meta("subjectId", subject.getId(), "fromAccountId", subject.getOwnerAccountId(),
                    "awaitingResponse", subject.getTargetResponse() == null));
        }
    }

    private ModeratedSubject reload(UUID subjectId) {
        return subjectPersistence.findById(subjectId).orElseThrow(() -> new SubjectNotFoundException(subjectId));
    }
}
