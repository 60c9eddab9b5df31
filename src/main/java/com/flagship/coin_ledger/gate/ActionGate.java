package com.flagship.coin_ledger.gate;

import com.flagship.coin_ledger.exception.DomainEffectFailedException;
import com.flagship.coin_ledger.exception.InsufficientBalanceException;
import com.flagship.coin_ledger.exception.NotEligibleException;
import com.flagship.coin_ledger.ledger.LedgerStore;
import com.flagship.coin_ledger.notification.NotificationEmitter;
import com.flagship.coin_ledger.notification.NotificationKind;
import com.flagship.coin_ledger.observability.CorrelationContext;
import com.flagship.coin_ledger.observability.LedgerMetrics;
import com.flagship.coin_ledger.outbox.OutboxService;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import com.flagship.coin_ledger.subject.SubjectPersistenceService;
import com.flagship.coin_ledger.subject.SubjectStatus;
import com.flagship.coin_ledger.subject.event.SubjectSubmittedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Single entry point for coin-consuming actions.
 *
 * One call is one atomic unit:
 * 1. Lock the actor's account row (serializes all of the actor's coin activity)
 * 2. Check eligibility: POST and CONNECT need an APPROVED profile
 * 3. Check balance >= cost
 * 4. Append the debit, referencing the pre-allocated subject id
 * 5. Run the domain effect (insert the PENDING subject, flushed immediately)
 * 6. Write SubjectSubmitted to the outbox
 * 7. Notify the actor (stored after commit)
 *
 * If any step fails the whole unit rolls back: no debit without its subject,
 * no subject without its debit. The gate never locks an existing subject, so
 * lock order stays subject -> account everywhere.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionGate {

    private final LedgerStore ledgerStore;
    private final SubjectPersistenceService subjectPersistence;
    private final OutboxService outboxService;
    private final NotificationEmitter notificationEmitter;
    private final LedgerMetrics metrics;

    /**
     * @param cost coins to debit; 0 skips the debit
     * @throws com.flagship.coin_ledger.exception.AccountNotFoundException if the actor does not exist
     * @throws NotEligibleException if the action needs an approved profile and the actor has none
     * @throws InsufficientBalanceException if the balance is below cost
     * @throws DomainEffectFailedException if the effect fails; the debit is rolled back with it
     */
    @Transactional
    public ModeratedSubject attempt(UUID accountId, ActionKind action, long cost, DomainEffect effect) {
        if (cost < 0) {
            throw new IllegalArgumentException("Cost must not be negative: " + cost);
        }
        long start = System.currentTimeMillis();
        CorrelationContext.putAccount(accountId);

        ledgerStore.lockAccount(accountId);

        if (action.requiresApprovedProfile()) {
            checkProfileApproved(accountId, action);
        }

        long balance = ledgerStore.balanceOf(accountId);
        if (balance < cost) {
            metrics.recordGateAttempt(action.name(), "insufficient_balance");
            throw new InsufficientBalanceException(accountId, balance, cost);
        }

        UUID subjectId = UUID.randomUUID();
        if (cost > 0) {
            ledgerStore.append(accountId, -cost, action.debitReason(),
                action.subjectKind().referenceKind(), subjectId,
                action.subjectKind().name().toLowerCase() + " submitted");
        }

        ModeratedSubject subject = runEffect(action, subjectId, effect);

        outboxService.saveEvent(OutboxService.AGGREGATE_SUBJECT, subject.getId(),
            SubjectSubmittedEvent.EVENT_TYPE, SubjectSubmittedEvent.from(subject));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("subjectId", subject.getId());
        payload.put("coins", cost);
        payload.put("balance", balance - cost);
        notificationEmitter.emit(accountId, NotificationKind.forSubmission(subject.getKind()), payload);

        metrics.recordGateAttempt(action.name(), "success");
        metrics.recordLatency("attempt_" + action.name(), System.currentTimeMillis() - start);
        log.info("Action accepted: action={}, subjectId={}, cost={}, balanceBefore={}",
                action, subjectId, cost, balance);
        return subject;
    }

    private void checkProfileApproved(UUID accountId, ActionKind action) {
        // The profile subject shares its id with the account.
        SubjectStatus profileStatus = subjectPersistence.findById(accountId)
            .map(ModeratedSubject::getStatus)
            .orElse(null);
        if (profileStatus != SubjectStatus.APPROVED) {
            metrics.recordGateAttempt(action.name(), "not_eligible");
            throw new NotEligibleException(
                "Your profile must be approved before you can perform " + action
                    + " (profile status: " + profileStatus + ")");
        }
    }

    private ModeratedSubject runEffect(ActionKind action, UUID subjectId, DomainEffect effect) {
        ModeratedSubject subject;
        try {
            subject = effect.apply(subjectId);
        } catch (DomainEffectFailedException e) {
            metrics.recordGateAttempt(action.name(), "domain_effect_failed");
            throw e;
        } catch (RuntimeException e) {
            metrics.recordGateAttempt(action.name(), "domain_effect_failed");
            log.warn("Domain effect failed, rolling back: action={}, subjectId={}, error={}",
                    action, subjectId, e.getMessage());
            throw new DomainEffectFailedException("Could not record " + action + ": " + e.getMessage(), e);
        }
        if (subject == null || !subjectId.equals(subject.getId())) {
            metrics.recordGateAttempt(action.name(), "domain_effect_failed");
            throw new DomainEffectFailedException("Domain effect did not create subject " + subjectId);
        }
        return subject;
    }
}
