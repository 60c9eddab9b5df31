package com.flagship.coin_ledger.gate;

import com.flagship.coin_ledger.account.AccountService;
import com.flagship.coin_ledger.config.CoinSettings;
import com.flagship.coin_ledger.exception.DomainEffectFailedException;
import com.flagship.coin_ledger.exception.InvalidTargetException;
import com.flagship.coin_ledger.ledger.LedgerStore;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import com.flagship.coin_ledger.subject.SubjectKind;
import com.flagship.coin_ledger.subject.SubjectPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * The user-facing coin actions, each one a single call through {@link ActionGate}.
 * Costs and the coin price come from {@link CoinSettings}, never from the request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CoinActionService {

    private final ActionGate actionGate;
    private final SubjectPersistenceService subjectPersistence;
    private final AccountService accountService;
    private final IdempotencyService idempotencyService;
    private final LedgerStore ledgerStore;
    private final CoinSettings settings;

    @Transactional
    public ModeratedSubject createPost(UUID actorId, String title, String body, String idempotencyKey) {
        Optional<ModeratedSubject> existing = replay(idempotencyKey, actorId, SubjectKind.POST);
        if (existing.isPresent()) {
            return existing.get();
        }

        long cost = settings.getCostPost();
        ModeratedSubject post = actionGate.attempt(actorId, ActionKind.POST, cost,
            subjectId -> subjectPersistence.insert(
                ModeratedSubject.post(subjectId, actorId, cost, title, body), idempotencyKey));

        idempotencyService.remember(idempotencyKey, post.getId());
        return post;
    }

    /**
     * @throws InvalidTargetException for a self-request, an unknown target, or a related post
     *                                that is not the target's
     * @throws DomainEffectFailedException if a PENDING or APPROVED request to the target already exists
     */
    @Transactional
    public ModeratedSubject requestConnection(UUID actorId, UUID targetAccountId, UUID relatedPostId,
                                              String idempotencyKey) {
        if (targetAccountId == null || targetAccountId.equals(actorId)) {
            throw new InvalidTargetException("Cannot send a connection request to yourself");
        }
        if (!accountService.exists(targetAccountId)) {
            throw new InvalidTargetException("Target account not found: " + targetAccountId);
        }
        if (relatedPostId != null) {
            checkRelatedPost(relatedPostId, targetAccountId);
        }

        Optional<ModeratedSubject> existing = replay(idempotencyKey, actorId, SubjectKind.CONNECTION_REQUEST);
        if (existing.isPresent()) {
            return existing.get();
        }

        long cost = settings.getCostConnect();
        ModeratedSubject request = actionGate.attempt(actorId, ActionKind.CONNECT, cost, subjectId -> {
            // Checked under the actor's account lock, so two racing requests cannot both pass.
            if (subjectPersistence.hasOpenConnectionRequest(actorId, targetAccountId)) {
                throw new DomainEffectFailedException("Connection request already sent to " + targetAccountId);
            }
            return subjectPersistence.insert(
                ModeratedSubject.connectionRequest(subjectId, actorId, cost, targetAccountId, relatedPostId),
                idempotencyKey);
        });

        idempotencyService.remember(idempotencyKey, request.getId());
        return request;
    }

    /**
     * Free to submit. The current coin price is captured on the request so a later
     * price change does not alter what an approval credits.
     */
    @Transactional
    public ModeratedSubject requestTopup(UUID actorId, BigDecimal amountMvr, String slipPath, String idempotencyKey) {
        if (amountMvr == null || amountMvr.signum() <= 0) {
            throw new IllegalArgumentException("Top-up amount must be positive");
        }
        if (slipPath == null || slipPath.isBlank()) {
            throw new IllegalArgumentException("Payment slip is required");
        }
        if (slipPath.length() > ModeratedSubject.MAX_SLIP_PATH_LENGTH) {
            throw new IllegalArgumentException(
                "Payment slip path must be at most " + ModeratedSubject.MAX_SLIP_PATH_LENGTH + " characters");
        }

        Optional<ModeratedSubject> existing = replay(idempotencyKey, actorId, SubjectKind.TOPUP_REQUEST);
        if (existing.isPresent()) {
            return existing.get();
        }

        BigDecimal pricePerCoin = settings.getCoinPriceMvr();
        ModeratedSubject topup = actionGate.attempt(actorId, ActionKind.TOPUP, 0L,
            subjectId -> subjectPersistence.insert(
                ModeratedSubject.topupRequest(subjectId, actorId, amountMvr, pricePerCoin, slipPath),
                idempotencyKey));

        idempotencyService.remember(idempotencyKey, topup.getId());
        return topup;
    }

    /**
     * Looks up a keyed request under the actor's account lock. A second request with the
     * same key waits for the first to commit and then finds its subject.
     */
    private Optional<ModeratedSubject> replay(String idempotencyKey, UUID actorId, SubjectKind kind) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Optional.empty();
        }
        ledgerStore.lockAccount(actorId);
        return idempotencyService.findExisting(idempotencyKey, actorId, kind);
    }

    private void checkRelatedPost(UUID relatedPostId, UUID targetAccountId) {
        ModeratedSubject post = subjectPersistence.findById(relatedPostId)
            .filter(subject -> subject.getKind() == SubjectKind.POST)
            .orElseThrow(() -> new InvalidTargetException("Related post not found: " + relatedPostId));
        if (!post.isOwnedBy(targetAccountId)) {
            throw new InvalidTargetException("Related post " + relatedPostId + " does not belong to the target");
        }
    }
}
