package com.flagship.coin_ledger.subject;

import com.flagship.coin_ledger.exception.AlreadyDecidedException;
import com.flagship.coin_ledger.exception.NotEligibleException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * A user-originated object awaiting or having received an admin decision.
 *
 * One shape for all four kinds; variant fields that do not apply to a kind are null:
 * <ul>
 *   <li>USER_PROFILE: title is the display name, body the bio. The id equals the owner's account id.</li>
 *   <li>POST: title and body.</li>
 *   <li>CONNECTION_REQUEST: targetAccountId, optional relatedPostId, targetResponse once answered.</li>
 *   <li>TOPUP_REQUEST: amountMvr, pricePerCoin captured at request time, slipPath, computedCoins once approved.</li>
 * </ul>
 *
 * Transitions return a new instance; the kind's table decides what is legal.
 */
@Value
@Builder(toBuilder = true)
public class ModeratedSubject {

    public static final int MAX_NOTE_LENGTH = 1000;
    public static final int MAX_SLIP_PATH_LENGTH = 255;
    UUID id;
    SubjectKind kind;
    UUID ownerAccountId;
    SubjectStatus status;
    long coinCost;
    boolean refundApplied;

    String title;
    String body;

    UUID targetAccountId;
    UUID relatedPostId;
    TargetResponse targetResponse;

    BigDecimal amountMvr;
    BigDecimal pricePerCoin;
    String slipPath;
    Long computedCoins;

    String adminNote;
    UUID decidedBy;
    Instant decidedAt;
    Instant createdAt;
    Instant updatedAt;

    public static ModeratedSubject profile(UUID accountId, String displayName, String bio) {
        return pending(accountId, SubjectKind.USER_PROFILE, accountId, 0)
            .title(displayName)
            .body(bio)
            .build();
    }

    public static ModeratedSubject post(UUID id, UUID ownerAccountId, long coinCost, String title, String body) {
        return pending(id, SubjectKind.POST, ownerAccountId, coinCost)
            .title(title)
            .body(body)
            .build();
    }

    public static ModeratedSubject connectionRequest(UUID id, UUID ownerAccountId, long coinCost,
                                                     UUID targetAccountId, UUID relatedPostId) {
        return pending(id, SubjectKind.CONNECTION_REQUEST, ownerAccountId, coinCost)
            .targetAccountId(targetAccountId)
            .relatedPostId(relatedPostId)
            .build();
    }

    public static ModeratedSubject topupRequest(UUID id, UUID ownerAccountId, BigDecimal amountMvr,
                                                BigDecimal pricePerCoin, String slipPath) {
        return pending(id, SubjectKind.TOPUP_REQUEST, ownerAccountId, 0)
            .amountMvr(amountMvr)
            .pricePerCoin(pricePerCoin)
            .slipPath(slipPath)
            .build();
    }

    private static ModeratedSubjectBuilder pending(UUID id, SubjectKind kind, UUID ownerAccountId, long coinCost) {
        Instant now = Instant.now();
        return ModeratedSubject.builder()
            .id(id)
            .kind(kind)
            .ownerAccountId(ownerAccountId)
            .status(SubjectStatus.PENDING)
            .coinCost(coinCost)
            .refundApplied(false)
            .createdAt(now)
            .updatedAt(now);
    }

    /**
     * Applies an admin decision.
     *
     * @throws AlreadyDecidedException if the kind's table does not allow the move
     */
    public ModeratedSubject decide(SubjectStatus outcome, UUID adminId, String note) {
        if (note != null && note.length() > MAX_NOTE_LENGTH) {
            throw new IllegalArgumentException("Note must be at most " + MAX_NOTE_LENGTH + " characters");
        }
        if (!kind.allowsDecision(status, outcome)) {
            throw new AlreadyDecidedException(
                String.format("%s %s is %s and cannot become %s", kind, id, status, outcome));
        }
        Instant now = Instant.now();
        return toBuilder()
            .status(outcome)
            .decidedBy(adminId)
            .decidedAt(now)
            .adminNote(note)
            .updatedAt(now)
            .build();
    }

    /**
     * Withdraws a pending subject. Ownership is checked by the caller.
     *
     * @throws NotEligibleException if the kind has no CANCELLED state
     * @throws AlreadyDecidedException if the subject is no longer PENDING
     */
    public ModeratedSubject cancel() {
        if (!kind.allowsCancel()) {
            throw new NotEligibleException(kind + " cannot be cancelled");
        }
        if (status != SubjectStatus.PENDING) {
            throw new AlreadyDecidedException(
                String.format("%s %s is %s and cannot be cancelled", kind, id, status));
        }
        return toBuilder()
            .status(SubjectStatus.CANCELLED)
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * Replaces the content of a profile and sends it back to moderation.
     * The previous decision is cleared.
     *
     * @throws NotEligibleException if the kind does not support resubmission
     * @throws AlreadyDecidedException if the subject was cancelled
     */
    public ModeratedSubject resubmit(String newTitle, String newBody) {
        if (!kind.allowsResubmit()) {
            throw new NotEligibleException(kind + " cannot be resubmitted");
        }
        if (status == SubjectStatus.CANCELLED) {
            throw new AlreadyDecidedException(kind + " " + id + " is CANCELLED");
        }
        return toBuilder()
            .title(newTitle)
            .body(newBody)
            .status(SubjectStatus.PENDING)
            .decidedBy(null)
            .decidedAt(null)
            .adminNote(null)
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * Records the target's answer to an approved connection request.
     *
     * @throws NotEligibleException unless this is an APPROVED, unanswered connection request
     */
    public ModeratedSubject respond(TargetResponse response) {
        if (kind != SubjectKind.CONNECTION_REQUEST) {
            throw new NotEligibleException(kind + " cannot be answered");
        }
        if (status != SubjectStatus.APPROVED) {
            throw new NotEligibleException("Connection request " + id + " is " + status + ", not APPROVED");
        }
        if (targetResponse != null) {
            throw new NotEligibleException("Connection request " + id + " was already answered: " + targetResponse);
        }
        return toBuilder()
            .targetResponse(response)
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * Coins granted by an approved top-up: floor(amountMvr / pricePerCoin).
     */
    public long coinsForTopup() {
        if (kind != SubjectKind.TOPUP_REQUEST || amountMvr == null || pricePerCoin == null
                || pricePerCoin.signum() <= 0) {
            return 0L;
        }
        return amountMvr.divide(pricePerCoin, 0, RoundingMode.FLOOR).longValueExact();
    }

    public boolean isPending() {
        return status == SubjectStatus.PENDING;
    }

    public boolean isOwnedBy(UUID accountId) {
        return ownerAccountId.equals(accountId);
    }

    /**
     * Whether a refund is still owed if this subject ends REJECTED or CANCELLED.
     */
    public boolean isRefundable() {
        return coinCost > 0 && !refundApplied;
    }
}
