package com.flagship.coin_ledger.gate;

import com.flagship.coin_ledger.exception.DomainEffectFailedException;
import com.flagship.coin_ledger.observability.LedgerMetrics;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import com.flagship.coin_ledger.subject.SubjectKind;
import com.flagship.coin_ledger.subject.SubjectPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency keys for the subject-creating endpoints.
 *
 * Strategy:
 * 1. Try Redis first (fast, may be unavailable or not configured)
 * 2. Fall back to the subjects table, which stores the key in a unique column
 * 3. Cache database hits in Redis for later lookups
 *
 * Redis is only ever a hint: an id found there is confirmed against the database,
 * so a key cached by a transaction that later rolled back is ignored.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:subject:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);
    static final int MAX_KEY_LENGTH = 128;

    private final SubjectPersistenceService subjectPersistence;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final LedgerMetrics metrics;

    public IdempotencyService(SubjectPersistenceService subjectPersistence,
                              Optional<StringRedisTemplate> redisTemplate,
                              LedgerMetrics metrics) {
        this.subjectPersistence = subjectPersistence;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
    }

    /**
     * Returns the subject already created under this key by this owner, if any.
     *
     * @throws DomainEffectFailedException if the key was used by another owner or for another kind
     */
    public Optional<ModeratedSubject> findExisting(String idempotencyKey, UUID ownerAccountId, SubjectKind kind) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Optional.empty();
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("Idempotency-Key must be at most " + MAX_KEY_LENGTH + " characters");
        }

        Optional<ModeratedSubject> existing = lookupRedis(idempotencyKey)
            .flatMap(subjectPersistence::findById)
            .or(() -> subjectPersistence.findByIdempotencyKey(idempotencyKey));

        if (existing.isEmpty()) {
            metrics.recordIdempotencyMiss();
            return Optional.empty();
        }

        ModeratedSubject subject = existing.get();
        if (!subject.isOwnedBy(ownerAccountId) || subject.getKind() != kind) {
            throw new DomainEffectFailedException("Idempotency key already used for a different request");
        }
        metrics.recordIdempotencyHit();
        remember(idempotencyKey, subject.getId());
        log.info("Idempotency key already used, returning existing subject {}", subject.getId());
        return existing;
    }

    /**
     * Caches key -> subject id in Redis. Best effort; the database column is the source of truth.
     */
    public void remember(String idempotencyKey, UUID subjectId) {
        if (idempotencyKey == null || idempotencyKey.isBlank() || redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, subjectId.toString(), REDIS_TTL);
        } catch (DataAccessException e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }

    private Optional<UUID> lookupRedis(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            return Optional.ofNullable(cached).map(UUID::fromString);
        } catch (DataAccessException e) {
            log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }
}
