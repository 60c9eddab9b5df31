package com.flagship.coin_ledger.subject;

import com.flagship.coin_ledger.exception.SubjectNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the domain layer (ModeratedSubject) and the persistence layer (ModeratedSubjectEntity).
 *
 * Writes that change an existing subject require a surrounding transaction that has already
 * locked the row through {@link #lockForUpdate(UUID)}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubjectPersistenceService {

    private final ModeratedSubjectRepository repository;

    /**
     * Inserts a new subject and flushes immediately, so constraint violations surface
     * inside the caller's atomic unit instead of at commit.
     */
    @Transactional
    public ModeratedSubject insert(ModeratedSubject subject, String idempotencyKey) {
        ModeratedSubjectEntity saved = repository.saveAndFlush(
            ModeratedSubjectEntity.fromDomain(subject, idempotencyKey));
        log.debug("Inserted {} {} for owner {}", saved.getKind(), saved.getId(), saved.getOwnerAccountId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<ModeratedSubject> findById(UUID subjectId) {
        return repository.findById(subjectId).map(ModeratedSubjectEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<ModeratedSubject> findByIdempotencyKey(String idempotencyKey) {
        return repository.findByIdempotencyKey(idempotencyKey).map(ModeratedSubjectEntity::toDomain);
    }

    /**
     * Locks the subject row for the rest of the current transaction.
     *
     * @throws SubjectNotFoundException if there is no such subject
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ModeratedSubject lockForUpdate(UUID subjectId) {
        return repository.findByIdForUpdate(subjectId)
            .map(ModeratedSubjectEntity::toDomain)
            .orElseThrow(() -> new SubjectNotFoundException(subjectId));
    }

    /**
     * Persists a transition computed on the domain object.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ModeratedSubject applyTransition(ModeratedSubject next) {
        ModeratedSubjectEntity entity = repository.findById(next.getId())
            .orElseThrow(() -> new SubjectNotFoundException(next.getId()));
        entity.updateFromDomain(next);
        ModeratedSubjectEntity saved = repository.saveAndFlush(entity);
        log.debug("Subject {} {} is now {}", saved.getKind(), saved.getId(), saved.getStatus());
        return saved.toDomain();
    }

    /**
     * Sets the refund guard on a locked subject.
     *
     * @throws IllegalStateException if the guard is already set
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ModeratedSubject markRefundApplied(UUID subjectId) {
        ModeratedSubjectEntity entity = repository.findById(subjectId)
            .orElseThrow(() -> new SubjectNotFoundException(subjectId));
        entity.markRefundApplied();
        return repository.saveAndFlush(entity).toDomain();
    }

    /**
     * Whether the owner already has a PENDING or APPROVED connection request towards the target.
     */
    @Transactional(readOnly = true)
    public boolean hasOpenConnectionRequest(UUID ownerAccountId, UUID targetAccountId) {
        return repository.existsOpenRequest(ownerAccountId, targetAccountId, SubjectKind.CONNECTION_REQUEST,
            EnumSet.of(SubjectStatus.PENDING, SubjectStatus.APPROVED));
    }

    @Transactional(readOnly = true)
    public List<ModeratedSubject> findOwned(UUID ownerAccountId, SubjectKind kind) {
        return repository.findByOwnerAccountIdAndKindOrderByCreatedAtDesc(ownerAccountId, kind).stream()
            .map(ModeratedSubjectEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<ModeratedSubject> findTargeting(UUID targetAccountId, SubjectKind kind) {
        return repository.findByTargetAccountIdAndKindOrderByCreatedAtDesc(targetAccountId, kind).stream()
            .map(ModeratedSubjectEntity::toDomain)
            .toList();
    }

    /**
     * Moderation queue. With a status the oldest come first (work order); without one,
     * everything of the kind, newest first.
     */
    @Transactional(readOnly = true)
    public Page<ModeratedSubject> queue(SubjectKind kind, SubjectStatus status, int page, int size) {
        PageRequest pageRequest = PageRequest.of(Math.max(page, 0), Math.max(1, Math.min(size, 100)));
        Page<ModeratedSubjectEntity> entities = status != null
            ? repository.findByKindAndStatusOrderByCreatedAtAsc(kind, status, pageRequest)
            : repository.findByKindOrderByCreatedAtDesc(kind, pageRequest);
        return entities.map(ModeratedSubjectEntity::toDomain);
    }
}
