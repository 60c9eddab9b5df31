package com.flagship.coin_ledger.subject;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for moderated subjects of every kind.
 */
@Repository
public interface ModeratedSubjectRepository extends JpaRepository<ModeratedSubjectEntity, UUID> {

    /**
     * Loads a subject with a row lock held until the transaction ends.
     * Every state transition goes through here, so transitions on one subject are serialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT s FROM ModeratedSubjectEntity s WHERE s.id = :id")
    Optional<ModeratedSubjectEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<ModeratedSubjectEntity> findByIdempotencyKey(String idempotencyKey);

    Page<ModeratedSubjectEntity> findByKindAndStatusOrderByCreatedAtAsc(SubjectKind kind, SubjectStatus status,
                                                                       Pageable pageable);

    Page<ModeratedSubjectEntity> findByKindOrderByCreatedAtDesc(SubjectKind kind, Pageable pageable);

    List<ModeratedSubjectEntity> findByOwnerAccountIdAndKindOrderByCreatedAtDesc(UUID ownerAccountId, SubjectKind kind);

    List<ModeratedSubjectEntity> findByTargetAccountIdAndKindOrderByCreatedAtDesc(UUID targetAccountId, SubjectKind kind);

    /**
     * Whether the owner already has an open or accepted request of this kind towards the target.
     */
    @Query("SELECT CASE WHEN COUNT(s) > 0 THEN true ELSE false END FROM ModeratedSubjectEntity s " +
           "WHERE s.ownerAccountId = :owner AND s.targetAccountId = :target AND s.kind = :kind " +
           "AND s.status IN :statuses")
    boolean existsOpenRequest(@Param("owner") UUID ownerAccountId,
                              @Param("target") UUID targetAccountId,
                              @Param("kind") SubjectKind kind,
                              @Param("statuses") Collection<SubjectStatus> statuses);
}
