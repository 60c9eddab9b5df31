package com.flagship.coin_ledger.notification;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface NotificationRepository extends JpaRepository<NotificationEntity, UUID> {

    List<NotificationEntity> findByAccountIdOrderByCreatedAtDesc(UUID accountId, Pageable pageable);

    List<NotificationEntity> findByAccountIdAndKindOrderByCreatedAtDesc(UUID accountId, NotificationKind kind);

    long countByAccountIdAndSeenFalse(UUID accountId);
}
