package com.flagship.coin_ledger.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.coin_ledger.exception.NotOwnerException;
import com.flagship.coin_ledger.exception.NotificationNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    static final int MAX_PAGE_SIZE = 100;

    private final NotificationRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Always runs in its own transaction: called after the emitting transaction
     * has already committed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Notification store(UUID accountId, NotificationKind kind, Map<String, Object> payload) {
        NotificationEntity saved = repository.save(NotificationEntity.create(accountId, kind, toJson(payload)));
        log.debug("Stored notification {} for account {}: {}", saved.getId(), accountId, kind);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public List<Notification> list(UUID accountId, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        return repository.findByAccountIdOrderByCreatedAtDesc(accountId, PageRequest.of(0, size)).stream()
            .map(NotificationEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Notification> listOfKind(UUID accountId, NotificationKind kind) {
        return repository.findByAccountIdAndKindOrderByCreatedAtDesc(accountId, kind).stream()
            .map(NotificationEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnseen(UUID accountId) {
        return repository.countByAccountIdAndSeenFalse(accountId);
    }

    @Transactional
    public Notification markSeen(UUID notificationId, UUID accountId) {
        NotificationEntity entity = repository.findById(notificationId)
            .orElseThrow(() -> new NotificationNotFoundException(notificationId));
        if (!entity.getAccountId().equals(accountId)) {
            throw new NotOwnerException(notificationId, accountId);
        }
        entity.markSeen();
        return repository.save(entity).toDomain();
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload != null ? payload : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize notification payload", e);
        }
    }
}
