package com.flagship.coin_ledger.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "notifications")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class NotificationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 64)
    private NotificationKind kind;

    @Column(length = 4000, updatable = false)
    private String payload;

    @Column(nullable = false)
    private boolean seen;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static NotificationEntity create(UUID accountId, NotificationKind kind, String payload) {
        NotificationEntity entity = new NotificationEntity();
        entity.id = UUID.randomUUID();
        entity.accountId = accountId;
        entity.kind = kind;
        entity.payload = payload;
        entity.seen = false;
        return entity;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    void markSeen() {
        this.seen = true;
    }

    public Notification toDomain() {
        return new Notification(id, accountId, kind, payload, seen, createdAt);
    }
}
