package com.flagship.coin_ledger.notification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.coin_ledger.account.Actor;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping
    public ResponseEntity<List<NotificationResponse>> list(@RequestHeader(Actor.HEADER) UUID actorId,
                                                           @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return ResponseEntity.ok(notificationService.list(actorId, limit).stream()
            .map(NotificationResponse::from)
            .toList());
    }

    @PatchMapping("/{id}/seen")
    public ResponseEntity<NotificationResponse> markSeen(@RequestHeader(Actor.HEADER) UUID actorId,
                                                         @PathVariable("id") UUID notificationId) {
        return ResponseEntity.ok(NotificationResponse.from(notificationService.markSeen(notificationId, actorId)));
    }

    /**
     * The payload is passed through as the stored JSON string.
     */
    @Value
    public static class NotificationResponse {
        @JsonProperty("id")
        UUID id;

        @JsonProperty("kind")
        NotificationKind kind;

        @JsonProperty("payload")
        String payload;

        @JsonProperty("seen")
        boolean seen;

        @JsonProperty("created_at")
        Instant createdAt;

        static NotificationResponse from(Notification notification) {
            return new NotificationResponse(notification.getId(), notification.getKind(),
                notification.getPayload(), notification.isSeen(), notification.getCreatedAt());
        }
    }
}
