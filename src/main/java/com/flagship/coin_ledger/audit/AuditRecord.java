package com.flagship.coin_ledger.audit;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Who did what to which entity. adminId is the acting account; for a
 * cancellation that is the requester, not an admin.
 */
@Value
public class AuditRecord {
    UUID auditId;
    UUID adminId;
    AuditAction action;
    String entity;
    UUID entityId;
    Map<String, Object> meta;
    String correlationId;
    Instant occurredAt;
}
