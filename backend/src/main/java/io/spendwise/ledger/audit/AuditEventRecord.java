package io.spendwise.ledger.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Built by {@link
 * AuditEventBuilder}, which fills in actor and request metadata.
 *
 * @param eventType event name following the {@code {entity}.{action}} convention
 * @param entityType kind of audited entity, e.g. "recurring_template"
 * @param entityId id of the affected entity (not a FK, the entity may be deleted later)
 * @param actorId JWT subject of the acting user; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param source origin of the action: API or INTERNAL
 * @param ipAddress client IP; null outside HTTP requests
 * @param userAgent truncated User-Agent header; null outside HTTP requests
 * @param details key field values stored as JSON; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String actorId,
    String actorType,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}
