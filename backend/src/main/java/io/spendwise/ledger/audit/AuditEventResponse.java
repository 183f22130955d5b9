package io.spendwise.ledger.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record AuditEventResponse(
    UUID id,
    String eventType,
    String actorId,
    String actorType,
    String source,
    Map<String, Object> details,
    Instant occurredAt) {

  public static AuditEventResponse from(AuditEvent event) {
    return new AuditEventResponse(
        event.getId(),
        event.getEventType(),
        event.getActorId(),
        event.getActorType(),
        event.getSource(),
        event.getDetails(),
        event.getOccurredAt());
  }
}
