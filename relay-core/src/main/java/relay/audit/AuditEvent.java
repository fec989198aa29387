package relay.audit;

import java.time.Instant;
import java.util.Objects;

/**
 * A stored audit log entry.
 *
 * @param id        event id (ULID, sortable by creation)
 * @param projectId owning project
 * @param actor     who caused the event
 * @param payload   typed body; {@link AuditPayload#eventType()} is the event type
 * @param createdAt append time
 */
public record AuditEvent(String id, String projectId, String actor, AuditPayload payload, Instant createdAt) {
  public AuditEvent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(actor, "actor");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public String eventType() {
    return payload.eventType();
  }
}
