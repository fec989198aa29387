package relay.spi;

import relay.audit.AuditEvent;
import relay.audit.AuditPayload;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Append-only log of control-plane events, scoped per project.
 *
 * <p>The guardian reads it back to find its last action per connector, and the outcome
 * summarizer reconstructs the policy-update feed from it.
 */
public interface AuditLog {

    /**
     * Appends an event.
     *
     * @param projectId owning project
     * @param actor     who caused the event ({@code "system"}, {@code "guardian"} or a user)
     * @param payload   typed event body; its {@link AuditPayload#eventType()} names the event
     * @return the stored event
     */
    AuditEvent appendEvent(String projectId, String actor, AuditPayload payload);

    /**
     * Lists a project's events, newest first.
     */
    List<AuditEvent> listEvents(String projectId, int limit);

    /**
     * Lists a project's events of the given types created at or after {@code since}, newest first.
     *
     * <p>Events of other types never count against {@code limit}, so a busy delivery log cannot
     * hide guardian or policy events.
     *
     * @param eventTypes event types to include; must not be empty
     * @param since      inclusive lower bound on {@link AuditEvent#createdAt()}, or {@code null} for none
     */
    List<AuditEvent> listEvents(String projectId, Set<String> eventTypes, Instant since, int limit);
}
