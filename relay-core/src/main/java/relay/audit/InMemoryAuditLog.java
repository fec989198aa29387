package relay.audit;

import com.github.f4b6a3.ulid.UlidCreator;
import relay.spi.AuditLog;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Heap-backed {@link AuditLog}. Events are kept for the life of the process.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryAuditLog implements AuditLog {
  private final Map<String, CopyOnWriteArrayList<AuditEvent>> eventsByProject = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryAuditLog() {
    this(Clock.systemUTC());
  }

  public InMemoryAuditLog(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public AuditEvent appendEvent(String projectId, String actor, AuditPayload payload) {
    AuditEvent event = new AuditEvent(UlidCreator.getMonotonicUlid().toString(), projectId, actor, payload,
        clock.instant());
    eventsByProject.computeIfAbsent(projectId, ignored -> new CopyOnWriteArrayList<>()).add(event);
    return event;
  }

  @Override
  public List<AuditEvent> listEvents(String projectId, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    List<AuditEvent> events = eventsByProject.get(projectId);
    if (events == null) {
      return List.of();
    }
    List<AuditEvent> newestFirst = new ArrayList<>(events);
    Collections.reverse(newestFirst);
    return newestFirst.size() > limit ? List.copyOf(newestFirst.subList(0, limit)) : newestFirst;
  }

  @Override
  public List<AuditEvent> listEvents(String projectId, Set<String> eventTypes, Instant since, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    if (eventTypes.isEmpty()) {
      throw new IllegalArgumentException("eventTypes must not be empty");
    }
    List<AuditEvent> events = eventsByProject.get(projectId);
    if (events == null) {
      return List.of();
    }
    List<AuditEvent> matching = new ArrayList<>();
    for (int i = events.size() - 1; i >= 0 && matching.size() < limit; i--) {
      AuditEvent event = events.get(i);
      if (eventTypes.contains(event.eventType()) && (since == null || !event.createdAt().isBefore(since))) {
        matching.add(event);
      }
    }
    return matching;
  }
}
