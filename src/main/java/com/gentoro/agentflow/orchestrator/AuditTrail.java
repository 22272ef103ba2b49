package com.gentoro.agentflow.orchestrator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/** Append-only record of everything a run did. Safe for concurrent appends. */
public class AuditTrail {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(AuditTrail.class);

  private final ConcurrentLinkedQueue<AuditEvent> events = new ConcurrentLinkedQueue<>();
  private final AtomicLong sequence = new AtomicLong();

  public AuditEvent append(
      AuditEvent.Type type, String taskId, String agent, Map<String, ?> attributes) {
    Map<String, Object> attrs = new HashMap<>();
    if (attributes != null) {
      attributes.forEach(
          (k, v) -> {
            if (v != null) attrs.put(k, v);
          });
    }
    AuditEvent event =
        new AuditEvent(sequence.incrementAndGet(), Instant.now(), type, taskId, agent, attrs);
    events.add(event);
    log.debug("audit {} task={} agent={} {}", type, taskId, agent, event.attributes());
    return event;
  }

  /** Events in append order. */
  public List<AuditEvent> events() {
    List<AuditEvent> out = new ArrayList<>(events);
    out.sort((a, b) -> Long.compare(a.sequence(), b.sequence()));
    return out;
  }

  public List<AuditEvent> events(String taskId) {
    return events().stream().filter(e -> taskId.equals(e.taskId())).toList();
  }

  public List<AuditEvent> events(AuditEvent.Type type) {
    return events().stream().filter(e -> e.type() == type).toList();
  }
}
