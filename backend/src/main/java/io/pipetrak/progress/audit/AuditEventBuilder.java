package io.pipetrak.progress.audit;

import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;

/**
 * Builder that constructs an {@link AuditEventRecord}. Derives {@code actorType} from whether an
 * actor was supplied and {@code source} from whether an HTTP request is in progress.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("milestone_schedule.override_updated")
 *     .entityType("milestone_schedule")
 *     .entityId(projectId)
 *     .actorId(actorId)
 *     .details(Map.of("item_type", "spool"))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID actorId;
  private String source;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    if (eventType == null || entityType == null || entityId == null) {
      throw new IllegalStateException("eventType, entityType and entityId are required");
    }
    String resolvedSource = source;
    if (resolvedSource == null) {
      resolvedSource = RequestContextHolder.getRequestAttributes() != null ? "API" : "INTERNAL";
    }
    String actorType = actorId != null ? "USER" : "SYSTEM";
    return new AuditEventRecord(
        eventType, entityType, entityId, actorId, actorType, resolvedSource, details);
  }
}
