package io.pipetrak.progress.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/audit-events")
public class AuditEventController {

  private final AuditService auditService;

  public AuditEventController(AuditService auditService) {
    this.auditService = auditService;
  }

  @GetMapping
  public ResponseEntity<Page<AuditEventResponse>> listEvents(
      @RequestParam(required = false) String entityType,
      @RequestParam(required = false) UUID entityId,
      @PageableDefault(size = 50) Pageable pageable) {
    return ResponseEntity.ok(
        auditService.findEvents(entityType, entityId, pageable).map(AuditEventResponse::from));
  }

  public record AuditEventResponse(
      UUID id,
      String eventType,
      String entityType,
      UUID entityId,
      UUID actorId,
      String actorType,
      String source,
      Map<String, Object> details,
      Instant occurredAt) {

    public static AuditEventResponse from(AuditEvent e) {
      return new AuditEventResponse(
          e.getId(),
          e.getEventType(),
          e.getEntityType(),
          e.getEntityId(),
          e.getActorId(),
          e.getActorType(),
          e.getSource(),
          e.getDetails(),
          e.getOccurredAt());
    }
  }
}
