package io.pipetrak.progress.audit;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/** Records and queries audit events. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   */
  void log(AuditEventRecord record);

  /**
   * Queries audit events, newest first. Both filters are optional; null means "no filter on this
   * field".
   */
  Page<AuditEvent> findEvents(String entityType, UUID entityId, Pageable pageable);
}
