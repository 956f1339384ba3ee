package io.b2mash.b2b.deliverytracker.audit;

import java.util.List;
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
   * Queries audit events matching the given filter. All filter fields are optional.
   *
   * @return a page of matching audit events ordered by occurredAt DESC
   */
  Page<AuditEvent> findEvents(AuditEventFilter filter, Pageable pageable);

  List<AuditEventRepository.EventTypeCount> countEventsByType();
}
