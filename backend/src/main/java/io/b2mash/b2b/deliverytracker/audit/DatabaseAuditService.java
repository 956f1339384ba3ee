package io.b2mash.b2b.deliverytracker.audit;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database-backed implementation of {@link AuditService}.
 *
 * <p>Transaction semantics: {@code log()} participates in the caller's transaction. If the domain
 * operation rolls back, so does its audit trail; a failed variation application leaves no
 * "variation.applied" row behind.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;

  public DatabaseAuditService(AuditEventRepository auditEventRepository) {
    this.auditEventRepository = auditEventRepository;
  }

  @Override
  @Transactional
  public void log(AuditEventRecord record) {
    auditEventRepository.save(new AuditEvent(record));
    log.debug(
        "Recorded audit event: type={}, entity={}/{}, actor={}",
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.actorId());
  }

  @Override
  @Transactional(readOnly = true)
  public Page<AuditEvent> findEvents(AuditEventFilter filter, Pageable pageable) {
    return auditEventRepository.findByFilter(
        filter.projectId(),
        filter.entityType(),
        filter.entityId(),
        filter.actorId(),
        filter.eventType(),
        filter.from(),
        filter.to(),
        pageable);
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEventRepository.EventTypeCount> countEventsByType() {
    return auditEventRepository.countByEventType();
  }
}
