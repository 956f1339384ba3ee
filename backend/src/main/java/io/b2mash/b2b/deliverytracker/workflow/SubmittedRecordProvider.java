package io.b2mash.b2b.deliverytracker.workflow;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Contract for collaborator modules (timesheets, expenses) that own records awaiting approval.
 * Implementations report their records as they stand; the workflow view does not re-derive their
 * status.
 */
public interface SubmittedRecordProvider {

  /** The category every record from this provider falls under. */
  WorkflowCategory category();

  /** Records in the given projects currently awaiting approval. */
  List<SubmittedRecord> findSubmitted(Collection<UUID> projectIds);

  record SubmittedRecord(
      String entityKind,
      UUID entityId,
      UUID projectId,
      String title,
      String status,
      Instant submittedAt) {}
}
