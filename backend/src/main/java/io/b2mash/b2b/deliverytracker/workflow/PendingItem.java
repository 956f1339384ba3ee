package io.b2mash.b2b.deliverytracker.workflow;

import io.b2mash.b2b.deliverytracker.signature.SignatureParty;
import java.time.Instant;
import java.util.UUID;

/**
 * One item awaiting the caller's action.
 *
 * @param entityKind entity type of the pending item, e.g. {@code deliverable} or {@code timesheet}
 * @param requiredAction what the caller is expected to do
 * @param requiredParty the signature slot to fill; null for review and collaborator items
 * @param status the entity's status as its owner reports it
 */
public record PendingItem(
    WorkflowCategory category,
    String entityKind,
    UUID entityId,
    UUID projectId,
    String title,
    String requiredAction,
    SignatureParty requiredParty,
    String status,
    Instant pendingSince,
    long daysPending,
    WorkflowUrgency urgency) {}
