package io.b2mash.b2b.deliverytracker.deliverable;

import io.b2mash.b2b.deliverytracker.exception.InvalidStateException;
import io.b2mash.b2b.deliverytracker.exception.ResourceNotFoundException;
import io.b2mash.b2b.deliverytracker.signature.SignatureCompletionHandler;
import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureRecord;
import io.b2mash.b2b.deliverytracker.workitem.ProgressRollup;
import io.b2mash.b2b.deliverytracker.workitem.WorkItem;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemRepository;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Deliverable sign-off: both parties sign a review-complete deliverable, which then is delivered. */
@Component
public class DeliverableSignOffHandler implements SignatureCompletionHandler {

  private final WorkItemRepository workItemRepository;
  private final ProgressRollup progressRollup;

  public DeliverableSignOffHandler(
      WorkItemRepository workItemRepository, ProgressRollup progressRollup) {
    this.workItemRepository = workItemRepository;
    this.progressRollup = progressRollup;
  }

  @Override
  public SignatureEntityKind kind() {
    return SignatureEntityKind.DELIVERABLE;
  }

  @Override
  public void assertSignable(UUID entityId) {
    var deliverable = requireDeliverable(entityId);
    if (deliverable.getDeliverableStatus() != DeliverableStatus.REVIEW_COMPLETE) {
      throw new InvalidStateException(
          "Deliverable not ready for sign-off",
          "Deliverable "
              + deliverable.getItemRef()
              + " must be in Review Complete before it can be signed, but is "
              + deliverable.getDeliverableStatus().label());
    }
  }

  /** Marks the deliverable delivered; progress is forced to 100. */
  @Override
  public void onCompleted(SignatureRecord record, UUID completingSignerId) {
    var deliverable = requireDeliverable(record.getEntityId());
    var before = deliverable.getDeliverableStatus();
    deliverable.markDelivered();
    progressRollup.publishStatusChange(deliverable, before.name(), completingSignerId, "signed_off");
  }

  private WorkItem requireDeliverable(UUID deliverableId) {
    return workItemRepository
        .findLiveById(deliverableId)
        .orElseThrow(() -> new ResourceNotFoundException("Deliverable", deliverableId));
  }
}
