package io.b2mash.b2b.deliverytracker.baseline;

import io.b2mash.b2b.deliverytracker.exception.ResourceConflictException;
import io.b2mash.b2b.deliverytracker.signature.SignatureCompletionHandler;
import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureRecord;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemKind;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemRepository;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Completion of a baseline commitment writes the milestone's first baseline version. */
@Component
public class BaselineCommitmentHandler implements SignatureCompletionHandler {

  private final BaselineVersionService baselineVersionService;
  private final BaselineVersionRepository baselineVersionRepository;
  private final WorkItemRepository workItemRepository;

  public BaselineCommitmentHandler(
      BaselineVersionService baselineVersionService,
      BaselineVersionRepository baselineVersionRepository,
      WorkItemRepository workItemRepository) {
    this.baselineVersionService = baselineVersionService;
    this.baselineVersionRepository = baselineVersionRepository;
    this.workItemRepository = workItemRepository;
  }

  @Override
  public SignatureEntityKind kind() {
    return SignatureEntityKind.BASELINE_COMMITMENT;
  }

  @Override
  public void assertSignable(UUID entityId) {
    var milestone = baselineVersionService.requireMilestone(entityId);
    if (baselineVersionRepository.existsByMilestoneId(entityId)) {
      throw new ResourceConflictException(
          "Baseline locked",
          "The baseline of milestone " + milestone.getItemRef() + " is already committed");
    }
  }

  @Override
  public void onCompleted(SignatureRecord record, UUID completingSignerId) {
    var milestone = baselineVersionService.requireMilestone(record.getEntityId());
    var deliverables =
        workItemRepository
            .findLiveChildrenOfKind(List.of(milestone.getId()), WorkItemKind.DELIVERABLE)
            .stream()
            .map(BaselineVersionService::snapshotOf)
            .toList();
    baselineVersionService.recordVersion(
        milestone,
        BaselineSource.COMMITMENT,
        null,
        milestone.getStartDate(),
        milestone.getEndDate(),
        milestone.getValue(),
        deliverables,
        completingSignerId);
  }
}
