package io.b2mash.b2b.deliverytracker.milestone;

import io.b2mash.b2b.deliverytracker.workitem.WorkItem;
import java.util.List;

/**
 * Flat milestone/deliverable projection kept for list screens that predate the unified tree. The
 * deliverables are exactly the live deliverable children that aggregation reads.
 */
public record MilestoneWithDeliverables(WorkItem milestone, List<WorkItem> deliverables) {}
