package io.b2mash.b2b.deliverytracker.workitem;

import java.util.List;

/** A live work item with its live children, in sibling order. */
public record WorkItemNode(WorkItem item, List<WorkItemNode> children) {}
