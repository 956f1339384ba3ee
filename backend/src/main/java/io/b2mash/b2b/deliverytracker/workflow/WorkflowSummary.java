package io.b2mash.b2b.deliverytracker.workflow;

import java.util.List;
import java.util.Map;

/**
 * Pending items, oldest first, with per-category counts. Categories whose source failed are listed
 * in {@code unavailableCategories} and contribute no items.
 */
public record WorkflowSummary(
    List<PendingItem> items,
    Map<WorkflowCategory, Integer> countsByCategory,
    int total,
    List<WorkflowCategory> unavailableCategories) {}
