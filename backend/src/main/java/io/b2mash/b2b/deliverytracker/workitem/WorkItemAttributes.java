package io.b2mash.b2b.deliverytracker.workitem;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Caller-supplied attributes for creating or updating a work item.
 *
 * @param position zero-based insertion index among the new siblings; null appends
 * @param value commercial value, meaningful for milestones
 */
public record WorkItemAttributes(
    String name,
    String description,
    LocalDate startDate,
    LocalDate endDate,
    BigDecimal value,
    UUID estimateComponentId,
    Integer position) {

  public static WorkItemAttributes named(String name) {
    return new WorkItemAttributes(name, null, null, null, null, null, null);
  }
}
