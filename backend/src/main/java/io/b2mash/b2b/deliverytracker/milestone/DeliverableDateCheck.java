package io.b2mash.b2b.deliverytracker.milestone;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Outcome of checking a proposed deliverable end date against its milestone.
 *
 * @param baselined whether the milestone has a committed baseline version
 * @param limitDate the committed baseline end date, or the milestone's own end date when not yet
 *     baselined; null when neither is set
 */
public record DeliverableDateCheck(
    UUID milestoneId,
    LocalDate proposedEndDate,
    boolean baselined,
    LocalDate limitDate,
    boolean wouldBreach) {}
