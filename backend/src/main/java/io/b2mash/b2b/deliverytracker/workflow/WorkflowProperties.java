package io.b2mash.b2b.deliverytracker.workflow;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Days an item may wait before its urgency is raised.
 *
 * @param mediumAfterDays pending days at which an item becomes MEDIUM
 * @param highAfterDays pending days at which an item becomes HIGH
 * @param criticalAfterDays pending days at which an item becomes CRITICAL
 */
@ConfigurationProperties(prefix = "tracker.workflow")
public record WorkflowProperties(
    @DefaultValue("3") int mediumAfterDays,
    @DefaultValue("5") int highAfterDays,
    @DefaultValue("7") int criticalAfterDays) {}
