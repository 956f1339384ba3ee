package io.b2mash.b2b.deliverytracker.permission;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Role cache settings.
 *
 * @param cacheMaxSize maximum number of cached (project, member) role entries
 * @param cacheTtl how long a resolved role is reused before it is read again
 */
@ConfigurationProperties(prefix = "tracker.permissions")
public record PermissionProperties(
    @DefaultValue("10000") long cacheMaxSize, @DefaultValue("30s") Duration cacheTtl) {}
