package io.b2mash.b2b.deliverytracker.security;

/**
 * Organisation-level role constants. Org roles come from the JWT {@code org_role} claim; Spring
 * authorities are the {@code ROLE_} prefixed versions used by {@code @PreAuthorize}.
 *
 * <p>Project roles (who may sign for which party) live in {@code project_members} and are resolved
 * through {@link io.b2mash.b2b.deliverytracker.permission.PermissionService}.
 */
public final class Roles {

  // Org-level roles ("org_role" claim values)
  public static final String ORG_OWNER = "owner";
  public static final String ORG_ADMIN = "admin";
  public static final String ORG_MEMBER = "member";

  // Spring Security granted authorities
  public static final String AUTHORITY_ORG_OWNER = "ROLE_ORG_OWNER";
  public static final String AUTHORITY_ORG_ADMIN = "ROLE_ORG_ADMIN";
  public static final String AUTHORITY_ORG_MEMBER = "ROLE_ORG_MEMBER";

  private Roles() {}
}
