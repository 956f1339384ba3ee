package io.b2mash.b2b.deliverytracker.security;

import io.b2mash.b2b.deliverytracker.exception.ForbiddenException;
import java.util.UUID;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Resolves the acting member from the authenticated JWT. The subject claim carries the member id.
 * Controllers resolve it once and pass it explicitly into the services.
 */
public final class CurrentMember {

  public static UUID id(Jwt jwt) {
    if (jwt == null || jwt.getSubject() == null) {
      throw new ForbiddenException("Member not resolved", "Request carries no member identity");
    }
    try {
      return UUID.fromString(jwt.getSubject());
    } catch (IllegalArgumentException e) {
      throw new ForbiddenException(
          "Member not resolved", "Token subject is not a member id: " + jwt.getSubject());
    }
  }

  private CurrentMember() {}
}
