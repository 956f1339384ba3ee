package io.b2mash.b2b.deliverytracker.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Binds request id and member id into the logging MDC for the duration of the request. */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_MEMBER_ID = "memberId";
  private static final String MDC_REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      Authentication auth = SecurityContextHolder.getContext().getAuthentication();
      if (auth instanceof JwtAuthenticationToken jwtAuth) {
        MDC.put(MDC_MEMBER_ID, jwtAuth.getToken().getSubject());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_MEMBER_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
