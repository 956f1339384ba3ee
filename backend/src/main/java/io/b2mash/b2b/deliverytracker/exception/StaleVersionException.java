package io.b2mash.b2b.deliverytracker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Optimistic concurrency conflict. The caller read a version that has since changed and should
 * re-read current state before retrying.
 */
public class StaleVersionException extends ErrorResponseException {

  public StaleVersionException(String resourceType, Object id) {
    super(
        HttpStatus.CONFLICT,
        createProblem(
            "Stale version",
            resourceType
                + " "
                + id
                + " was modified by another request. Reload it and retry the operation."),
        null);
  }

  static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", "stale_version");
    return problem;
  }
}
