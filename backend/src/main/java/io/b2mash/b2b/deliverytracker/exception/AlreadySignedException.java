package io.b2mash.b2b.deliverytracker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class AlreadySignedException extends ErrorResponseException {

  public AlreadySignedException(String entityKind, Object entityId, String party) {
    super(
        HttpStatus.CONFLICT,
        createProblem(
            "Already signed",
            "The " + party + " signature for " + entityKind + " " + entityId + " is already in place"),
        null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", "already_signed");
    return problem;
  }
}
