package io.b2mash.b2b.deliverytracker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Demotion (indent) has no preceding sibling that could receive the item. */
public class NoValidParentException extends ErrorResponseException {

  public NoValidParentException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", "no_valid_parent");
    return problem;
  }
}
