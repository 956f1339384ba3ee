package io.b2mash.b2b.deliverytracker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class CertificateNotReadyException extends ErrorResponseException {

  public CertificateNotReadyException(String title, String detail) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", "certificate_not_ready");
    return problem;
  }
}
