package io.b2mash.b2b.einvoice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when an invoice cannot be mapped into an Authority request document. */
public class BuildException extends ErrorResponseException {

  public BuildException(String title, String detail) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
