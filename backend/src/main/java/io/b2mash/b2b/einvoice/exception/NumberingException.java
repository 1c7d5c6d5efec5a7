package io.b2mash.b2b.einvoice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when the sequence counter source is unavailable, times out or is interrupted. */
public class NumberingException extends ErrorResponseException {

  public NumberingException(String title, String detail) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(title, detail), null);
  }

  public NumberingException(String title, String detail, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(title, detail), cause);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
