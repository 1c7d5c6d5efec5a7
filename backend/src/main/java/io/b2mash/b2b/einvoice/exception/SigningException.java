package io.b2mash.b2b.einvoice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when the authentication block cannot be attached: certificate material missing,
 * unreadable, or outside its validity period. Messages never contain secret material.
 */
public class SigningException extends ErrorResponseException {

  public SigningException(String title, String detail) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(title, detail), null);
  }

  public SigningException(String title, String detail, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(title, detail), cause);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
