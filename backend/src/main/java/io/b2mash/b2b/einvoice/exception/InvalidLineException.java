package io.b2mash.b2b.einvoice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when an invoice line has a non-positive quantity or unit price, or a tax rate outside
 * [0, 100]. The offending field is exposed as the {@code field} problem property.
 */
public class InvalidLineException extends ErrorResponseException {

  private final String field;

  public InvalidLineException(String field, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(field, detail), null);
    this.field = field;
  }

  public String getField() {
    return field;
  }

  private static ProblemDetail createProblem(String field, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid invoice line");
    problem.setDetail(detail);
    problem.setProperty("field", field);
    return problem;
  }
}
