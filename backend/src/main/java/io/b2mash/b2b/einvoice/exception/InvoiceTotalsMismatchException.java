package io.b2mash.b2b.einvoice.exception;

import io.b2mash.b2b.einvoice.invoice.InvoiceValidationService.TotalsCheck;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when the amounts supplied on an invoice differ from the amounts derived from its lines by
 * more than the allowed tolerance. Results in HTTP 422 with the failing checks attached.
 */
public class InvoiceTotalsMismatchException extends ErrorResponseException {

  private final List<TotalsCheck> failedChecks;

  public InvoiceTotalsMismatchException(List<TotalsCheck> failedChecks) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(failedChecks), null);
    this.failedChecks = List.copyOf(failedChecks);
  }

  public List<TotalsCheck> getFailedChecks() {
    return failedChecks;
  }

  private static ProblemDetail createProblem(List<TotalsCheck> checks) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Invoice totals mismatch");
    problem.setDetail(
        "Supplied amounts do not match the amounts calculated from the invoice lines.");
    problem.setProperty("checks", checks);
    return problem;
  }
}
