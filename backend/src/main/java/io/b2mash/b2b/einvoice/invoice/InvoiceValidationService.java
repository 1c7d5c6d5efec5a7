package io.b2mash.b2b.einvoice.invoice;

import io.b2mash.b2b.einvoice.exception.InvoiceTotalsMismatchException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Compares the amounts supplied on an invoice with the amounts derived from its lines. */
@Service
public class InvoiceValidationService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceValidationService.class);

  /** Maximum accepted difference between a supplied and a derived amount. */
  public static final BigDecimal TOLERANCE = new BigDecimal("0.01");

  public record TotalsCheck(
      String field, BigDecimal supplied, BigDecimal calculated, boolean passed) {}

  private final AmountCalculator amountCalculator;

  public InvoiceValidationService(AmountCalculator amountCalculator) {
    this.amountCalculator = amountCalculator;
  }

  /**
   * Runs every totals check, including the lines' own tax amounts, and returns them all. A line
   * check is named {@code lines[i].taxAmount}; the check named {@code netAmount + taxAmount}
   * compares the supplied total with the sum of the supplied net and tax.
   */
  public List<TotalsCheck> checkTotals(Invoice invoice) {
    var checks = new ArrayList<TotalsCheck>();
    for (int i = 0; i < invoice.lines().size(); i++) {
      InvoiceLine supplied = invoice.lines().get(i);
      InvoiceLine derived = amountCalculator.reprice(supplied);
      checks.add(check("lines[" + i + "].taxAmount", supplied.taxAmount(), derived.taxAmount()));
    }

    InvoiceTotals totals = amountCalculator.computeTotals(invoice.lines());
    checks.add(check("netAmount", invoice.netAmount(), totals.netAmount()));
    checks.add(check("taxAmount", invoice.taxAmount(), totals.taxAmount()));
    checks.add(check("totalAmount", invoice.totalAmount(), totals.totalAmount()));
    checks.add(check("netAmount + taxAmount", invoice.totalAmount(), suppliedSum(invoice)));
    return checks;
  }

  /**
   * @throws InvoiceTotalsMismatchException if any check in {@link #checkTotals} fails
   */
  public void requireConsistentTotals(Invoice invoice) {
    var failed = checkTotals(invoice).stream().filter(check -> !check.passed()).toList();
    if (!failed.isEmpty()) {
      log.warn(
          "Totals mismatch: salesPoint={}, sequenceNumber={}, fields={}",
          invoice.salesPoint(),
          invoice.sequenceNumber(),
          failed.stream().map(TotalsCheck::field).toList());
      throw new InvoiceTotalsMismatchException(failed);
    }
  }

  private static BigDecimal suppliedSum(Invoice invoice) {
    if (invoice.netAmount() == null || invoice.taxAmount() == null) {
      return null;
    }
    return invoice.netAmount().add(invoice.taxAmount());
  }

  private static TotalsCheck check(String field, BigDecimal supplied, BigDecimal calculated) {
    boolean passed =
        supplied != null
            && calculated != null
            && supplied.subtract(calculated).abs().compareTo(TOLERANCE) <= 0;
    return new TotalsCheck(field, supplied, calculated, passed);
  }
}
