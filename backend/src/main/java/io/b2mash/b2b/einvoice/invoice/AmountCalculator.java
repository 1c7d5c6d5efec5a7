package io.b2mash.b2b.einvoice.invoice;

import io.b2mash.b2b.einvoice.exception.InvalidLineException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Stateless calculator for line taxes and invoice totals.
 *
 * <p>Every monetary output is rounded to scale 2 with {@link RoundingMode#HALF_UP}, which rounds
 * halves away from zero. Totals are compared downstream with a 0.01 tolerance, so all callers must
 * go through this class to get consistent figures.
 */
@Service
public class AmountCalculator {

  private static final BigDecimal HUNDRED = new BigDecimal("100");

  /**
   * Computes tax and total for one line.
   *
   * @param quantity billed quantity, must be positive
   * @param unitPrice price per unit before tax, must be positive
   * @param taxRatePercent tax rate percentage in [0, 100] (e.g. 21 for 21%)
   * @return {@code taxAmount = round2(q * p * rate / 100)} and {@code lineTotal = round2(q * p) +
   *     taxAmount}
   * @throws InvalidLineException if any argument is out of range
   */
  public LineAmounts computeLine(
      BigDecimal quantity, BigDecimal unitPrice, BigDecimal taxRatePercent) {
    requirePositive("quantity", quantity);
    requirePositive("unitPrice", unitPrice);
    if (taxRatePercent == null
        || taxRatePercent.signum() < 0
        || taxRatePercent.compareTo(HUNDRED) > 0) {
      throw new InvalidLineException(
          "taxRatePercent", "Tax rate must be between 0 and 100, got " + taxRatePercent);
    }

    BigDecimal amount = quantity.multiply(unitPrice);
    BigDecimal taxAmount = amount.multiply(taxRatePercent).divide(HUNDRED, 2, RoundingMode.HALF_UP);
    BigDecimal lineTotal = round2(amount).add(taxAmount);
    return new LineAmounts(taxAmount, lineTotal);
  }

  /** Builds a line whose derived fields come from {@link #computeLine}. */
  public InvoiceLine price(
      String description, BigDecimal quantity, BigDecimal unitPrice, BigDecimal taxRatePercent) {
    var amounts = computeLine(quantity, unitPrice, taxRatePercent);
    return new InvoiceLine(
        description,
        quantity,
        unitPrice,
        taxRatePercent,
        amounts.taxAmount(),
        amounts.lineTotal());
  }

  /** Recomputes the derived fields of an existing line, discarding the ones it carries. */
  public InvoiceLine reprice(InvoiceLine line) {
    return price(line.description(), line.quantity(), line.unitPrice(), line.taxRatePercent());
  }

  /**
   * Sums the lines. The result does not depend on line order.
   *
   * @param lines priced lines; derived fields are recomputed, not trusted
   */
  public InvoiceTotals computeTotals(List<InvoiceLine> lines) {
    BigDecimal net = BigDecimal.ZERO.setScale(2);
    BigDecimal tax = BigDecimal.ZERO.setScale(2);
    for (InvoiceLine line : lines) {
      var amounts = computeLine(line.quantity(), line.unitPrice(), line.taxRatePercent());
      net = net.add(line.net());
      tax = tax.add(amounts.taxAmount());
    }
    return new InvoiceTotals(net, tax, net.add(tax));
  }

  static BigDecimal round2(BigDecimal value) {
    return value.setScale(2, RoundingMode.HALF_UP);
  }

  private static void requirePositive(String field, BigDecimal value) {
    if (value == null || value.signum() <= 0) {
      throw new InvalidLineException(field, field + " must be greater than 0, got " + value);
    }
  }
}
