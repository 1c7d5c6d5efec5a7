package io.b2mash.b2b.einvoice.invoice;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * One billed item. {@code taxAmount} and {@code lineTotal} are derived; obtain lines through
 * {@link AmountCalculator#price} rather than supplying them directly.
 */
public record InvoiceLine(
    String description,
    BigDecimal quantity,
    BigDecimal unitPrice,
    BigDecimal taxRatePercent,
    BigDecimal taxAmount,
    BigDecimal lineTotal) {

  /** Tax rates the Authority accepts, in percent. */
  public static final List<BigDecimal> ALLOWED_TAX_RATES =
      List.of(
          new BigDecimal("0"), new BigDecimal("10.5"), new BigDecimal("21"), new BigDecimal("27"));

  /** Line amount before tax, {@code round2(quantity * unitPrice)}. */
  public BigDecimal net() {
    return quantity.multiply(unitPrice).setScale(2, RoundingMode.HALF_UP);
  }

  public boolean hasAllowedTaxRate() {
    return taxRatePercent != null
        && ALLOWED_TAX_RATES.stream().anyMatch(rate -> rate.compareTo(taxRatePercent) == 0);
  }
}
