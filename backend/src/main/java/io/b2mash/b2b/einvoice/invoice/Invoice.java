package io.b2mash.b2b.einvoice.invoice;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * One electronic invoice submission. Amounts are supplied by the caller and checked against the
 * amounts derived from {@code lines} before the invoice is sent to the Authority.
 */
public record Invoice(
    DocumentKind documentKind,
    int salesPoint,
    long sequenceNumber,
    LocalDate issueDate,
    Recipient recipient,
    List<InvoiceLine> lines,
    BigDecimal netAmount,
    BigDecimal taxAmount,
    BigDecimal totalAmount,
    String notes) {

  public Invoice {
    lines = lines == null ? List.of() : List.copyOf(lines);
  }
}
