package io.b2mash.b2b.einvoice.invoice;

import java.math.BigDecimal;

/** Invoice-level amounts derived from its lines. {@code total = net + tax}. */
public record InvoiceTotals(BigDecimal netAmount, BigDecimal taxAmount, BigDecimal totalAmount) {}
