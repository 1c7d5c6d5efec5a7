package io.b2mash.b2b.einvoice.invoice;

import java.math.BigDecimal;

/** Derived amounts of a single line, both at scale 2. */
public record LineAmounts(BigDecimal taxAmount, BigDecimal lineTotal) {}
