package io.b2mash.b2b.einvoice.authority.request;

import java.math.BigDecimal;

/** Taxable base and tax amount for one tax rate, identified by the Authority's rate code. */
public record TaxBreakdownEntry(
    int rateCode, BigDecimal ratePercent, String baseAmount, String taxAmount) {}
