package io.b2mash.b2b.einvoice.authority.request;

import java.util.List;

/**
 * Detail record of an authorization request. Amounts are pre-formatted with two decimals and the
 * date is {@code yyyyMMdd}, as the Authority expects them on the wire.
 */
public record RequestDetail(
    int conceptCode,
    int recipientDocumentTypeCode,
    long recipientDocumentNumber,
    long sequenceFrom,
    long sequenceTo,
    String issueDate,
    String totalAmount,
    String nonTaxedAmount,
    String netAmount,
    String exemptAmount,
    String taxAmount,
    String otherTributesAmount,
    String currencyCode,
    String exchangeRate,
    List<TaxBreakdownEntry> taxBreakdown) {

  public RequestDetail {
    taxBreakdown = List.copyOf(taxBreakdown);
  }
}
