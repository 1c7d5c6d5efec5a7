package io.b2mash.b2b.einvoice.authority.request;

import java.util.List;

/**
 * Unsigned authorization request for a single invoice.
 *
 * @param remarks notes produced while building, e.g. a document type fallback
 */
public record RequestDocument(
    String issuerTaxId, RequestHeader header, RequestDetail detail, List<String> remarks) {

  public RequestDocument {
    remarks = List.copyOf(remarks);
  }

  /** Sequence number being authorized; batching is not supported so from == to. */
  public long sequenceNumber() {
    return detail.sequenceFrom();
  }
}
