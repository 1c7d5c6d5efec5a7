package io.b2mash.b2b.einvoice.numbering;

import io.b2mash.b2b.einvoice.invoice.DocumentKind;

/** External counter the numbering service seeds itself from. */
public interface SequenceSource {

  /**
   * Returns the last sequence number already issued for the pair, or 0 if none. May block.
   *
   * @throws RuntimeException if the counter cannot be read
   */
  long lastIssued(DocumentKind kind, int salesPoint);
}
