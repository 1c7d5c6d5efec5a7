package io.b2mash.b2b.einvoice.numbering;

import io.b2mash.b2b.einvoice.invoice.DocumentKind;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Counter source for simulated mode: every sequence starts empty. */
@Component
@ConditionalOnProperty(name = "authority.mode", havingValue = "simulated", matchIfMissing = true)
public class InMemorySequenceSource implements SequenceSource {

  @Override
  public long lastIssued(DocumentKind kind, int salesPoint) {
    return 0L;
  }
}
