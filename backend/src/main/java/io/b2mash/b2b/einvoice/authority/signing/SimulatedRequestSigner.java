package io.b2mash.b2b.einvoice.authority.signing;

import io.b2mash.b2b.einvoice.authority.AuthorityCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Placeholder signer for development: no certificate is read and the values are fixed. */
@Component
@ConditionalOnProperty(name = "authority.mode", havingValue = "simulated", matchIfMissing = true)
public class SimulatedRequestSigner implements RequestSigner {

  private static final Logger log = LoggerFactory.getLogger(SimulatedRequestSigner.class);

  static final String TOKEN = "SIMULATED_TOKEN";
  static final String SIGNATURE = "SIMULATED_SIGNATURE";

  @Override
  public AuthorizationHeader authenticate(AuthorityCredentials credentials) {
    log.debug("Simulated signing for issuer {}", credentials.taxId());
    return new AuthorizationHeader(TOKEN, SIGNATURE, credentials.taxId());
  }
}
