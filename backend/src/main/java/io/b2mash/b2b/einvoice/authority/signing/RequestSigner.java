package io.b2mash.b2b.einvoice.authority.signing;

import io.b2mash.b2b.einvoice.authority.AuthorityCredentials;
import io.b2mash.b2b.einvoice.authority.request.RequestDocument;

/**
 * Port for obtaining the Authority's authentication block. Implementations are the only code that
 * reads certificate material, and they never log it.
 */
public interface RequestSigner {

  /**
   * Returns a token and signature valid for the issuer.
   *
   * @throws io.b2mash.b2b.einvoice.exception.SigningException if certificate material is
   *     missing, invalid or expired
   */
  AuthorizationHeader authenticate(AuthorityCredentials credentials);

  /** Attaches an authentication block to the document. Either fully succeeds or throws. */
  default SignedRequest sign(RequestDocument document, AuthorityCredentials credentials) {
    return new SignedRequest(document, authenticate(credentials));
  }
}
