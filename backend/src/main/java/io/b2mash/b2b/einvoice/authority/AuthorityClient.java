package io.b2mash.b2b.einvoice.authority;

import io.b2mash.b2b.einvoice.authority.signing.SignedRequest;

/**
 * Port for submitting a signed request to the Authority.
 *
 * <p>Implementations must not throw for network errors, malformed replies or rejections; those are
 * returned as a rejected {@link AuthorityDecision}. Re-submitting the same (sales point, document
 * type, sequence number) must yield the code issued the first time.
 */
public interface AuthorityClient {

  AuthorityDecision submit(SignedRequest request);
}
