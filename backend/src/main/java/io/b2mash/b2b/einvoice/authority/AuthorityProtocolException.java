package io.b2mash.b2b.einvoice.authority;

/**
 * Raised inside the SOAP adapters when a reply cannot be understood. Never leaves the authority
 * package boundary: clients turn it into a rejected decision, numbering into a numbering error.
 */
public class AuthorityProtocolException extends RuntimeException {

  public AuthorityProtocolException(String message) {
    super(message);
  }

  public AuthorityProtocolException(String message, Throwable cause) {
    super(message, cause);
  }
}
