package io.b2mash.b2b.einvoice.authority;

/** Sends a SOAP envelope to the Authority and returns the raw reply envelope. */
@FunctionalInterface
public interface AuthorityTransport {

  /**
   * @param operation the service operation, e.g. {@code FECAESolicitar}
   * @param envelope complete SOAP envelope
   * @return the reply body as text
   */
  String exchange(String operation, String envelope);
}
