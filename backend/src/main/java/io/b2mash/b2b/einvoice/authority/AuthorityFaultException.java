package io.b2mash.b2b.einvoice.authority;

/** A SOAP fault returned by the invoicing service in place of a result. */
public class AuthorityFaultException extends AuthorityProtocolException {

  private final String faultCode;
  private final String reason;

  public AuthorityFaultException(String faultCode, String reason) {
    super("SOAP fault " + faultCode + ": " + reason);
    this.faultCode = faultCode;
    this.reason = reason;
  }

  public String faultCode() {
    return faultCode;
  }

  public String reason() {
    return reason;
  }
}
