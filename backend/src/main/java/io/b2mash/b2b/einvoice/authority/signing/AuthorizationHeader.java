package io.b2mash.b2b.einvoice.authority.signing;

/** Authentication block sent with every Authority call. */
public record AuthorizationHeader(String token, String sign, String issuerTaxId) {

  @Override
  public String toString() {
    return "AuthorizationHeader[token=****, sign=****, issuerTaxId=" + issuerTaxId + "]";
  }
}
