package io.b2mash.b2b.einvoice.authority.signing;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;

/** Issuer private key and its certificate. Never logged. */
public record SigningMaterial(PrivateKey privateKey, X509Certificate certificate) {

  @Override
  public String toString() {
    return "SigningMaterial[subject=" + certificate.getSubjectX500Principal().getName() + "]";
  }
}
