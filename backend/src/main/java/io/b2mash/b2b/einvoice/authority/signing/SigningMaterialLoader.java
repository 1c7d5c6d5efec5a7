package io.b2mash.b2b.einvoice.authority.signing;

import io.b2mash.b2b.einvoice.authority.AuthorityCredentials;
import io.b2mash.b2b.einvoice.exception.SigningException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Collections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Reads the issuer's PKCS#12 keystore. */
@Component
public class SigningMaterialLoader {

  private static final Logger log = LoggerFactory.getLogger(SigningMaterialLoader.class);

  public SigningMaterial load(AuthorityCredentials credentials) {
    String location = credentials.certificatePath();
    if (location == null || location.isBlank()) {
      throw new SigningException("Missing certificate", "No certificate path is configured");
    }
    Path path = Path.of(location);
    if (!Files.isReadable(path)) {
      throw new SigningException(
          "Missing certificate", "Certificate file is not readable: " + path.getFileName());
    }

    char[] password =
        credentials.certificatePassword() == null
            ? new char[0]
            : credentials.certificatePassword().toCharArray();
    try (InputStream in = Files.newInputStream(path)) {
      var keyStore = KeyStore.getInstance("PKCS12");
      keyStore.load(in, password);
      for (String alias : Collections.list(keyStore.aliases())) {
        if (keyStore.isKeyEntry(alias)
            && keyStore.getKey(alias, password) instanceof PrivateKey privateKey
            && keyStore.getCertificate(alias) instanceof X509Certificate certificate) {
          log.info(
              "Loaded signing certificate: alias={}, subject={}, notAfter={}",
              alias,
              certificate.getSubjectX500Principal().getName(),
              certificate.getNotAfter().toInstant());
          return new SigningMaterial(privateKey, certificate);
        }
      }
      throw new SigningException(
          "Invalid certificate", "Keystore contains no private key with an X.509 certificate");
    } catch (IOException | GeneralSecurityException e) {
      // KeyStore reports a wrong password as an IOException; keep the message generic
      throw new SigningException(
          "Invalid certificate", "Certificate keystore could not be read", e);
    }
  }
}
