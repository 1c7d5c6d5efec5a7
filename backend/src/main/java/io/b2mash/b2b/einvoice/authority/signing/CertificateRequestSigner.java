package io.b2mash.b2b.einvoice.authority.signing;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.einvoice.authority.AuthorityCredentials;
import io.b2mash.b2b.einvoice.authority.AuthorityProperties;
import io.b2mash.b2b.einvoice.exception.SigningException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Signature;
import java.security.cert.CertificateExpiredException;
import java.security.cert.CertificateNotYetValidException;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.Date;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Signs access tickets with the issuer's X.509 certificate.
 *
 * <p>A login ticket request (unique id, generation and expiration time, target service) is signed
 * with SHA256withRSA. The base64 request is the token and the base64 signature is the sign. Tickets
 * are cached until shortly before they expire. The certificate is checked against the clock on
 * every call so an expired certificate is rejected even while a ticket is cached.
 */
@Component
@ConditionalOnProperty(name = "authority.mode", havingValue = "live")
public class CertificateRequestSigner implements RequestSigner {

  private static final Logger log = LoggerFactory.getLogger(CertificateRequestSigner.class);

  static final String SERVICE = "wsfe";
  private static final String SIGNATURE_ALGORITHM = "SHA256withRSA";
  private static final Duration RENEWAL_MARGIN = Duration.ofMinutes(10);

  private final SigningMaterialLoader materialLoader;
  private final Clock clock;
  private final Duration ticketLifetime;
  private final Cache<String, AuthorizationHeader> tickets;

  private volatile SigningMaterial material;

  public CertificateRequestSigner(
      SigningMaterialLoader materialLoader, AuthorityProperties properties, Clock clock) {
    this.materialLoader = materialLoader;
    this.clock = clock;
    this.ticketLifetime = properties.ticketLifetime();
    Duration cacheFor = ticketLifetime.minus(RENEWAL_MARGIN);
    this.tickets =
        Caffeine.newBuilder()
            .expireAfterWrite(cacheFor.isNegative() ? Duration.ZERO : cacheFor)
            .maximumSize(16)
            .build();
  }

  @Override
  public AuthorizationHeader authenticate(AuthorityCredentials credentials) {
    SigningMaterial signingMaterial = material(credentials);
    requireValid(signingMaterial);
    return tickets.get(credentials.taxId(), taxId -> issueTicket(signingMaterial, taxId));
  }

  private AuthorizationHeader issueTicket(SigningMaterial signingMaterial, String taxId) {
    OffsetDateTime now = OffsetDateTime.now(clock);
    String request = loginTicketRequest(now, now.plus(ticketLifetime));
    try {
      var signature = Signature.getInstance(SIGNATURE_ALGORITHM);
      signature.initSign(signingMaterial.privateKey());
      signature.update(request.getBytes(StandardCharsets.UTF_8));
      String sign = Base64.getEncoder().encodeToString(signature.sign());
      String token =
          Base64.getEncoder().encodeToString(request.getBytes(StandardCharsets.UTF_8));
      log.info(
          "Issued access ticket for issuer {}, valid until {}", taxId, now.plus(ticketLifetime));
      return new AuthorizationHeader(token, sign, taxId);
    } catch (GeneralSecurityException e) {
      throw new SigningException("Signing failed", "Access ticket could not be signed", e);
    }
  }

  // TODO: exchange the signed ticket request with the Authority's login service (LoginCms) once
  // CMS packaging is available, and cache the token/sign it returns instead of the local pair.
  static String loginTicketRequest(OffsetDateTime generated, OffsetDateTime expires) {
    var format = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
        + "<loginTicketRequest version=\"1.0\"><header>"
        + "<uniqueId>"
        + generated.toEpochSecond()
        + "</uniqueId>"
        + "<generationTime>"
        + generated.format(format)
        + "</generationTime>"
        + "<expirationTime>"
        + expires.format(format)
        + "</expirationTime>"
        + "</header><service>"
        + SERVICE
        + "</service></loginTicketRequest>";
  }

  private SigningMaterial material(AuthorityCredentials credentials) {
    SigningMaterial loaded = material;
    if (loaded == null) {
      synchronized (this) {
        loaded = material;
        if (loaded == null) {
          loaded = materialLoader.load(credentials);
          material = loaded;
        }
      }
    }
    return loaded;
  }

  private void requireValid(SigningMaterial signingMaterial) {
    try {
      signingMaterial.certificate().checkValidity(Date.from(clock.instant()));
    } catch (CertificateExpiredException e) {
      throw new SigningException("Certificate expired", "The signing certificate has expired", e);
    } catch (CertificateNotYetValidException e) {
      throw new SigningException(
          "Certificate not yet valid", "The signing certificate is not valid yet", e);
    }
  }
}
