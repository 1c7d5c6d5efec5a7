package io.b2mash.b2b.einvoice.authorization;

import io.b2mash.b2b.einvoice.verification.VerificationImage;
import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of one submission attempt. Created once and never modified.
 *
 * <p>{@code authorizationCode}, {@code expiryDate} and {@code verificationImage} are present iff
 * {@code authorized}; {@code failureReason} is present iff not.
 */
public record AuthorizationResult(
    boolean authorized,
    String authorizationCode,
    LocalDate expiryDate,
    VerificationImage verificationImage,
    long sequenceNumber,
    List<String> remarks,
    String failureReason) {

  public AuthorizationResult {
    remarks = remarks == null ? List.of() : List.copyOf(remarks);
    if (authorized) {
      if (authorizationCode == null || expiryDate == null || verificationImage == null) {
        throw new IllegalArgumentException(
            "Authorized result requires code, expiry date and verification image");
      }
      if (failureReason != null) {
        throw new IllegalArgumentException("Authorized result cannot carry a failure reason");
      }
    } else {
      if (failureReason == null || failureReason.isBlank()) {
        throw new IllegalArgumentException("Rejected result requires a failure reason");
      }
      if (authorizationCode != null || expiryDate != null || verificationImage != null) {
        throw new IllegalArgumentException("Rejected result cannot carry authorization data");
      }
    }
  }

  public static AuthorizationResult authorized(
      String authorizationCode,
      LocalDate expiryDate,
      VerificationImage verificationImage,
      long sequenceNumber,
      List<String> remarks) {
    return new AuthorizationResult(
        true, authorizationCode, expiryDate, verificationImage, sequenceNumber, remarks, null);
  }

  public static AuthorizationResult rejected(
      String failureReason, long sequenceNumber, List<String> remarks) {
    return new AuthorizationResult(
        false, null, null, null, sequenceNumber, remarks, failureReason);
  }
}
