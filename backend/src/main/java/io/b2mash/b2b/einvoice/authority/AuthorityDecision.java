package io.b2mash.b2b.einvoice.authority;

import java.time.LocalDate;
import java.util.List;

/**
 * The Authority's answer to one authorization request. Rejections and transport failures are
 * decisions too; clients never throw for them.
 */
public record AuthorityDecision(
    boolean authorized,
    String authorizationCode,
    LocalDate expiryDate,
    List<String> remarks,
    String failureReason) {

  public AuthorityDecision {
    remarks = remarks == null ? List.of() : List.copyOf(remarks);
  }

  public static AuthorityDecision approved(
      String authorizationCode, LocalDate expiryDate, List<String> remarks) {
    return new AuthorityDecision(true, authorizationCode, expiryDate, remarks, null);
  }

  public static AuthorityDecision rejected(String failureReason, List<String> remarks) {
    return new AuthorityDecision(false, null, null, remarks, failureReason);
  }
}
