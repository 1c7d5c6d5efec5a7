package io.b2mash.b2b.einvoice.authority;

import java.time.LocalDate;
import java.util.List;

/**
 * Parsed {@code FECAESolicitar} reply.
 *
 * @param result {@code A} approved, {@code R} rejected, {@code P} partially approved
 */
public record AuthorityReply(
    String result,
    String authorizationCode,
    LocalDate expiryDate,
    List<Message> observations,
    List<Message> errors) {

  /** A coded message from the Authority. */
  public record Message(int code, String text) {

    @Override
    public String toString() {
      return code + ": " + text;
    }
  }

  public AuthorityReply {
    observations = List.copyOf(observations);
    errors = List.copyOf(errors);
  }

  public boolean approved() {
    return "A".equals(result) && authorizationCode != null && !authorizationCode.isBlank();
  }

  public boolean hasError(int code) {
    return errors.stream().anyMatch(message -> message.code() == code)
        || observations.stream().anyMatch(message -> message.code() == code);
  }
}
