package io.b2mash.b2b.einvoice.authority;

/**
 * Process-wide issuer credentials, built once at startup and never modified. Only the signer reads
 * {@code certificatePath} and {@code certificatePassword}.
 */
public record AuthorityCredentials(
    String taxId,
    int salesPoint,
    String certificatePath,
    String certificatePassword,
    String endpoint,
    AuthorityEnvironment environment) {

  /** Issuer tax id as a number, ignoring separators. */
  public long numericTaxId() {
    return Long.parseLong(taxId.replaceAll("\\D", ""));
  }

  @Override
  public String toString() {
    return "AuthorityCredentials[taxId="
        + taxId
        + ", salesPoint="
        + salesPoint
        + ", certificatePath="
        + certificatePath
        + ", certificatePassword=****, endpoint="
        + endpoint
        + ", environment="
        + environment
        + "]";
  }
}
