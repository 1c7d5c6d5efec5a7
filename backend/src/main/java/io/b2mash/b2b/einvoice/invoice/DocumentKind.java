package io.b2mash.b2b.einvoice.invoice;

import java.util.Arrays;
import java.util.Optional;

/** Kind of fiscal document being authorized. */
public enum DocumentKind {
  INVOICE("factura"),
  CREDIT_NOTE("nota_credito"),
  DEBIT_NOTE("nota_debito");

  private final String slug;

  DocumentKind(String slug) {
    this.slug = slug;
  }

  /** Returns the value used by the invoice form for this kind (e.g. "nota_credito"). */
  public String getSlug() {
    return slug;
  }

  public static Optional<DocumentKind> fromSlug(String slug) {
    if (slug == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(kind -> kind.slug.equalsIgnoreCase(slug)).findFirst();
  }
}
