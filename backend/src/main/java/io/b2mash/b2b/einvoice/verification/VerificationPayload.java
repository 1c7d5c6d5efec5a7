package io.b2mash.b2b.einvoice.verification;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;

/**
 * Canonical content of the public verification code. Field names and order are fixed by the
 * Authority's verification scheme.
 */
@JsonPropertyOrder({
  "ver",
  "fecha",
  "cuit",
  "ptoVta",
  "tipoCmp",
  "nroCmp",
  "importe",
  "moneda",
  "ctz",
  "tipoDocRec",
  "nroDocRec",
  "tipoCodAut",
  "codAut"
})
public record VerificationPayload(
    int ver,
    String fecha,
    long cuit,
    int ptoVta,
    int tipoCmp,
    long nroCmp,
    BigDecimal importe,
    String moneda,
    BigDecimal ctz,
    int tipoDocRec,
    long nroDocRec,
    String tipoCodAut,
    String codAut) {}
