package io.b2mash.b2b.einvoice.invoice;

/** The party an invoice is issued to. All fields are required for submission. */
public record Recipient(
    String documentType,
    String documentNumber,
    String legalName,
    String address,
    String taxCondition) {}
