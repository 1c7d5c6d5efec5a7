package io.b2mash.b2b.einvoice.authority.request;

/** Batch header: record count, sales point and document type code. */
public record RequestHeader(int recordCount, int salesPoint, int documentTypeCode) {}
