package io.b2mash.b2b.einvoice.authority.signing;

import io.b2mash.b2b.einvoice.authority.request.RequestDocument;

/** A request document together with the authentication block that authorizes sending it. */
public record SignedRequest(RequestDocument document, AuthorizationHeader authorization) {}
