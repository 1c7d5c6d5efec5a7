package io.b2mash.b2b.einvoice.authority;

/** Authority environment the issuer is registered against. */
public enum AuthorityEnvironment {
  TESTING,
  PRODUCTION
}
