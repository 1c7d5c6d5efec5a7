package io.b2mash.b2b.einvoice.numbering;

import io.b2mash.b2b.einvoice.authority.AuthorityCredentials;
import io.b2mash.b2b.einvoice.authority.AuthorityReplyParser;
import io.b2mash.b2b.einvoice.authority.AuthorityTransport;
import io.b2mash.b2b.einvoice.authority.SoapEnvelopeWriter;
import io.b2mash.b2b.einvoice.authority.request.AuthorizationRequestBuilder;
import io.b2mash.b2b.einvoice.authority.signing.RequestSigner;
import io.b2mash.b2b.einvoice.invoice.DocumentKind;
import java.util.ArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Reads the last authorized number from the Authority ({@code FECompUltimoAutorizado}). */
@Component
@ConditionalOnProperty(name = "authority.mode", havingValue = "live")
public class AuthoritySequenceSource implements SequenceSource {

  private static final Logger log = LoggerFactory.getLogger(AuthoritySequenceSource.class);

  private final AuthorityTransport transport;
  private final SoapEnvelopeWriter envelopeWriter;
  private final AuthorityReplyParser replyParser;
  private final RequestSigner signer;
  private final AuthorizationRequestBuilder requestBuilder;
  private final AuthorityCredentials credentials;

  public AuthoritySequenceSource(
      AuthorityTransport transport,
      SoapEnvelopeWriter envelopeWriter,
      AuthorityReplyParser replyParser,
      RequestSigner signer,
      AuthorizationRequestBuilder requestBuilder,
      AuthorityCredentials credentials) {
    this.transport = transport;
    this.envelopeWriter = envelopeWriter;
    this.replyParser = replyParser;
    this.signer = signer;
    this.requestBuilder = requestBuilder;
    this.credentials = credentials;
  }

  @Override
  public long lastIssued(DocumentKind kind, int salesPoint) {
    int documentTypeCode = requestBuilder.documentTypeCode(kind, new ArrayList<>());
    String envelope =
        envelopeWriter.lastAuthorizedRequest(
            signer.authenticate(credentials), salesPoint, documentTypeCode);
    long last =
        replyParser.parseLastAuthorized(transport.exchange("FECompUltimoAutorizado", envelope));
    log.info(
        "Authority reports last number {} for salesPoint={}, documentType={}",
        last,
        salesPoint,
        documentTypeCode);
    return last;
  }
}
