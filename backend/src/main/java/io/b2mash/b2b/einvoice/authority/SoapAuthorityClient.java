package io.b2mash.b2b.einvoice.authority;

import io.b2mash.b2b.einvoice.authority.AuthorityReply.Message;
import io.b2mash.b2b.einvoice.authority.signing.SignedRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Submits {@code FECAESolicitar} requests to the live invoicing service.
 *
 * <p>When the Authority answers that the sequence number was already authorized, the issued code
 * is looked up with {@code FECompConsultar} and returned as an approval, so a retried submission
 * never yields a second code.
 */
@Component
@ConditionalOnProperty(name = "authority.mode", havingValue = "live")
public class SoapAuthorityClient implements AuthorityClient {

  private static final Logger log = LoggerFactory.getLogger(SoapAuthorityClient.class);

  /** "Sequence number already authorized" error reported by the Authority. */
  static final int ALREADY_AUTHORIZED = 10016;

  static final String AUTHORIZED_REMARK = "Invoice authorized";

  private static final Pattern AUTHORIZATION_CODE = Pattern.compile("\\d{14}");

  private final AuthorityTransport transport;
  private final SoapEnvelopeWriter envelopeWriter;
  private final AuthorityReplyParser replyParser;

  public SoapAuthorityClient(
      AuthorityTransport transport,
      SoapEnvelopeWriter envelopeWriter,
      AuthorityReplyParser replyParser) {
    this.transport = transport;
    this.envelopeWriter = envelopeWriter;
    this.replyParser = replyParser;
  }

  @Override
  public AuthorityDecision submit(SignedRequest request) {
    var document = request.document();
    try {
      String reply =
          transport.exchange("FECAESolicitar", envelopeWriter.authorizationRequest(request));
      AuthorityReply parsed = replyParser.parseAuthorization(reply);

      if (parsed.approved()) {
        requireIssuedCode(parsed);
        log.info(
            "Authority approved salesPoint={}, sequenceNumber={}, code={}",
            document.header().salesPoint(),
            document.sequenceNumber(),
            parsed.authorizationCode());
        return AuthorityDecision.approved(
            parsed.authorizationCode(),
            parsed.expiryDate(),
            remarks(request, parsed.observations(), true));
      }

      if (parsed.hasError(ALREADY_AUTHORIZED)) {
        return recoverIssued(request);
      }

      String reason = failureReason(parsed);
      log.warn(
          "Authority rejected salesPoint={}, sequenceNumber={}: {}",
          document.header().salesPoint(),
          document.sequenceNumber(),
          reason);
      return AuthorityDecision.rejected(reason, remarks(request, parsed.observations(), false));
    } catch (AuthorityFaultException e) {
      log.warn(
          "Authority fault for salesPoint={}, sequenceNumber={}: {}",
          document.header().salesPoint(),
          document.sequenceNumber(),
          e.getMessage());
      return AuthorityDecision.rejected(
          "Authority fault " + e.faultCode() + ": " + e.reason(), document.remarks());
    } catch (RuntimeException e) {
      log.error(
          "Authority call failed for salesPoint={}, sequenceNumber={}: {}",
          document.header().salesPoint(),
          document.sequenceNumber(),
          e.getMessage(),
          e);
      return AuthorityDecision.rejected(
          "Authority unavailable: " + e.getMessage(), document.remarks());
    }
  }

  private AuthorityDecision recoverIssued(SignedRequest request) {
    var document = request.document();
    log.info(
        "Sequence number {} already authorized at salesPoint={}, querying issued code",
        document.sequenceNumber(),
        document.header().salesPoint());
    String reply =
        transport.exchange(
            "FECompConsultar",
            envelopeWriter.queryRequest(
                request.authorization(),
                document.header().salesPoint(),
                document.header().documentTypeCode(),
                document.sequenceNumber()));
    return replyParser
        .parseQuery(reply)
        .map(
            issued -> {
              requireIssuedCode(issued);
              return AuthorityDecision.approved(
                  issued.authorizationCode(),
                  issued.expiryDate(),
                  remarks(request, issued.observations(), true));
            })
        .orElseGet(
            () ->
                AuthorityDecision.rejected(
                    "Sequence number "
                        + document.sequenceNumber()
                        + " is reported as authorized but no code was found",
                    document.remarks()));
  }

  private static void requireIssuedCode(AuthorityReply reply) {
    String code = reply.authorizationCode();
    if (code == null || !AUTHORIZATION_CODE.matcher(code).matches()) {
      throw new AuthorityProtocolException(
          "Authorization code '" + code + "' is not a 14-digit number");
    }
    if (reply.expiryDate() == null) {
      throw new AuthorityProtocolException(
          "Authorization code " + reply.authorizationCode() + " has no expiry date");
    }
  }

  private static List<String> remarks(
      SignedRequest request, List<Message> observations, boolean authorized) {
    var remarks = new ArrayList<>(request.document().remarks());
    observations.forEach(observation -> remarks.add(observation.toString()));
    if (authorized) {
      remarks.add(AUTHORIZED_REMARK);
    }
    return remarks;
  }

  private static String failureReason(AuthorityReply reply) {
    List<Message> messages = !reply.errors().isEmpty() ? reply.errors() : reply.observations();
    if (messages.isEmpty()) {
      return "Authority returned result " + reply.result() + " without details";
    }
    return messages.stream().map(Message::toString).collect(Collectors.joining("; "));
  }
}
