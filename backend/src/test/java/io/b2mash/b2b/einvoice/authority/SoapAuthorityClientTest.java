package io.b2mash.b2b.einvoice.authority;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SoapAuthorityClientTest {

  private final List<String> operations = new ArrayList<>();

  @Test
  void submit_approvedReplyBecomesApproval() {
    var client = client(AuthorityReplies.approved("74123456789012", "20240527"));

    var decision = client.submit(AuthorityReplies.signedRequest(42));

    assertThat(decision.authorized()).isTrue();
    assertThat(decision.authorizationCode()).isEqualTo("74123456789012");
    assertThat(decision.expiryDate()).isEqualTo(LocalDate.of(2024, 5, 27));
    assertThat(decision.remarks())
        .containsExactly("10217: Recipient condition not checked", "Invoice authorized");
    assertThat(operations).containsExactly("FECAESolicitar");
  }

  @Test
  void submit_rejectionCarriesAuthorityMessages() {
    var client =
        client(AuthorityReplies.rejectedWithObservation(10048, "Total does not match"));

    var decision = client.submit(AuthorityReplies.signedRequest(42));

    assertThat(decision.authorized()).isFalse();
    assertThat(decision.authorizationCode()).isNull();
    assertThat(decision.failureReason()).isEqualTo("10048: Total does not match");
    assertThat(decision.remarks()).containsExactly("10048: Total does not match");
  }

  @Test
  void submit_alreadyAuthorizedRecoversIssuedCode() {
    var client =
        client(
            AuthorityReplies.error(SoapAuthorityClient.ALREADY_AUTHORIZED, "Already authorized"),
            AuthorityReplies.query("71999999999999", "20240520"));

    var decision = client.submit(AuthorityReplies.signedRequest(42));

    assertThat(decision.authorized()).isTrue();
    assertThat(decision.authorizationCode()).isEqualTo("71999999999999");
    assertThat(decision.expiryDate()).isEqualTo(LocalDate.of(2024, 5, 20));
    assertThat(operations).containsExactly("FECAESolicitar", "FECompConsultar");
  }

  @Test
  void submit_alreadyAuthorizedWithoutIssuedCodeIsRejected() {
    var client =
        client(
            AuthorityReplies.error(SoapAuthorityClient.ALREADY_AUTHORIZED, "Already authorized"),
            AuthorityReplies.queryNotFound());

    var decision = client.submit(AuthorityReplies.signedRequest(42));

    assertThat(decision.authorized()).isFalse();
    assertThat(decision.failureReason()).contains("no code was found");
  }

  @Test
  void submit_otherErrorIsRejectedWithoutQuery() {
    var client = client(AuthorityReplies.error(600, "Token expired"));

    var decision = client.submit(AuthorityReplies.signedRequest(42));

    assertThat(decision.failureReason()).isEqualTo("600: Token expired");
    assertThat(operations).containsExactly("FECAESolicitar");
  }

  @Test
  void submit_transportFailureBecomesRejection() {
    AuthorityTransport failing =
        (operation, envelope) -> {
          throw new IllegalStateException("Connection refused");
        };
    var client =
        new SoapAuthorityClient(failing, new SoapEnvelopeWriter(), new AuthorityReplyParser());

    var decision = client.submit(AuthorityReplies.signedRequest(42));

    assertThat(decision.authorized()).isFalse();
    assertThat(decision.failureReason()).isEqualTo("Authority unavailable: Connection refused");
  }

  @Test
  void submit_malformedReplyBecomesRejection() {
    var client = client("<html>Service Unavailable");

    var decision = client.submit(AuthorityReplies.signedRequest(42));

    assertThat(decision.authorized()).isFalse();
    assertThat(decision.failureReason()).startsWith("Authority unavailable: Malformed reply");
  }

  @Test
  void submit_approvalWithoutExpiryIsRejected() {
    var client = client(AuthorityReplies.approved("74123456789012", ""));

    var decision = client.submit(AuthorityReplies.signedRequest(42));

    assertThat(decision.authorized()).isFalse();
    assertThat(decision.failureReason()).contains("has no expiry date");
  }

  @Test
  void submit_soapFaultIsRejectedWithFaultReason() {
    var client = client(AuthorityReplies.fault("soap:Receiver", "Server was unable to process"));

    var decision = client.submit(AuthorityReplies.signedRequest(42));

    assertThat(decision.authorized()).isFalse();
    assertThat(decision.failureReason())
        .isEqualTo("Authority fault soap:Receiver: Server was unable to process");
    assertThat(operations).containsExactly("FECAESolicitar");
  }

  @Test
  void submit_approvalWithMalformedCodeIsRejected() {
    var client = client(AuthorityReplies.approved("7412345678901X", "20240527"));

    var decision = client.submit(AuthorityReplies.signedRequest(42));

    assertThat(decision.authorized()).isFalse();
    assertThat(decision.failureReason()).contains("is not a 14-digit number");
  }

  @Test
  void submit_recoveredCodeOfWrongLengthIsRejected() {
    var client =
        client(
            AuthorityReplies.error(SoapAuthorityClient.ALREADY_AUTHORIZED, "Already authorized"),
            AuthorityReplies.query("7199999999", "20240520"));

    var decision = client.submit(AuthorityReplies.signedRequest(42));

    assertThat(decision.authorized()).isFalse();
    assertThat(decision.failureReason()).contains("'7199999999' is not a 14-digit number");
  }

  @Test
  void submit_codeWithLeadingZeroIsKeptVerbatim() {
    var client = client(AuthorityReplies.approved("04123456789012", "20240527"));

    var decision = client.submit(AuthorityReplies.signedRequest(42));

    assertThat(decision.authorized()).isTrue();
    assertThat(decision.authorizationCode()).isEqualTo("04123456789012");
  }

  private SoapAuthorityClient client(String... replies) {
    AuthorityTransport transport =
        (operation, envelope) -> {
          operations.add(operation);
          return replies[operations.size() - 1];
        };
    return new SoapAuthorityClient(
        transport, new SoapEnvelopeWriter(), new AuthorityReplyParser());
  }
}
