package io.b2mash.b2b.einvoice.numbering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.einvoice.authority.AuthorityCredentials;
import io.b2mash.b2b.einvoice.authority.AuthorityEnvironment;
import io.b2mash.b2b.einvoice.authority.AuthorityProtocolException;
import io.b2mash.b2b.einvoice.authority.AuthorityReplyParser;
import io.b2mash.b2b.einvoice.authority.AuthorityTransport;
import io.b2mash.b2b.einvoice.authority.SoapEnvelopeWriter;
import io.b2mash.b2b.einvoice.authority.request.AuthorizationRequestBuilder;
import io.b2mash.b2b.einvoice.authority.signing.SimulatedRequestSigner;
import io.b2mash.b2b.einvoice.invoice.AmountCalculator;
import io.b2mash.b2b.einvoice.invoice.DocumentKind;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AuthoritySequenceSourceTest {

  private static final AuthorityCredentials CREDENTIALS =
      new AuthorityCredentials(
          "20123456789", 5, null, null, "http://localhost", AuthorityEnvironment.TESTING);

  private final List<String> envelopes = new ArrayList<>();

  @Test
  void lastIssued_readsNumberForKindAndSalesPoint() {
    var source =
        source(
            "<soap:Envelope xmlns:soap=\"http://www.w3.org/2003/05/soap-envelope\"><soap:Body>"
                + "<FECompUltimoAutorizadoResponse xmlns=\"http://ar.gov.afip.dif.FEV1/\">"
                + "<FECompUltimoAutorizadoResult><PtoVta>5</PtoVta><CbteTipo>3</CbteTipo>"
                + "<CbteNro>118</CbteNro></FECompUltimoAutorizadoResult>"
                + "</FECompUltimoAutorizadoResponse></soap:Body></soap:Envelope>");

    assertThat(source.lastIssued(DocumentKind.CREDIT_NOTE, 5)).isEqualTo(118);
    assertThat(envelopes).singleElement().asString().contains("<ar:CbteTipo>3</ar:CbteTipo>");
  }

  @Test
  void lastIssued_propagatesAuthorityErrors() {
    var source =
        source(
            "<soap:Envelope xmlns:soap=\"http://www.w3.org/2003/05/soap-envelope\"><soap:Body>"
                + "<FECompUltimoAutorizadoResponse xmlns=\"http://ar.gov.afip.dif.FEV1/\">"
                + "<FECompUltimoAutorizadoResult><Errors><Err><Code>600</Code>"
                + "<Msg>Token expired</Msg></Err></Errors></FECompUltimoAutorizadoResult>"
                + "</FECompUltimoAutorizadoResponse></soap:Body></soap:Envelope>");

    assertThatThrownBy(() -> source.lastIssued(DocumentKind.INVOICE, 5))
        .isInstanceOf(AuthorityProtocolException.class)
        .hasMessageContaining("600: Token expired");
  }

  private AuthoritySequenceSource source(String reply) {
    AuthorityTransport transport =
        (operation, envelope) -> {
          envelopes.add(envelope);
          return reply;
        };
    return new AuthoritySequenceSource(
        transport,
        new SoapEnvelopeWriter(),
        new AuthorityReplyParser(),
        new SimulatedRequestSigner(),
        new AuthorizationRequestBuilder(new AmountCalculator()),
        CREDENTIALS);
  }
}
