package io.b2mash.b2b.einvoice.authorization;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.einvoice.authority.AuthorityClient;
import io.b2mash.b2b.einvoice.authority.SimulatedAuthorityClient;
import io.b2mash.b2b.einvoice.invoice.DocumentKind;
import io.b2mash.b2b.einvoice.invoice.Invoice;
import io.b2mash.b2b.einvoice.invoice.InvoiceFixtures;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class InvoiceAuthorizationServiceIntegrationTest {

  @TestConfiguration
  static class FixedClockConfig {

    @Bean
    @Primary
    Clock fixedClock() {
      return Clock.fixed(Instant.parse("2024-05-17T12:00:00Z"), ZoneOffset.UTC);
    }
  }

  @Autowired private InvoiceAuthorizationService service;
  @Autowired private AuthorityClient authorityClient;

  @Test
  void simulatedModeIsTheDefault() {
    assertThat(authorityClient).isInstanceOf(SimulatedAuthorityClient.class);
  }

  @Test
  void numberAndAuthorizeInvoice() {
    long number = service.getNextNumber(DocumentKind.DEBIT_NOTE);
    var invoice =
        InvoiceFixtures.invoice(
            DocumentKind.DEBIT_NOTE,
            number,
            List.of(
                InvoiceFixtures.line("Late fee", "1", "150", "21"),
                InvoiceFixtures.line("Interest", "1", "20", "10.5")));

    var result = service.submitInvoice(invoice);

    assertThat(result.authorized()).isTrue();
    assertThat(result.sequenceNumber()).isEqualTo(number);
    assertThat(result.authorizationCode()).matches("[1-9]\\d{13}");
    assertThat(result.expiryDate()).isEqualTo(LocalDate.of(2024, 5, 27));
    assertThat(result.remarks()).contains("Invoice authorized");
    assertThat(result.verificationImage().payload())
        .contains("\"ptoVta\":5")
        .contains("\"tipoCmp\":2")
        .contains("\"nroCmp\":" + number)
        .contains("\"importe\":203.60");
  }

  @Test
  void resubmittingSameNumberReturnsSameCode() {
    long number = service.getNextNumber(DocumentKind.INVOICE);
    Invoice invoice = InvoiceFixtures.invoice(number);

    var first = service.submitInvoice(invoice);
    var second = service.submitInvoice(invoice);

    assertThat(second.authorizationCode()).isEqualTo(first.authorizationCode());
  }

  @Test
  void numbersAreSequentialPerKind() {
    long first = service.getNextNumber(DocumentKind.CREDIT_NOTE);
    long second = service.getNextNumber(DocumentKind.CREDIT_NOTE);

    assertThat(second).isEqualTo(first + 1);
  }
}
