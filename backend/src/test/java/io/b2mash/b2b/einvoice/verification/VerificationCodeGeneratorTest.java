package io.b2mash.b2b.einvoice.verification;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.qrcode.QRCodeReader;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import io.b2mash.b2b.einvoice.authority.AuthorityCredentials;
import io.b2mash.b2b.einvoice.authority.AuthorityEnvironment;
import io.b2mash.b2b.einvoice.authority.request.AuthorizationRequestBuilder;
import io.b2mash.b2b.einvoice.invoice.AmountCalculator;
import io.b2mash.b2b.einvoice.invoice.DocumentKind;
import io.b2mash.b2b.einvoice.invoice.InvoiceFixtures;
import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Random;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;

class VerificationCodeGeneratorTest {

  private static final AuthorityCredentials CREDENTIALS =
      new AuthorityCredentials(
          "20-12345678-9", 5, null, null, "http://localhost", AuthorityEnvironment.TESTING);

  private static final String EXPECTED_PAYLOAD =
      "{\"ver\":1,\"fecha\":\"2024-05-17\",\"cuit\":20123456789,\"ptoVta\":5,\"tipoCmp\":1,"
          + "\"nroCmp\":42,\"importe\":242.00,\"moneda\":\"PES\",\"ctz\":1,\"tipoDocRec\":80,"
          + "\"nroDocRec\":30712345671,\"tipoCodAut\":\"E\",\"codAut\":\"74123456789012\"}";

  private final VerificationCodeGenerator generator =
      new VerificationCodeGenerator(
          new ObjectMapper(),
          new AuthorizationRequestBuilder(new AmountCalculator()),
          new AmountCalculator(),
          new VerificationProperties(300, 2, ErrorCorrectionLevel.M));

  @Test
  void generate_payloadHasFixedFieldsInOrder() {
    var image = generator.generate(InvoiceFixtures.invoice(42), CREDENTIALS, "74123456789012");

    assertThat(image.payload()).isEqualTo(EXPECTED_PAYLOAD);
  }

  @Test
  void generate_imageDecodesToPayload() throws Exception {
    var image = generator.generate(InvoiceFixtures.invoice(42), CREDENTIALS, "74123456789012");

    var buffered = ImageIO.read(new ByteArrayInputStream(image.png()));
    assertThat(buffered.getWidth()).isEqualTo(300);
    assertThat(decode(image)).isEqualTo(EXPECTED_PAYLOAD);
  }

  @Test
  void generate_isDeterministic() {
    var invoice = InvoiceFixtures.invoice(42);

    assertThat(generator.generate(invoice, CREDENTIALS, "74123456789012"))
        .isEqualTo(generator.generate(invoice, CREDENTIALS, "74123456789012"));
  }

  @Test
  void payload_usesDocumentTypeCodeOfKind() {
    var invoice =
        InvoiceFixtures.invoice(
            DocumentKind.CREDIT_NOTE, 7, List.of(InvoiceFixtures.line("Refund", "1", "10", "21")));

    var payload = generator.payload(invoice, CREDENTIALS, "74123456789012");

    assertThat(payload.tipoCmp()).isEqualTo(3);
    assertThat(payload.nroCmp()).isEqualTo(7);
    assertThat(payload.importe()).isEqualByComparingTo("12.10");
  }

  @Test
  void generate_keepsEveryDigitOfAuthorizationCode() throws Exception {
    var random = new Random(17);
    var codes = new ArrayList<>(List.of("00000000000001", "04123456789012", "99999999999999"));
    for (int i = 0; i < 5; i++) {
      codes.add(String.format("%014d", Math.floorMod(random.nextLong(), 100_000_000_000_000L)));
    }

    for (String code : codes) {
      var image = generator.generate(InvoiceFixtures.invoice(42), CREDENTIALS, code);

      JsonNode parsed = new ObjectMapper().readTree(image.payload());
      assertThat(parsed.get("codAut").isTextual()).isTrue();
      assertThat(parsed.get("codAut").asText()).isEqualTo(code);
      assertThat(decode(image)).isEqualTo(image.payload());
    }
  }

  @Test
  void payload_importeIsTotalDerivedFromLines() {
    var base = InvoiceFixtures.invoice(42);
    var invoice = InvoiceFixtures.withTotal(base, new BigDecimal("242.01"));

    assertThat(generator.payload(invoice, CREDENTIALS, "74123456789012").importe())
        .isEqualByComparingTo("242.00");
  }

  @Test
  void toDataUri_embedsPngAsBase64() {
    var image = generator.generate(InvoiceFixtures.invoice(42), CREDENTIALS, "74123456789012");

    String uri = image.toDataUri();

    assertThat(uri).startsWith("data:image/png;base64,");
    byte[] decoded = Base64.getDecoder().decode(uri.substring("data:image/png;base64,".length()));
    assertThat(decoded).isEqualTo(image.png());
  }

  @Test
  void png_returnsDefensiveCopy() {
    var image = new VerificationImage("x", new byte[] {1, 2, 3});

    image.png()[0] = 9;

    assertThat(image.png()).containsExactly(1, 2, 3);
  }

  private static String decode(VerificationImage image) throws Exception {
    var buffered = ImageIO.read(new ByteArrayInputStream(image.png()));
    var bitmap = new BinaryBitmap(new HybridBinarizer(new BufferedImageLuminanceSource(buffered)));
    return new QRCodeReader().decode(bitmap).getText();
  }
}
