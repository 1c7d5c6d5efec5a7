package io.b2mash.b2b.einvoice.verification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import io.b2mash.b2b.einvoice.authority.AuthorityCredentials;
import io.b2mash.b2b.einvoice.authority.request.AuthorizationRequestBuilder;
import io.b2mash.b2b.einvoice.exception.EncodingException;
import io.b2mash.b2b.einvoice.invoice.AmountCalculator;
import io.b2mash.b2b.einvoice.invoice.Invoice;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Builds the verification payload of an authorized invoice and renders it as a QR code. */
@Service
public class VerificationCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(VerificationCodeGenerator.class);

  static final int PROTOCOL_VERSION = 1;
  static final String AUTHORIZATION_TYPE_ELECTRONIC = "E";

  private final ObjectMapper objectMapper;
  private final AuthorizationRequestBuilder requestBuilder;
  private final AmountCalculator amountCalculator;
  private final VerificationProperties properties;

  public VerificationCodeGenerator(
      ObjectMapper objectMapper,
      AuthorizationRequestBuilder requestBuilder,
      AmountCalculator amountCalculator,
      VerificationProperties properties) {
    this.objectMapper = objectMapper;
    this.requestBuilder = requestBuilder;
    this.amountCalculator = amountCalculator;
    this.properties = properties;
  }

  /**
   * @throws EncodingException if the QR image cannot be produced
   */
  public VerificationImage generate(
      Invoice invoice, AuthorityCredentials credentials, String authorizationCode) {
    String payload = serialize(payload(invoice, credentials, authorizationCode));
    byte[] png = render(payload);
    log.debug(
        "Generated verification code for sequenceNumber={}, {} bytes",
        invoice.sequenceNumber(),
        png.length);
    return new VerificationImage(payload, png);
  }

  /**
   * The canonical payload. The sales point is the issuer's configured one and {@code importe} is
   * the total derived from the lines, the same figure sent as {@code ImpTotal}. The authorization
   * code is carried as a string so leading zeros survive.
   */
  public VerificationPayload payload(
      Invoice invoice, AuthorityCredentials credentials, String authorizationCode) {
    return new VerificationPayload(
        PROTOCOL_VERSION,
        invoice.issueDate().toString(),
        credentials.numericTaxId(),
        credentials.salesPoint(),
        requestBuilder.documentTypeCode(invoice.documentKind(), new ArrayList<>()),
        invoice.sequenceNumber(),
        amountCalculator.computeTotals(invoice.lines()).totalAmount(),
        AuthorizationRequestBuilder.CURRENCY_CODE,
        new BigDecimal(AuthorizationRequestBuilder.EXCHANGE_RATE),
        AuthorizationRequestBuilder.RECIPIENT_DOCUMENT_TYPE_TAX_ID,
        Long.parseLong(invoice.recipient().documentNumber().replaceAll("\\D", "")),
        AUTHORIZATION_TYPE_ELECTRONIC,
        authorizationCode);
  }

  private String serialize(VerificationPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new EncodingException(
          "Verification payload", "Verification payload could not be serialized", e);
    }
  }

  private byte[] render(String payload) {
    Map<EncodeHintType, Object> hints =
        Map.of(
            EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name(),
            EncodeHintType.MARGIN, properties.margin(),
            EncodeHintType.ERROR_CORRECTION, properties.errorCorrection());
    try {
      BitMatrix matrix =
          new QRCodeWriter()
              .encode(payload, BarcodeFormat.QR_CODE, properties.size(), properties.size(), hints);
      var out = new ByteArrayOutputStream();
      MatrixToImageWriter.writeToStream(matrix, "PNG", out);
      return out.toByteArray();
    } catch (WriterException | IOException e) {
      throw new EncodingException(
          "QR encoding failed", "Verification image could not be rendered", e);
    }
  }
}
