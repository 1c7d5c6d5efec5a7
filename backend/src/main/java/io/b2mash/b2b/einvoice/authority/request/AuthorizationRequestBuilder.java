package io.b2mash.b2b.einvoice.authority.request;

import io.b2mash.b2b.einvoice.authority.AuthorityCredentials;
import io.b2mash.b2b.einvoice.exception.BuildException;
import io.b2mash.b2b.einvoice.invoice.AmountCalculator;
import io.b2mash.b2b.einvoice.invoice.DocumentKind;
import io.b2mash.b2b.einvoice.invoice.Invoice;
import io.b2mash.b2b.einvoice.invoice.InvoiceLine;
import io.b2mash.b2b.einvoice.invoice.InvoiceTotals;
import io.b2mash.b2b.einvoice.invoice.Recipient;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Maps an {@link Invoice} into the Authority's request document. Stateless and deterministic: the
 * only date in the output is the invoice's own issue date.
 *
 * <p>Amounts on the wire are derived from the lines by {@link AmountCalculator}, never copied from
 * the invoice, so {@code ImpTotal = ImpNeto + ImpIVA} and {@code ImpIVA} equals the sum of the rate
 * entries.
 */
@Service
public class AuthorizationRequestBuilder {

  private static final Logger log = LoggerFactory.getLogger(AuthorizationRequestBuilder.class);

  /** Class "A" document codes. */
  static final Map<DocumentKind, Integer> DOCUMENT_TYPE_CODES;

  static {
    var codes = new EnumMap<DocumentKind, Integer>(DocumentKind.class);
    codes.put(DocumentKind.INVOICE, 1);
    codes.put(DocumentKind.DEBIT_NOTE, 2);
    codes.put(DocumentKind.CREDIT_NOTE, 3);
    DOCUMENT_TYPE_CODES = Collections.unmodifiableMap(codes);
  }

  /** Rate percent (trailing zeros stripped) to the Authority's VAT rate id. */
  static final Map<BigDecimal, Integer> TAX_RATE_CODES =
      Map.of(
          BigDecimal.ZERO, 3,
          new BigDecimal("10.5"), 4,
          new BigDecimal("21"), 5,
          new BigDecimal("27"), 6);

  public static final int DEFAULT_DOCUMENT_TYPE_CODE = 1;
  public static final int CONCEPT_GOODS = 1;
  public static final int RECIPIENT_DOCUMENT_TYPE_TAX_ID = 80;
  public static final String CURRENCY_CODE = "PES";
  public static final String EXCHANGE_RATE = "1";

  private static final DateTimeFormatter WIRE_DATE = DateTimeFormatter.BASIC_ISO_DATE;
  private static final String ZERO_AMOUNT = "0.00";

  private final AmountCalculator amountCalculator;

  public AuthorizationRequestBuilder(AmountCalculator amountCalculator) {
    this.amountCalculator = amountCalculator;
  }

  /**
   * @throws BuildException if the invoice is incomplete, uses an unsupported rate, or was numbered
   *     under a sales point other than the configured one
   */
  public RequestDocument build(Invoice invoice, AuthorityCredentials credentials) {
    requireComplete(invoice);
    if (invoice.salesPoint() != credentials.salesPoint()) {
      throw new BuildException(
          "Sales point mismatch",
          "Invoice was numbered under sales point "
              + invoice.salesPoint()
              + " but the issuer submits under "
              + credentials.salesPoint());
    }
    var remarks = new ArrayList<String>();
    List<TaxBreakdownEntry> breakdown = taxBreakdown(invoice.lines());
    InvoiceTotals totals = amountCalculator.computeTotals(invoice.lines());

    int documentTypeCode = documentTypeCode(invoice.documentKind(), remarks);
    var header = new RequestHeader(1, credentials.salesPoint(), documentTypeCode);

    var detail =
        new RequestDetail(
            CONCEPT_GOODS,
            RECIPIENT_DOCUMENT_TYPE_TAX_ID,
            recipientDocumentNumber(invoice.recipient()),
            invoice.sequenceNumber(),
            invoice.sequenceNumber(),
            invoice.issueDate().format(WIRE_DATE),
            format(totals.totalAmount()),
            ZERO_AMOUNT,
            format(totals.netAmount()),
            ZERO_AMOUNT,
            format(totals.taxAmount()),
            ZERO_AMOUNT,
            CURRENCY_CODE,
            EXCHANGE_RATE,
            breakdown);

    log.debug(
        "Built request: salesPoint={}, documentType={}, sequenceNumber={}, rates={}",
        header.salesPoint(),
        documentTypeCode,
        invoice.sequenceNumber(),
        detail.taxBreakdown().size());
    return new RequestDocument(credentials.taxId(), header, detail, remarks);
  }

  /**
   * Returns the Authority code for the given kind. A kind missing from the table is sent as an
   * invoice; the substitution is logged and remarked so it does not pass unnoticed.
   */
  public int documentTypeCode(DocumentKind kind, List<String> remarks) {
    Integer code = kind == null ? null : DOCUMENT_TYPE_CODES.get(kind);
    if (code != null) {
      return code;
    }
    log.warn(
        "No document type code for kind {}, falling back to {}",
        kind,
        DEFAULT_DOCUMENT_TYPE_CODE);
    remarks.add(
        "Unknown document kind "
            + kind
            + "; submitted as Invoice (code "
            + DEFAULT_DOCUMENT_TYPE_CODE
            + ")");
    return DEFAULT_DOCUMENT_TYPE_CODE;
  }

  /** One entry per distinct rate, ordered by rate code. Line tax is recomputed, not trusted. */
  List<TaxBreakdownEntry> taxBreakdown(List<InvoiceLine> lines) {
    record RateTotals(BigDecimal percent, BigDecimal base, BigDecimal tax) {
      RateTotals plus(RateTotals other) {
        return new RateTotals(percent, base.add(other.base()), tax.add(other.tax()));
      }
    }

    var byCode = new TreeMap<Integer, RateTotals>();
    for (InvoiceLine line : lines) {
      int code = taxRateCode(line.taxRatePercent());
      BigDecimal tax =
          amountCalculator
              .computeLine(line.quantity(), line.unitPrice(), line.taxRatePercent())
              .taxAmount();
      byCode.merge(
          code, new RateTotals(line.taxRatePercent(), line.net(), tax), RateTotals::plus);
    }

    var entries = new ArrayList<TaxBreakdownEntry>();
    byCode.forEach(
        (code, totals) ->
            entries.add(
                new TaxBreakdownEntry(
                    code,
                    totals.percent().stripTrailingZeros(),
                    format(totals.base()),
                    format(totals.tax()))));
    return entries;
  }

  private int taxRateCode(BigDecimal ratePercent) {
    Integer code = ratePercent == null ? null : TAX_RATE_CODES.get(normalize(ratePercent));
    if (code == null) {
      throw new BuildException(
          "Unsupported tax rate",
          "Tax rate " + ratePercent + "% is not one of " + InvoiceLine.ALLOWED_TAX_RATES);
    }
    return code;
  }

  private static BigDecimal normalize(BigDecimal value) {
    return value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
  }

  private static long recipientDocumentNumber(Recipient recipient) {
    String digits = recipient.documentNumber().replaceAll("\\D", "");
    if (digits.isEmpty() || digits.length() > 18) {
      throw new BuildException(
          "Invalid recipient document",
          "Recipient document number must contain between 1 and 18 digits");
    }
    return Long.parseLong(digits);
  }

  private static void requireComplete(Invoice invoice) {
    if (invoice == null) {
      throw new BuildException("Missing invoice", "No invoice supplied");
    }
    if (invoice.lines().isEmpty()) {
      throw new BuildException("Missing lines", "An invoice requires at least one line");
    }
    if (invoice.issueDate() == null) {
      throw new BuildException("Missing issue date", "Invoice issue date is required");
    }
    if (invoice.salesPoint() <= 0 || invoice.sequenceNumber() <= 0) {
      throw new BuildException(
          "Invalid numbering", "Sales point and sequence number must be positive");
    }
    if (invoice.netAmount() == null
        || invoice.taxAmount() == null
        || invoice.totalAmount() == null) {
      throw new BuildException("Missing amounts", "Net, tax and total amounts are required");
    }
    var recipient = invoice.recipient();
    if (recipient == null) {
      throw new BuildException("Missing recipient", "Invoice recipient is required");
    }
    requireText("documentType", recipient.documentType());
    requireText("documentNumber", recipient.documentNumber());
    requireText("legalName", recipient.legalName());
    requireText("address", recipient.address());
    requireText("taxCondition", recipient.taxCondition());
    for (InvoiceLine line : invoice.lines()) {
      if (line == null || line.description() == null || line.description().isBlank()) {
        throw new BuildException("Invalid line", "Every line requires a description");
      }
      if (line.quantity() == null || line.unitPrice() == null) {
        throw new BuildException(
            "Invalid line", "Line '" + line.description() + "' is missing amounts");
      }
    }
  }

  private static void requireText(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new BuildException("Missing recipient field", "Recipient " + field + " is required");
    }
  }

  private static String format(BigDecimal amount) {
    return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }
}
