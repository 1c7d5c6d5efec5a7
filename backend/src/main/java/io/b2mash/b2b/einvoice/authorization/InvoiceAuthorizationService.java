package io.b2mash.b2b.einvoice.authorization;

import io.b2mash.b2b.einvoice.authority.AuthorityClient;
import io.b2mash.b2b.einvoice.authority.AuthorityCredentials;
import io.b2mash.b2b.einvoice.authority.AuthorityDecision;
import io.b2mash.b2b.einvoice.authority.AuthorityProperties;
import io.b2mash.b2b.einvoice.authority.request.AuthorizationRequestBuilder;
import io.b2mash.b2b.einvoice.authority.request.RequestDocument;
import io.b2mash.b2b.einvoice.authority.signing.RequestSigner;
import io.b2mash.b2b.einvoice.authority.signing.SignedRequest;
import io.b2mash.b2b.einvoice.invoice.AmountCalculator;
import io.b2mash.b2b.einvoice.invoice.DocumentKind;
import io.b2mash.b2b.einvoice.invoice.Invoice;
import io.b2mash.b2b.einvoice.invoice.InvoiceTotals;
import io.b2mash.b2b.einvoice.invoice.InvoiceValidationService;
import io.b2mash.b2b.einvoice.numbering.InvoiceNumberService;
import io.b2mash.b2b.einvoice.support.TimeBoundedExecutor;
import io.b2mash.b2b.einvoice.verification.VerificationCodeGenerator;
import io.b2mash.b2b.einvoice.verification.VerificationImage;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for the UI/API layer: authorizes invoices and hands out sequence numbers.
 *
 * <p>Local faults (invalid lines, incomplete invoices, inconsistent totals, signing and encoding
 * failures) are thrown. Everything the Authority says, and any failure to reach it, comes back as
 * a rejected {@link AuthorizationResult}.
 */
@Service
public class InvoiceAuthorizationService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceAuthorizationService.class);

  private final AmountCalculator amountCalculator;
  private final InvoiceValidationService validationService;
  private final AuthorizationRequestBuilder requestBuilder;
  private final RequestSigner signer;
  private final AuthorityClient authorityClient;
  private final VerificationCodeGenerator verificationCodes;
  private final InvoiceNumberService numberService;
  private final AuthorityCredentials credentials;
  private final TimeBoundedExecutor executor;
  private final Duration defaultTimeout;

  public InvoiceAuthorizationService(
      AmountCalculator amountCalculator,
      InvoiceValidationService validationService,
      AuthorizationRequestBuilder requestBuilder,
      RequestSigner signer,
      AuthorityClient authorityClient,
      VerificationCodeGenerator verificationCodes,
      InvoiceNumberService numberService,
      AuthorityCredentials credentials,
      TimeBoundedExecutor authorityCallExecutor,
      AuthorityProperties properties) {
    this.amountCalculator = amountCalculator;
    this.validationService = validationService;
    this.requestBuilder = requestBuilder;
    this.signer = signer;
    this.authorityClient = authorityClient;
    this.verificationCodes = verificationCodes;
    this.numberService = numberService;
    this.credentials = credentials;
    this.executor = authorityCallExecutor;
    this.defaultTimeout = properties.requestTimeout();
  }

  public AuthorizationResult submitInvoice(Invoice invoice) {
    return submitInvoice(invoice, defaultTimeout);
  }

  /**
   * Builds, signs and submits the invoice, then renders its verification code.
   *
   * @param timeout upper bound for the Authority call; on expiry or interruption the call is
   *     cancelled and a rejected result is returned
   */
  public AuthorizationResult submitInvoice(Invoice invoice, Duration timeout) {
    RequestDocument document = requestBuilder.build(invoice, credentials);
    validationService.requireConsistentTotals(invoice);
    SignedRequest signed = signer.sign(document, credentials);

    log.info(
        "Submitting invoice: salesPoint={}, kind={}, sequenceNumber={}, total={}",
        document.header().salesPoint(),
        invoice.documentKind(),
        invoice.sequenceNumber(),
        invoice.totalAmount());
    AuthorityDecision decision = callAuthority(signed, timeout);

    if (!decision.authorized()) {
      log.warn(
          "Invoice not authorized: sequenceNumber={}, reason={}",
          invoice.sequenceNumber(),
          decision.failureReason());
      return AuthorizationResult.rejected(
          decision.failureReason(), invoice.sequenceNumber(), decision.remarks());
    }

    VerificationImage image =
        verificationCodes.generate(invoice, credentials, decision.authorizationCode());
    return AuthorizationResult.authorized(
        decision.authorizationCode(),
        decision.expiryDate(),
        image,
        invoice.sequenceNumber(),
        decision.remarks());
  }

  /** Totals derived from the invoice's lines, for comparison with what the caller entered. */
  public InvoiceTotals computeTotals(Invoice invoice) {
    return amountCalculator.computeTotals(invoice.lines());
  }

  /** Allocates the next number for the configured sales point. */
  public long getNextNumber(DocumentKind kind) {
    return numberService.nextNumber(kind, credentials.salesPoint());
  }

  public long getNextNumber(DocumentKind kind, Duration timeout) {
    return numberService.nextNumber(kind, credentials.salesPoint(), timeout);
  }

  private AuthorityDecision callAuthority(SignedRequest signed, Duration timeout) {
    var remarks = signed.document().remarks();
    try {
      return executor.call(() -> authorityClient.submit(signed), timeout);
    } catch (TimeoutException e) {
      log.warn("Authority did not answer within {}", timeout);
      return AuthorityDecision.rejected("Authority did not answer within " + timeout, remarks);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Submission of sequenceNumber={} was cancelled", signed.document().sequenceNumber());
      return AuthorityDecision.rejected("Submission cancelled", remarks);
    } catch (ExecutionException e) {
      log.error("Authority call failed: {}", e.getCause().getMessage(), e.getCause());
      return AuthorityDecision.rejected(
          "Authority call failed: " + e.getCause().getMessage(), remarks);
    }
  }
}
