package io.b2mash.b2b.einvoice.authority;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.einvoice.authority.signing.SignedRequest;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Stand-in for the Authority used in development and tests. Every request is approved with a
 * random 14-digit code valid for {@value #VALIDITY_DAYS} days from the current date. Codes are
 * remembered per (sales point, document type, sequence number) in a cache bounded to {@value
 * #MAXIMUM_REMEMBERED} entries, so a long-running process does not grow without limit.
 */
@Component
@ConditionalOnProperty(name = "authority.mode", havingValue = "simulated", matchIfMissing = true)
public class SimulatedAuthorityClient implements AuthorityClient {

  private static final Logger log = LoggerFactory.getLogger(SimulatedAuthorityClient.class);

  static final int VALIDITY_DAYS = 10;
  static final String AUTHORIZED_REMARK = "Invoice authorized";
  static final long MAXIMUM_REMEMBERED = 10_000;

  private static final long SMALLEST_CODE = 10_000_000_000_000L;
  private static final long CODE_BOUND = 100_000_000_000_000L;

  private record SubmissionKey(int salesPoint, int documentTypeCode, long sequenceNumber) {}

  private final Cache<SubmissionKey, AuthorityDecision> issued;
  private final Clock clock;

  @Autowired
  public SimulatedAuthorityClient(Clock clock) {
    this(clock, MAXIMUM_REMEMBERED);
  }

  /** Evictions run on the calling thread so {@link #issuedCount()} is exact after a submit. */
  SimulatedAuthorityClient(Clock clock, long maximumRemembered) {
    this.clock = clock;
    this.issued =
        Caffeine.newBuilder().maximumSize(maximumRemembered).executor(Runnable::run).build();
  }

  @Override
  public AuthorityDecision submit(SignedRequest request) {
    var document = request.document();
    var key =
        new SubmissionKey(
            document.header().salesPoint(),
            document.header().documentTypeCode(),
            document.sequenceNumber());

    var existing = issued.getIfPresent(key);
    if (existing != null) {
      log.info(
          "Simulated authority: {} already authorized, returning code {}",
          key,
          existing.authorizationCode());
      return existing;
    }
    return issued.get(key, k -> approve(request));
  }

  long issuedCount() {
    issued.cleanUp();
    return issued.estimatedSize();
  }

  private AuthorityDecision approve(SignedRequest request) {
    String code = Long.toString(ThreadLocalRandom.current().nextLong(SMALLEST_CODE, CODE_BOUND));
    LocalDate expiry = LocalDate.now(clock).plusDays(VALIDITY_DAYS);
    var remarks = new ArrayList<>(request.document().remarks());
    remarks.add(AUTHORIZED_REMARK);
    log.info(
        "Simulated authority: approved salesPoint={}, sequenceNumber={}, code={}, expires={}",
        request.document().header().salesPoint(),
        request.document().sequenceNumber(),
        code,
        expiry);
    return AuthorityDecision.approved(code, expiry, remarks);
  }
}
