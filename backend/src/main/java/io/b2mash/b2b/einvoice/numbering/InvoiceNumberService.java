package io.b2mash.b2b.einvoice.numbering;

import io.b2mash.b2b.einvoice.authority.AuthorityProperties;
import io.b2mash.b2b.einvoice.exception.NumberingException;
import io.b2mash.b2b.einvoice.invoice.DocumentKind;
import io.b2mash.b2b.einvoice.support.TimeBoundedExecutor;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Allocates sequence numbers per (sales point, document kind).
 *
 * <ul>
 *   <li>Each counter is seeded once from the {@link SequenceSource}, then advanced in memory
 *   <li>Allocation is an atomic increment: concurrent callers never receive the same number and
 *       numbers are gap-free within the process
 *   <li>The seed lookup is the only blocking step; if it times out or is interrupted no counter is
 *       created
 * </ul>
 */
@Service
public class InvoiceNumberService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceNumberService.class);

  private record CounterKey(int salesPoint, DocumentKind kind) {}

  private final Map<CounterKey, AtomicLong> counters = new ConcurrentHashMap<>();
  private final SequenceSource sequenceSource;
  private final TimeBoundedExecutor executor;
  private final Duration defaultTimeout;

  public InvoiceNumberService(
      SequenceSource sequenceSource,
      TimeBoundedExecutor authorityCallExecutor,
      AuthorityProperties properties) {
    this.sequenceSource = sequenceSource;
    this.executor = authorityCallExecutor;
    this.defaultTimeout = properties.requestTimeout();
  }

  public long nextNumber(DocumentKind kind, int salesPoint) {
    return nextNumber(kind, salesPoint, defaultTimeout);
  }

  /**
   * Allocates the next number.
   *
   * @param timeout upper bound for the counter seed lookup
   * @throws NumberingException if the counter source is unavailable, slow or the call is
   *     interrupted
   */
  public long nextNumber(DocumentKind kind, int salesPoint, Duration timeout) {
    if (kind == null || salesPoint <= 0) {
      throw new NumberingException(
          "Invalid numbering key", "A document kind and a positive sales point are required");
    }
    var key = new CounterKey(salesPoint, kind);
    AtomicLong counter = counters.get(key);
    if (counter == null) {
      long seed = fetchSeed(key, timeout);
      counter = counters.computeIfAbsent(key, k -> new AtomicLong(seed));
    }
    long number = counter.incrementAndGet();
    log.info("Allocated sequence number {} for salesPoint={}, kind={}", number, salesPoint, kind);
    return number;
  }

  private long fetchSeed(CounterKey key, Duration timeout) {
    try {
      long seed =
          executor.call(() -> sequenceSource.lastIssued(key.kind(), key.salesPoint()), timeout);
      if (seed < 0) {
        throw new NumberingException(
            "Invalid counter", "Counter source returned a negative number: " + seed);
      }
      return seed;
    } catch (TimeoutException e) {
      throw new NumberingException(
          "Counter unavailable", "Counter source did not answer within " + timeout, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new NumberingException("Numbering cancelled", "Counter lookup was interrupted", e);
    } catch (ExecutionException e) {
      log.error("Counter lookup failed for {}: {}", key, e.getCause().getMessage(), e.getCause());
      throw new NumberingException(
          "Counter unavailable",
          "Counter source failed: " + e.getCause().getMessage(),
          e.getCause());
    }
  }
}
