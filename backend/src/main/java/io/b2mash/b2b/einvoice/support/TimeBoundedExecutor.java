package io.b2mash.b2b.einvoice.support;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs blocking calls on a dedicated pool so the caller can bound them with a timeout. If the
 * timeout expires or the calling thread is interrupted, the call is cancelled (its worker thread
 * is interrupted) before the exception is rethrown.
 */
public class TimeBoundedExecutor implements AutoCloseable {

  private final ExecutorService executor;

  public TimeBoundedExecutor(ExecutorService executor) {
    this.executor = executor;
  }

  /**
   * @throws TimeoutException if {@code task} did not finish within {@code timeout}
   * @throws InterruptedException if the calling thread was interrupted while waiting
   * @throws ExecutionException if {@code task} threw; the cause is the original exception
   */
  public <T> T call(Callable<T> task, Duration timeout)
      throws TimeoutException, InterruptedException, ExecutionException {
    Future<T> future = executor.submit(task);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException | InterruptedException e) {
      future.cancel(true);
      throw e;
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
