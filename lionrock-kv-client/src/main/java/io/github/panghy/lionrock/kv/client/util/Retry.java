package io.github.panghy.lionrock.kv.client.util;

/**
 * A blocking retry loop:
 * <pre>
 *   for (Retry r = Retry.start(options); r.next(); ) {
 *     // attempt, break or return on success.
 *   }
 * </pre>
 * The first call to {@link #next()} returns immediately, subsequent calls sleep for the back-off delay. {@link #next()}
 * returns false once the retries are exhausted or the thread is interrupted (the interrupt flag is preserved).
 */
public class Retry {

  private final RetryOptions options;
  private boolean started;
  private int retries;

  private Retry(RetryOptions options) {
    this.options = options;
  }

  public static Retry start(RetryOptions options) {
    return new Retry(options);
  }

  public boolean next() {
    if (!started) {
      started = true;
      return true;
    }
    if (!options.canRetry(retries) || Thread.currentThread().isInterrupted()) {
      return false;
    }
    long delayMs = options.backoffMillis(retries);
    retries++;
    if (delayMs > 0) {
      try {
        Thread.sleep(delayMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    }
    return true;
  }

  /**
   * @return The number of retries made so far.
   */
  public int getRetries() {
    return retries;
  }
}
