package io.github.panghy.lionrock.kv.client;

import io.github.panghy.lionrock.kv.client.util.Retry;
import io.github.panghy.lionrock.kv.client.util.RetryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry helpers for non-transactional operations.
 */
public abstract class KvRetries {

  private static final Logger logger = LoggerFactory.getLogger(KvRetries.class);

  /**
   * Options of {@link #incrementValRetryable(DB, Object, long)}: the default back-off, capped at 10 retries.
   */
  public static final RetryOptions DEFAULT_RETRY_OPTIONS = RetryOptions.newBuilder().
      setMaxRetries(10).
      build();

  /**
   * Increment the INT value of a key as a non-transactional operation that is retried on ambiguous and unhandled
   * retryable errors. Since a retried increment may already have been applied, the key can end up incremented more
   * than once.
   *
   * @return The new value.
   */
  public static long incrementValRetryable(DB db, Object key, long inc) {
    return incrementValRetryable(db, key, inc, DEFAULT_RETRY_OPTIONS);
  }

  public static long incrementValRetryable(DB db, Object key, long inc, RetryOptions retryOptions) {
    KvException lastError = null;
    for (Retry r = Retry.start(retryOptions); r.next(); ) {
      try {
        return db.inc(key, inc).valueInt();
      } catch (KvException e) {
        if (!KvErrorCodes.isRetryableNonTransactional(e.getCode())) {
          throw e;
        }
        if (logger.isDebugEnabled()) {
          logger.debug("retrying increment (retry {}) after: {}", r.getRetries() + 1, e.getMessage());
        }
        lastError = e;
      }
    }
    throw lastError;
  }
}
