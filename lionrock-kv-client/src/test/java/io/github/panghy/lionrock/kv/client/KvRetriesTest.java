package io.github.panghy.lionrock.kv.client;

import com.google.common.util.concurrent.MoreExecutors;
import io.github.panghy.lionrock.kv.client.impl.TxnCoordSenderFactory;
import io.github.panghy.lionrock.kv.client.util.RetryOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class KvRetriesTest {

  private static final RetryOptions TWO_RETRIES = RetryOptions.newBuilder().
      setInitialBackoffMillis(0).
      setMaxBackoffMillis(0).
      setMaxRetries(2).
      build();

  private EchoSender store;
  private DB db;

  @BeforeEach
  void setUp() {
    store = new EchoSender();
    db = new DB(new TxnCoordSenderFactory(store, MoreExecutors.directExecutor()), Clock.systemUTC(),
        DBContext.newBuilder().setExecutor(MoreExecutors.directExecutor()).build());
  }

  @Test
  void incrementValRetryable_retriesAmbiguousResults() {
    store.failNext(new KvException("timed out", KvErrorCodes.error_code_ambiguous_result));
    assertEquals(3, KvRetries.incrementValRetryable(db, "counter", 3, TWO_RETRIES));
    assertEquals(2, store.getRequests().size());
  }

  @Test
  void incrementValRetryable_nonRetryable() {
    store.failNext(new KvException("not an int", KvErrorCodes.error_code_value_type_mismatch));
    KvException e = assertThrows(KvException.class,
        () -> KvRetries.incrementValRetryable(db, "counter", 3, TWO_RETRIES));
    assertEquals(KvErrorCodes.error_code_value_type_mismatch, e.getCode());
    assertEquals(1, store.getRequests().size());
  }

  @Test
  void incrementValRetryable_exhausted() {
    for (int i = 0; i < 3; i++) {
      store.failNext(new KvException("unhandled " + i, KvErrorCodes.error_code_unhandled_retryable));
    }
    KvException e = assertThrows(KvException.class,
        () -> KvRetries.incrementValRetryable(db, "counter", 3, TWO_RETRIES));
    assertEquals("unhandled 2 (code: 1004)", e.getMessage());
    assertEquals(3, store.getRequests().size());
  }

  @Test
  void defaultRetryOptions_areBounded() {
    assertEquals(10, KvRetries.DEFAULT_RETRY_OPTIONS.getMaxRetries());
    assertTrue(KvRetries.DEFAULT_RETRY_OPTIONS.canRetry(9));
    assertFalse(KvRetries.DEFAULT_RETRY_OPTIONS.canRetry(10));
  }

  @Test
  void incrementValRetryable_defaultOptions() {
    store.failNext(new KvException("timed out", KvErrorCodes.error_code_ambiguous_result));
    assertEquals(4, KvRetries.incrementValRetryable(db, "counter", 4));
    assertEquals(2, store.getRequests().size());
  }
}
