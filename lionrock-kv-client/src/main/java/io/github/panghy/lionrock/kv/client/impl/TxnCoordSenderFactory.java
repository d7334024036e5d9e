package io.github.panghy.lionrock.kv.client.impl;

import io.github.panghy.lionrock.kv.client.Sender;
import io.github.panghy.lionrock.kv.client.TxnSender;
import io.github.panghy.lionrock.kv.client.TxnSenderFactory;
import io.github.panghy.lionrock.kv.client.util.RetryOptions;
import io.github.panghy.lionrock.kv.proto.TxnType;

import java.util.concurrent.Executor;

/**
 * Creates {@link TxnCoordSender}s that all send through the same {@link Sender}.
 */
public class TxnCoordSenderFactory implements TxnSenderFactory {

  /**
   * Retry policy of transactions when none is given.
   */
  public static final RetryOptions DEFAULT_RETRY_OPTIONS = RetryOptions.newBuilder().
      setInitialBackoffMillis(2).
      setMaxBackoffMillis(1000).
      setMaxRetries(100).
      build();

  private final Sender wrapped;
  private final RetryOptions retryOptions;
  private final Executor executor;

  public TxnCoordSenderFactory(Sender wrapped, Executor executor) {
    this(wrapped, DEFAULT_RETRY_OPTIONS, executor);
  }

  public TxnCoordSenderFactory(Sender wrapped, RetryOptions retryOptions, Executor executor) {
    this.wrapped = wrapped;
    this.retryOptions = retryOptions;
    this.executor = executor;
  }

  @Override
  public TxnSender transactionalSender(TxnType type, int gatewayNodeId) {
    return new TxnCoordSender(wrapped, type, gatewayNodeId, retryOptions, executor);
  }

  @Override
  public Sender nonTransactionalSender() {
    return wrapped;
  }

  public RetryOptions getRetryOptions() {
    return retryOptions;
  }
}
