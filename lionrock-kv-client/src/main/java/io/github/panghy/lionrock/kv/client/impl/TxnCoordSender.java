package io.github.panghy.lionrock.kv.client.impl;

import com.google.protobuf.ByteString;
import io.github.panghy.lionrock.kv.client.*;
import io.github.panghy.lionrock.kv.client.util.RetryOptions;
import io.github.panghy.lionrock.kv.proto.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * Client-side transaction coordinator. Every batch it sends carries the {@link TxnMeta} of the transaction, the store
 * keeps the writes of the transaction pending until a batch with an EndTransaction request commits or aborts them.
 * <p>
 * Retryable errors (see {@link KvErrorCodes#isRetryable(int)}) restart the transaction with a higher epoch after a
 * full-jitter back-off, until {@link RetryOptions#getMaxRetries()} is reached.
 *
 * @author Clement Pang
 */
public class TxnCoordSender implements TxnSender {

  private static final Logger logger = LoggerFactory.getLogger(TxnCoordSender.class);

  private final Sender wrapped;
  private final RetryOptions retryOptions;
  private final Executor executor;
  private final TxnMeta.Builder meta;
  private int retries;
  private boolean finalized;

  public TxnCoordSender(Sender wrapped, TxnType type, int gatewayNodeId, RetryOptions retryOptions,
                        Executor executor) {
    this.wrapped = wrapped;
    this.retryOptions = retryOptions;
    this.executor = executor;
    this.meta = TxnMeta.newBuilder().
        setId(newTxnId()).
        setType(type).
        setGatewayNodeId(gatewayNodeId).
        setName("unnamed");
  }

  @Override
  public synchronized TxnMeta getMeta() {
    return meta.build();
  }

  @Override
  public synchronized void setDebugName(String name) {
    meta.setName(name);
  }

  @Override
  public CompletableFuture<BatchResponse> send(BatchRequest request) {
    TxnMeta txnMeta;
    synchronized (this) {
      if (finalized) {
        return failedFuture(new KvException("transaction " + meta.getName() + " is already finalized",
            KvErrorCodes.error_code_transaction_status));
      }
      if (meta.getPriority() == 0) {
        meta.setPriority(request.getHeader().getUserPriority());
      }
      txnMeta = meta.build();
    }
    BatchRequest.Builder builder = request.toBuilder();
    builder.getHeaderBuilder().setTxn(txnMeta);
    boolean endsTxn = Requests.endsTransaction(request);
    return wrapped.send(builder.build()).thenApply(response -> {
      if (endsTxn) {
        synchronized (this) {
          // a retry may have restarted the transaction in the meantime.
          if (meta.getEpoch() == txnMeta.getEpoch()) {
            finalized = true;
          }
        }
      }
      return response;
    });
  }

  @Override
  public CompletableFuture<Void> onError(Throwable e) {
    Throwable unwrapped = KvErrors.unwrap(e);
    if (!(unwrapped instanceof KvException) || !((KvException) unwrapped).isRetryable()) {
      return failedFuture(unwrapped);
    }
    int retry;
    String name;
    synchronized (this) {
      if (!retryOptions.canRetry(retries)) {
        if (logger.isDebugEnabled()) {
          logger.debug("transaction {} exhausted its {} retries, last error: {}", meta.getName(), retries,
              unwrapped.getMessage());
        }
        return failedFuture(unwrapped);
      }
      retry = retries++;
      name = meta.getName();
    }
    long delayMs = retryOptions.backoffMillis(retry);
    if (logger.isDebugEnabled()) {
      logger.debug("retrying transaction {} (retry {}) in {}ms after: {}", name, retry + 1, delayMs,
          unwrapped.getMessage());
    }
    return CompletableFuture.runAsync(() -> {
      synchronized (this) {
        meta.setEpoch(meta.getEpoch() + 1);
        finalized = false;
      }
    }, CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS, executor));
  }

  @Override
  public CompletableFuture<Void> rollback() {
    TxnMeta txnMeta;
    synchronized (this) {
      if (finalized) {
        return completedFuture(null);
      }
      finalized = true;
      txnMeta = meta.build();
    }
    BatchRequest request = BatchRequest.newBuilder().
        setHeader(Header.newBuilder().setTxn(txnMeta)).
        addRequests(RequestUnion.newBuilder().
            setEndTransaction(EndTransactionRequest.newBuilder().setCommit(false))).
        build();
    return wrapped.send(request).thenApply(response -> null);
  }

  private static ByteString newTxnId() {
    UUID uuid = UUID.randomUUID();
    ByteBuffer buffer = ByteBuffer.allocate(16);
    buffer.putLong(uuid.getMostSignificantBits());
    buffer.putLong(uuid.getLeastSignificantBits());
    return ByteString.copyFrom(buffer.array());
  }
}
