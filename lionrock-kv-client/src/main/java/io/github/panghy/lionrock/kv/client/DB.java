package io.github.panghy.lionrock.kv.client;

import io.github.panghy.lionrock.kv.client.impl.CrossRangeTxnWrapperSender;
import io.github.panghy.lionrock.kv.client.impl.Requests;
import io.github.panghy.lionrock.kv.client.mixins.KvOperationsMixin;
import io.github.panghy.lionrock.kv.proto.*;
import io.grpc.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static com.apple.foundationdb.async.AsyncUtil.*;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * Handle to a range-partitioned key-value store. Single operations are sent as one-operation batches (see
 * {@link KvOperationsMixin}), groups of operations with {@link #run(Batch)} and transactions with
 * {@link #txn(Function)}.
 * <p>
 * Non-transactional batches are sent through a {@link CrossRangeTxnWrapperSender}: a batch that the store refuses to
 * execute outside of a transaction (because it spans ranges) is transparently re-run as a transaction.
 * <p>
 * A DB is safe for concurrent use.
 *
 * @author Clement Pang
 */
public class DB implements KvOperationsMixin {

  private static final Logger logger = LoggerFactory.getLogger(DB.class);

  private final TxnSenderFactory factory;
  private final Clock clock;
  private final DBContext ctx;
  /**
   * Sender used for non-transactional requests.
   */
  private final CrossRangeTxnWrapperSender crs;

  public DB(TxnSenderFactory factory, Clock clock) {
    this(factory, clock, DBContext.defaults());
  }

  public DB(TxnSenderFactory factory, Clock clock, DBContext ctx) {
    this.factory = factory;
    this.clock = clock;
    this.ctx = ctx;
    this.crs = new CrossRangeTxnWrapperSender(this, factory.nonTransactionalSender());
  }

  /**
   * @return A sender for non-transactional requests that wraps requests spanning ranges into transactions. It must
   * not be used to send transactional requests.
   */
  public Sender nonTransactionalSender() {
    return crs;
  }

  public TxnSenderFactory getFactory() {
    return factory;
  }

  public Clock getClock() {
    return clock;
  }

  public DBContext getContext() {
    return ctx;
  }

  public Executor getExecutor() {
    return ctx.getExecutor();
  }

  @Override
  public Batch newBatch() {
    return new Batch();
  }

  /**
   * Run the operations of the batch. The batch is atomic: either all of its operations succeed or none of them do.
   * Results are available in {@link Batch#getResults()} whether or not the batch failed.
   *
   * @throws RuntimeException The first error of the batch.
   */
  @Override
  public void run(Batch b) {
    try {
      runAsync(b).join();
    } catch (CompletionException | CancellationException e) {
      throw KvErrors.unwrapToRuntimeException(e);
    }
  }

  @Override
  public CompletableFuture<Void> runAsync(Batch b) {
    b.markUsed();
    RuntimeException err = b.prepare();
    if (err != null) {
      return failedFuture(err);
    }
    return b.sendAndFill(this::send);
  }

  /**
   * Split the range that contains {@code spanKey} at {@code splitKey}.
   */
  public void adminSplit(Object spanKey, Object splitKey) {
    Batch b = newBatch();
    b.adminSplit(spanKey, splitKey);
    getOneResult(b);
  }

  /**
   * Merge the range that contains {@code key} with the range that follows it.
   */
  public void adminMerge(Object key) {
    Batch b = newBatch();
    b.adminMerge(key);
    getOneResult(b);
  }

  /**
   * Transfer the lease of the range that contains {@code key} to another one of its replicas.
   */
  public void adminTransferLease(Object key, int targetStoreId) {
    Batch b = newBatch();
    b.adminTransferLease(key, targetStoreId);
    getOneResult(b);
  }

  /**
   * Add or remove replicas of the range that contains {@code key}. {@code expDesc} must match the current descriptor
   * of the range.
   *
   * @return The updated descriptor.
   */
  public RangeDescriptor adminChangeReplicas(Object key, ReplicaChangeType changeType,
                                             List<ReplicationTarget> targets, RangeDescriptor expDesc) {
    Batch b = newBatch();
    b.adminChangeReplicas(key, changeType, targets, expDesc);
    getOneResult(b);
    BatchResponse response = b.getRawResponse();
    if (response == null || response.getResponsesCount() == 0) {
      throw new KvException("unexpected empty responses for AdminChangeReplicas",
          KvErrorCodes.error_code_internal_error);
    }
    ResponseUnion first = response.getResponses(0);
    if (!first.hasAdminChangeReplicas()) {
      throw new KvException("unexpected response of type " + first.getValueCase() + " for AdminChangeReplicas",
          KvErrorCodes.error_code_internal_error);
    }
    return first.getAdminChangeReplicas().getDesc();
  }

  /**
   * Move the replicas of the range that contains {@code key} onto the given targets.
   */
  public void adminRelocateRange(Object key, List<ReplicationTarget> targets) {
    Batch b = newBatch();
    b.adminRelocateRange(key, targets);
    getOneResult(b);
  }

  /**
   * Run {@code retryable} in a transaction named "unnamed", see {@link #txn(String, Function)}.
   */
  public <T> T txn(Function<? super Txn, T> retryable) {
    return txn("unnamed", retryable);
  }

  /**
   * Run {@code retryable} in a transaction and commit it. The closure is re-executed (with the same {@link Txn}) for
   * as long as the transaction coordinator deems the failures retryable, it must therefore be idempotent apart from
   * its effects through the transaction. The transaction is committed after the closure returns unless the closure
   * committed it itself (see {@link Txn#commitInBatch(Batch)}).
   * <p>
   * On a terminal failure the transaction is rolled back and the error is thrown. A
   * {@link TransactionRetryException} that could not be retried is thrown as a {@link TerminatedRetryableException} so
   * that it cannot cause an enclosing transaction to be retried.
   */
  public <T> T txn(String name, Function<? super Txn, T> retryable) {
    Txn txn = new Txn(this, ctx.getNodeId().get(), TxnType.ROOT);
    txn.setDebugName(name);
    RuntimeException failure;
    while (true) {
      if (Context.current().isCancelled()) {
        failure = cancelled();
        break;
      }
      try {
        T returnVal = retryable.apply(txn);
        txn.commit();
        return returnVal;
      } catch (RuntimeException err) {
        try {
          txn.onError(KvErrors.unwrap(err)).join();
        } catch (CompletionException | CancellationException terminal) {
          failure = KvErrors.unwrapToRuntimeException(terminal);
          break;
        }
      }
    }
    txn.cleanupOnError(failure);
    throw terminate(failure);
  }

  public <T> CompletableFuture<T> txnAsync(Function<? super Txn, ? extends CompletableFuture<T>> retryable) {
    return txnAsync("unnamed", retryable);
  }

  /**
   * Asynchronous version of {@link #txn(String, Function)}, the closure and the retries run on the executor of the
   * {@link DBContext}.
   */
  public <T> CompletableFuture<T> txnAsync(String name,
                                           Function<? super Txn, ? extends CompletableFuture<T>> retryable) {
    Executor e = ctx.getExecutor();
    Txn txn = new Txn(this, ctx.getNodeId().get(), TxnType.ROOT);
    txn.setDebugName(name);
    AtomicReference<T> returnValue = new AtomicReference<>();
    return whileTrue(() -> {
      if (Context.current().isCancelled()) {
        return failedFuture(cancelled());
      }
      return composeHandleAsync(
          applySafely(retryable, txn).
              thenComposeAsync(returnVal ->
                  txn.commitAsync().thenApply(o -> {
                    returnValue.set(returnVal);
                    return false;
                  }), e),
          (value, t) -> {
            if (t == null) {
              return completedFuture(value);
            }
            return txn.onError(KvErrors.unwrap(t)).thenApply(o -> true);
          }, e);
    }, e).
        handle((o, t) -> t).
        thenCompose(t -> {
          if (t == null) {
            return completedFuture(returnValue.get());
          }
          RuntimeException failure = KvErrors.unwrapToRuntimeException(t);
          return txn.cleanupOnErrorAsync(failure).<T>thenApply(v -> {
            throw terminate(failure);
          });
        });
  }

  /**
   * Send a batch through the non-transactional sender.
   */
  CompletableFuture<BatchResponse> send(BatchRequest request) {
    return sendUsingSender(request, crs);
  }

  /**
   * Validate the batch, fill in defaults from the {@link DBContext} and send it with the given sender.
   */
  CompletableFuture<BatchResponse> sendUsingSender(BatchRequest request, Sender sender) {
    if (request.getRequestsCount() == 0) {
      return completedFuture(BatchResponse.getDefaultInstance());
    }
    ReadConsistency readConsistency = request.getHeader().getReadConsistency();
    if (readConsistency != ReadConsistency.CONSISTENT) {
      for (RequestUnion r : request.getRequestsList()) {
        if (Requests.isWrite(r)) {
          return failedFuture(new KvException("read consistency " + readConsistency +
              " does not support write requests", KvErrorCodes.error_code_read_consistency_unsupported));
        }
      }
    }
    if (Context.current().isCancelled()) {
      return failedFuture(cancelled());
    }
    BatchRequest.Builder builder = request.toBuilder();
    Header.Builder header = builder.getHeaderBuilder();
    if (header.getUserPriority() == 0) {
      header.setUserPriority(ctx.getUserPriority());
    }
    if (header.getTimestamp() == 0) {
      Instant now = clock.instant();
      header.setTimestamp(TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano());
    }
    return sender.send(builder.build()).whenComplete((response, t) -> {
      if (t != null && logger.isDebugEnabled()) {
        logger.debug("failed batch of {} request(s): {}", request.getRequestsCount(),
            KvErrors.unwrap(t).getMessage());
      }
    });
  }

  private static OperationCancelledException cancelled() {
    return new OperationCancelledException("context cancelled", Context.current().cancellationCause());
  }

  private static RuntimeException terminate(RuntimeException failure) {
    if (failure instanceof TransactionRetryException) {
      return new TerminatedRetryableException((TransactionRetryException) failure);
    }
    return failure;
  }
}
