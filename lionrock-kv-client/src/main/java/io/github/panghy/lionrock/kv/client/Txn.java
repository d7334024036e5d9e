package io.github.panghy.lionrock.kv.client;

import com.google.common.base.Preconditions;
import com.google.protobuf.ByteString;
import io.github.panghy.lionrock.kv.client.mixins.KvOperationsMixin;
import io.github.panghy.lionrock.kv.proto.ReadConsistency;
import io.github.panghy.lionrock.kv.proto.TxnMeta;
import io.github.panghy.lionrock.kv.proto.TxnType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * A transaction handle, usually obtained through {@link DB#txn(java.util.function.Function)}. Operations run through
 * the {@link TxnSender} of the transaction, which attaches the transaction to every batch.
 * <p>
 * A Txn is meant to be used by a single caller at a time.
 *
 * @author Clement Pang
 */
public class Txn implements KvOperationsMixin {

  private static final Logger logger = LoggerFactory.getLogger(Txn.class);

  private final DB db;
  private final TxnSender sender;
  private final TxnType type;
  private volatile String debugName = "unnamed";
  /**
   * Set once the transaction committed or rolled back, reset when it is restarted for a retry.
   */
  private volatile boolean finalized;

  public Txn(DB db, int gatewayNodeId, TxnType type) {
    Preconditions.checkArgument(type == TxnType.ROOT || gatewayNodeId != 0,
        "leaf transactions must have a gateway node");
    this.db = db;
    this.type = type;
    this.sender = db.getFactory().transactionalSender(type, gatewayNodeId);
  }

  public DB getDB() {
    return db;
  }

  public TxnType getType() {
    return type;
  }

  public TxnMeta getMeta() {
    return sender.getMeta();
  }

  public void setDebugName(String name) {
    this.debugName = name;
    sender.setDebugName(name);
  }

  public String getDebugName() {
    return debugName;
  }

  /**
   * @return Whether the transaction has committed or rolled back (and has not been restarted since).
   */
  public boolean isFinalized() {
    return finalized;
  }

  @Override
  public Batch newBatch() {
    return new Batch(this);
  }

  @Override
  public void run(Batch b) {
    join(runAsync(b));
  }

  /**
   * Run a batch as part of the transaction. Only {@link ReadConsistency#CONSISTENT} batches are allowed.
   */
  @Override
  public CompletableFuture<Void> runAsync(Batch b) {
    b.markUsed();
    ReadConsistency readConsistency = b.getHeader().getReadConsistency();
    if (readConsistency != ReadConsistency.CONSISTENT) {
      return failedFuture(new KvException("cannot use " + readConsistency + " read consistency in a transaction",
          KvErrorCodes.error_code_read_consistency_unsupported));
    }
    RuntimeException err = b.prepare();
    if (err != null) {
      return failedFuture(err);
    }
    boolean endsTxn = b.endsTxn();
    return b.sendAndFill(request -> db.sendUsingSender(request, sender)).thenApply(v -> {
      if (endsTxn) {
        finalized = true;
      }
      return v;
    });
  }

  /**
   * Run the batch and commit the transaction in the same exchange.
   */
  public void commitInBatch(Batch b) {
    join(commitInBatchAsync(b));
  }

  public CompletableFuture<Void> commitInBatchAsync(Batch b) {
    Preconditions.checkArgument(b.txn == this, "a batch can only be committed by the transaction that created it");
    b.endTxn(true);
    return runAsync(b);
  }

  /**
   * Commit the transaction, nothing is sent if it has already been committed (e.g. with
   * {@link #commitInBatch(Batch)}).
   */
  public void commit() {
    join(commitAsync());
  }

  public CompletableFuture<Void> commitAsync() {
    if (finalized) {
      return completedFuture(null);
    }
    Batch b = newBatch();
    b.endTxn(true);
    return runAsync(b);
  }

  /**
   * Abort the transaction and discard its writes.
   */
  public void rollback() {
    join(rollbackAsync());
  }

  public CompletableFuture<Void> rollbackAsync() {
    if (finalized) {
      return completedFuture(null);
    }
    return sender.rollback().thenApply(v -> {
      finalized = true;
      return v;
    });
  }

  /**
   * Roll back the transaction after {@code err} ended it. Failures to roll back are logged and not thrown.
   */
  public void cleanupOnError(Throwable err) {
    cleanupOnErrorAsync(err).join();
  }

  /**
   * Asynchronous version of {@link #cleanupOnError(Throwable)}, the returned future never fails.
   */
  public CompletableFuture<Void> cleanupOnErrorAsync(Throwable err) {
    Preconditions.checkNotNull(err, "cleanupOnError() requires an error");
    CompletableFuture<Void> rollback;
    try {
      rollback = rollbackAsync();
    } catch (RuntimeException e) {
      rollback = failedFuture(e);
    }
    return rollback.exceptionally(t -> {
      logger.warn("failure aborting transaction {}: {}; abort caused by: {}", debugName,
          KvErrors.unwrap(t).getMessage(), err.getMessage());
      return null;
    });
  }

  /**
   * Prepare the transaction for another attempt after {@code e}. The returned future completes once the transaction
   * can be retried and fails (with the error to surface) when it cannot. A {@link TransactionRetryException} for
   * another transaction is never retried.
   */
  public CompletableFuture<Void> onError(Throwable e) {
    Throwable unwrapped = KvErrors.unwrap(e);
    if (unwrapped instanceof TransactionRetryException) {
      ByteString txnId = ((TransactionRetryException) unwrapped).getTxnId();
      if (!txnId.isEmpty() && !txnId.equals(sender.getMeta().getId())) {
        return failedFuture(unwrapped);
      }
    }
    return sender.onError(unwrapped).thenApply(v -> {
      finalized = false;
      return v;
    });
  }

  private static void join(CompletableFuture<Void> future) {
    try {
      future.join();
    } catch (CompletionException | CancellationException e) {
      throw KvErrors.unwrapToRuntimeException(e);
    }
  }

  @Override
  public String toString() {
    return "Txn{" + debugName + ", epoch=" + sender.getMeta().getEpoch() + "}";
  }
}
