package io.github.panghy.lionrock.kv.client.impl;

import com.google.common.base.Preconditions;
import io.github.panghy.lionrock.kv.client.*;
import io.github.panghy.lionrock.kv.proto.BatchRequest;
import io.github.panghy.lionrock.kv.proto.BatchResponse;
import io.github.panghy.lionrock.kv.proto.RequestUnion;
import io.github.panghy.lionrock.kv.proto.ResponseUnion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

import static com.apple.foundationdb.async.AsyncUtil.composeHandle;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * A {@link Sender} for non-transactional batches. Batches that the store refuses to execute outside of a transaction
 * (because they span ranges) are re-run as an "auto-wrap" transaction that commits in the same batch, the caller
 * receives a response that is indistinguishable from the one of a plain non-transactional batch.
 *
 * @author Clement Pang
 */
public class CrossRangeTxnWrapperSender implements Sender {

  private static final Logger logger = LoggerFactory.getLogger(CrossRangeTxnWrapperSender.class);

  private final DB db;
  private final Sender wrapped;

  public CrossRangeTxnWrapperSender(DB db, Sender wrapped) {
    this.db = db;
    this.wrapped = wrapped;
  }

  /**
   * @throws IllegalStateException if the request is transactional.
   */
  @Override
  public CompletableFuture<BatchResponse> send(BatchRequest request) {
    Preconditions.checkState(!request.getHeader().hasTxn(),
        "CrossRangeTxnWrapperSender can't handle transactional requests");
    return composeHandle(wrapped.send(request), (response, t) -> {
      if (t == null) {
        return completedFuture(response);
      }
      Throwable err = KvErrors.unwrap(t);
      if (!(err instanceof KvException) ||
          ((KvException) err).getCode() != KvErrorCodes.error_code_op_requires_txn) {
        return failedFuture(err);
      }
      if (logger.isDebugEnabled()) {
        logger.debug("wrapping batch of {} request(s) in a transaction: {}", request.getRequestsCount(),
            err.getMessage());
      }
      return db.txnAsync("auto-wrap", txn -> {
        Batch b = txn.newBatch();
        b.getHeader().mergeFrom(request.getHeader());
        b.addRawRequest(request.getRequestsList().toArray(new RequestUnion[0]));
        return txn.commitInBatchAsync(b).thenApply(v -> b.getRawResponse());
      }).thenApply(txnResponse -> hideTxn(request, txnResponse));
    });
  }

  /**
   * @return The sender this sender delegates to.
   */
  public Sender getWrapped() {
    return wrapped;
  }

  /**
   * Strip the transaction from the response and drop the response to the EndTransaction request that the auto-wrap
   * appended, sequence ids are mapped back to the ones of the original request.
   */
  private static BatchResponse hideTxn(BatchRequest request, BatchResponse txnResponse) {
    BatchResponse.Builder builder = BatchResponse.newBuilder();
    builder.getHeaderBuilder().setNow(txnResponse.getHeader().getNow());
    for (ResponseUnion response : txnResponse.getResponsesList()) {
      long sequenceId = response.getSequenceId();
      if (sequenceId >= 0 && sequenceId < request.getRequestsCount()) {
        builder.addResponses(response.toBuilder().
            setSequenceId(request.getRequests((int) sequenceId).getSequenceId()));
      }
    }
    return builder.build();
  }
}
