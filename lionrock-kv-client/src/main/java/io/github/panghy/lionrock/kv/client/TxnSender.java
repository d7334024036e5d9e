package io.github.panghy.lionrock.kv.client;

import io.github.panghy.lionrock.kv.proto.TxnMeta;

import java.util.concurrent.CompletableFuture;

/**
 * A {@link Sender} bound to one transaction. It attaches the transaction to every batch it sends and owns the retry
 * policy of the transaction.
 *
 * @author Clement Pang
 */
public interface TxnSender extends Sender {

  /**
   * @return The current state of the transaction (id, epoch, name).
   */
  TxnMeta getMeta();

  void setDebugName(String name);

  /**
   * Decide whether the transaction can be retried after the given error. When it can, the returned future completes
   * after the back-off delay once the transaction has been prepared for the next attempt (e.g. its epoch advanced).
   * Otherwise the future fails with the error that should be surfaced to the caller.
   */
  CompletableFuture<Void> onError(Throwable e);

  /**
   * Abort the transaction, discarding its writes.
   */
  CompletableFuture<Void> rollback();
}
