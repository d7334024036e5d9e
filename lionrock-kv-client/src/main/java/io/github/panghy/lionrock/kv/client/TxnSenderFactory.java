package io.github.panghy.lionrock.kv.client;

import io.github.panghy.lionrock.kv.proto.TxnType;

/**
 * Creates the senders a {@link DB} uses to talk to the store.
 */
public interface TxnSenderFactory {

  /**
   * @param type          Whether the transaction is a root transaction or a leaf of a distributed one.
   * @param gatewayNodeId The node that coordinates the transaction.
   * @return A new {@link TxnSender} for a single transaction.
   */
  TxnSender transactionalSender(TxnType type, int gatewayNodeId);

  /**
   * @return A sender for requests that are not part of a transaction.
   */
  Sender nonTransactionalSender();
}
