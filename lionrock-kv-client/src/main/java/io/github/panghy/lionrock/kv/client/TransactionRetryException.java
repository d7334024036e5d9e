package io.github.panghy.lionrock.kv.client;

import com.google.protobuf.ByteString;

/**
 * Signals that the transaction identified by {@link #getTxnId()} hit a serialization conflict and should be retried
 * from the start with a refreshed state.
 *
 * @author Clement Pang
 */
public class TransactionRetryException extends KvException {

  private final ByteString txnId;

  public TransactionRetryException(String message, ByteString txnId) {
    super(message, KvErrorCodes.error_code_transaction_retry);
    this.txnId = txnId;
  }

  public ByteString getTxnId() {
    return txnId;
  }
}
