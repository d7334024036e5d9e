package io.github.panghy.lionrock.kv.client;

/**
 * Wraps a {@link TransactionRetryException} that reached the top of {@link DB#txn}. It is not retryable so that an
 * enclosing retry loop does not mistake it for its own retry signal.
 */
public class TerminatedRetryableException extends KvException {

  public TerminatedRetryableException(TransactionRetryException cause) {
    super("terminated retryable error: " + cause.getMessage(), KvErrorCodes.error_code_terminated_retryable, cause);
  }
}
