package io.github.panghy.lionrock.kv.client;

/**
 * The caller cancelled the operation (or its deadline expired) while it was in flight. A transaction that already
 * committed is not rolled back.
 */
public class OperationCancelledException extends KvException {

  public OperationCancelledException(String message) {
    super(message, KvErrorCodes.error_code_operation_cancelled);
  }

  public OperationCancelledException(String message, Throwable cause) {
    super(message, KvErrorCodes.error_code_operation_cancelled, cause);
  }
}
