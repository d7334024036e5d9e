package io.github.panghy.lionrock.kv.client;

/**
 * Error codes carried by {@link KvException} and by the {@code KvError} wire message. Codes below 2000 originate from
 * the store (or the transaction coordinator), codes from 2000 upwards are raised by the client before or after talking
 * to the store.
 *
 * @author Clement Pang
 */
public abstract class KvErrorCodes {

  /**
   * A non-transactional batch touches more than one range and has to be wrapped in a transaction.
   */
  public static final int error_code_op_requires_txn = 1000;
  public static final int error_code_condition_failed = 1001;
  /**
   * Serialization conflict, the transaction should be retried with a refreshed state.
   */
  public static final int error_code_transaction_retry = 1002;
  /**
   * The outcome of the operation is unknown, it may or may not have been applied.
   */
  public static final int error_code_ambiguous_result = 1003;
  public static final int error_code_unhandled_retryable = 1004;
  public static final int error_code_transaction_aborted = 1005;
  public static final int error_code_range_not_found = 1006;
  public static final int error_code_lease_transfer_rejected = 1007;
  public static final int error_code_replica_change_rejected = 1008;
  public static final int error_code_merge_rejected = 1009;

  public static final int error_code_read_consistency_unsupported = 2000;
  public static final int error_code_value_encoding = 2001;
  public static final int error_code_value_type_mismatch = 2002;
  public static final int error_code_transaction_status = 2003;
  public static final int error_code_unsupported_request = 2004;
  public static final int error_code_operation_cancelled = 2005;
  public static final int error_code_terminated_retryable = 2006;
  public static final int error_code_rpc_failed = 2007;

  public static final int error_code_internal_error = 4100;

  /**
   * @return Whether a transaction that failed with the given code can be retried by re-running it.
   */
  public static boolean isRetryable(int code) {
    return maybeCommitted(code) || retryableNotCommitted(code);
  }

  /**
   * @return Whether the operation might have been applied despite the error.
   */
  public static boolean maybeCommitted(int code) {
    return code == error_code_ambiguous_result;
  }

  public static boolean retryableNotCommitted(int code) {
    return code == error_code_transaction_retry || code == error_code_unhandled_retryable;
  }

  /**
   * @return Whether a single idempotent-safe non-transactional operation can be re-issued after this error.
   */
  public static boolean isRetryableNonTransactional(int code) {
    return code == error_code_ambiguous_result || code == error_code_unhandled_retryable;
  }
}
