package io.github.panghy.lionrock.kv.client;

import com.google.common.base.Throwables;
import io.github.panghy.lionrock.kv.proto.ErrorIndex;
import io.github.panghy.lionrock.kv.proto.KvError;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.protobuf.ProtoUtils;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Conversions between {@link KvException}s, the {@link KvError} wire message and gRPC statuses.
 *
 * @author Clement Pang
 */
public abstract class KvErrors {

  /**
   * Trailer that carries the structured error of a failed batch RPC.
   */
  public static final Metadata.Key<KvError> KV_ERROR_KEY =
      Metadata.Key.of("kv-error-bin", ProtoUtils.metadataMarshaller(KvError.getDefaultInstance()));

  public static KvError toProto(KvException e) {
    KvError.Builder builder = KvError.newBuilder().
        setCode(e.getCode()).
        setMessage(messageOf(e));
    e.getIndex().ifPresent(idx -> builder.setIndex(ErrorIndex.newBuilder().setIndex(idx)));
    if (e instanceof ConditionFailedException && ((ConditionFailedException) e).getActualValue() != null) {
      builder.setActualValue(((ConditionFailedException) e).getActualValue());
    }
    if (e instanceof TransactionRetryException) {
      builder.setTxnId(((TransactionRetryException) e).getTxnId());
    }
    return builder.build();
  }

  public static KvException fromProto(KvError error) {
    KvException toReturn;
    switch (error.getCode()) {
      case KvErrorCodes.error_code_condition_failed:
        toReturn = new ConditionFailedException(error.getMessage(),
            error.hasActualValue() ? error.getActualValue() : null);
        break;
      case KvErrorCodes.error_code_transaction_retry:
        toReturn = new TransactionRetryException(error.getMessage(), error.getTxnId());
        break;
      case KvErrorCodes.error_code_operation_cancelled:
        toReturn = new OperationCancelledException(error.getMessage());
        break;
      default:
        toReturn = new KvException(error.getMessage(), error.getCode());
    }
    if (error.hasIndex()) {
      toReturn.setIndex(error.getIndex().getIndex());
    }
    return toReturn;
  }

  /**
   * Converts an exception raised while serving a batch into a {@link StatusRuntimeException} with the structured error
   * attached as a trailer.
   */
  public static StatusRuntimeException toStatusRuntimeException(KvException e) {
    Metadata trailers = new Metadata();
    trailers.put(KV_ERROR_KEY, toProto(e));
    Status status = e instanceof OperationCancelledException ? Status.CANCELLED : Status.ABORTED;
    return status.withDescription(messageOf(e)).asRuntimeException(trailers);
  }

  /**
   * Strips future wrappers and recovers {@link KvException}s from gRPC trailers. Cancellations (of a future or of the
   * RPC) become {@link OperationCancelledException}s, other gRPC failures become
   * {@link KvErrorCodes#error_code_rpc_failed} errors.
   */
  public static Throwable unwrap(Throwable e) {
    while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
      e = e.getCause();
    }
    if (e instanceof KvException) {
      return e;
    }
    if (e instanceof CancellationException) {
      return new OperationCancelledException("operation cancelled", e);
    }
    Throwable rootCause = Throwables.getRootCause(e);
    if (rootCause instanceof StatusRuntimeException) {
      StatusRuntimeException sre = (StatusRuntimeException) rootCause;
      Metadata trailers = sre.getTrailers();
      if (trailers != null && trailers.containsKey(KV_ERROR_KEY)) {
        KvException toReturn = fromProto(trailers.get(KV_ERROR_KEY));
        toReturn.initCause(sre);
        return toReturn;
      }
      Status.Code code = sre.getStatus().getCode();
      if (code == Status.Code.CANCELLED || code == Status.Code.DEADLINE_EXCEEDED) {
        return new OperationCancelledException("rpc " + code.name().toLowerCase(), sre);
      }
      return new KvException("rpc failed: " + sre.getStatus(), KvErrorCodes.error_code_rpc_failed, sre);
    }
    return e;
  }

  /**
   * {@link #unwrap(Throwable)} for callers that need to rethrow unchecked.
   */
  public static RuntimeException unwrapToRuntimeException(Throwable e) {
    Throwable unwrapped = unwrap(e);
    if (unwrapped instanceof RuntimeException) {
      return (RuntimeException) unwrapped;
    }
    if (unwrapped instanceof Error) {
      throw (Error) unwrapped;
    }
    return new KvException(unwrapped.toString(), KvErrorCodes.error_code_internal_error, unwrapped);
  }

  private static String messageOf(KvException e) {
    // KvException#getMessage() appends the code.
    String message = e.getMessage();
    String suffix = " (code: " + e.getCode() + ")";
    return message.endsWith(suffix) ? message.substring(0, message.length() - suffix.length()) : message;
  }
}
