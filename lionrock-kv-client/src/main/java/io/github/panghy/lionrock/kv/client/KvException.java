package io.github.panghy.lionrock.kv.client;

import java.util.OptionalInt;

/**
 * Structured error raised by the key-value layer. Carries one of the {@link KvErrorCodes} and, when the error can be
 * attributed to a single request of a batch, the index of that request.
 *
 * @author Clement Pang
 */
public class KvException extends RuntimeException {

  private final int code;
  private volatile int index = -1;

  public KvException(String message, int code) {
    super(message);
    this.code = code;
  }

  public KvException(String message, int code, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  /**
   * @return The index of the offending request, if any. Within a {@link Batch} result this is the index of the
   * logical call, on the wire it is the index of the request.
   */
  public OptionalInt getIndex() {
    return index < 0 ? OptionalInt.empty() : OptionalInt.of(index);
  }

  public KvException setIndex(int index) {
    this.index = index;
    return this;
  }

  public boolean isRetryable() {
    return KvErrorCodes.isRetryable(code);
  }

  @Override
  public String getMessage() {
    return super.getMessage() + " (code: " + code + ")";
  }
}
