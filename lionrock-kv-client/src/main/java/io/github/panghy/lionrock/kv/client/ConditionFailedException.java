package io.github.panghy.lionrock.kv.client;

import io.github.panghy.lionrock.kv.proto.Value;

import javax.annotation.Nullable;

/**
 * Raised by conditional writes when the stored value does not match the expectation.
 */
public class ConditionFailedException extends KvException {

  @Nullable
  private final Value actualValue;

  public ConditionFailedException(String message, @Nullable Value actualValue) {
    super(message, KvErrorCodes.error_code_condition_failed);
    this.actualValue = actualValue;
  }

  /**
   * @return The value found in the store, null if the key did not exist.
   */
  @Nullable
  public Value getActualValue() {
    return actualValue;
  }
}
