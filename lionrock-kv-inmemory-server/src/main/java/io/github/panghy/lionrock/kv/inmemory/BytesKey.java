package io.github.panghy.lionrock.kv.inmemory;

import com.google.protobuf.ByteString;

import java.util.Arrays;

/**
 * Key of the store, caches its hash code.
 *
 * @author Clement Pang
 */
public class BytesKey extends BytesValue {

  /**
   * The smallest key, the start of the first range.
   */
  public static final BytesKey MIN = new BytesKey(new byte[0]);

  private final int hashCode;

  public BytesKey(byte[] value) {
    super(value);
    this.hashCode = Arrays.hashCode(value);
  }

  public static BytesKey of(ByteString value) {
    return new BytesKey(value.toByteArray());
  }

  @Override
  public int hashCode() {
    return hashCode;
  }
}
