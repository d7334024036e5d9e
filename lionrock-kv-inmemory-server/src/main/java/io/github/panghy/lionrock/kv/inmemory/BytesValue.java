package io.github.panghy.lionrock.kv.inmemory;

import com.google.common.primitives.UnsignedBytes;
import com.google.protobuf.ByteString;

import java.util.Arrays;

import static com.apple.foundationdb.tuple.ByteArrayUtil.printable;

/**
 * Wraps byte-arrays and orders them lexicographically (unsigned), the order of keys in the store.
 *
 * @author Clement Pang
 */
public class BytesValue implements Comparable<BytesValue> {

  private final byte[] value;

  public BytesValue(byte[] value) {
    this.value = value;
  }

  public byte[] getValue() {
    return value;
  }

  public ByteString toByteString() {
    return ByteString.copyFrom(value);
  }

  public boolean isEmpty() {
    return value.length == 0;
  }

  @Override
  public int compareTo(BytesValue o) {
    return UnsignedBytes.lexicographicalComparator().compare(value, o.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    BytesValue that = (BytesValue) o;
    return Arrays.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    return printable(value);
  }
}
