package io.github.panghy.lionrock.kv.client;

import com.google.common.io.BaseEncoding;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.Parser;
import io.github.panghy.lionrock.kv.proto.Value;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

import static com.apple.foundationdb.tuple.ByteArrayUtil.printable;

/**
 * A key and its (possibly absent) value. An absent value means the key does not exist, which is not an error.
 *
 * @author Clement Pang
 */
public class KeyValue {

  private final byte[] key;
  @Nullable
  private final Value value;

  public KeyValue(byte[] key, @Nullable Value value) {
    this.key = key;
    this.value = value;
  }

  public byte[] getKey() {
    return key;
  }

  @Nullable
  public Value getValue() {
    return value;
  }

  public boolean exists() {
    return value != null;
  }

  /**
   * @return The value as a long, 0 if the key does not exist.
   * @throws KvException if the value is not an INT.
   */
  public long valueInt() {
    if (value == null) {
      return 0;
    }
    return Values.getInt(value);
  }

  public double valueFloat() {
    if (value == null) {
      return 0;
    }
    return Values.getFloat(value);
  }

  /**
   * @return The value as bytes, null if the key does not exist.
   * @throws KvException if the value is not BYTES.
   */
  @Nullable
  public byte[] valueBytes() {
    if (value == null) {
      return null;
    }
    return Values.getBytes(value);
  }

  @Nullable
  public Instant valueTime() {
    if (value == null) {
      return null;
    }
    return Values.getTime(value);
  }

  /**
   * Parse the value as a proto message, an absent value parses as the default instance.
   */
  public <T extends Message> T valueProto(Parser<T> parser) {
    if (value == null) {
      try {
        return parser.parseFrom(new byte[0]);
      } catch (InvalidProtocolBufferException e) {
        throw new KvException("unable to create default proto", KvErrorCodes.error_code_value_encoding, e);
      }
    }
    return Values.getProto(value, parser);
  }

  /**
   * @return A human-readable rendition of the value according to its tag.
   */
  public String prettyValue() {
    if (value == null) {
      return "nil";
    }
    try {
      switch (value.getTag()) {
        case INT:
          return Long.toString(Values.getInt(value));
        case FLOAT:
          return Double.toString(Values.getFloat(value));
        case BYTES:
          return "\"" + printable(Values.getBytes(value)) + "\"";
        case TIME:
          return Values.getTime(value).toString();
        default:
          return BaseEncoding.base16().lowerCase().encode(value.getRawBytes().toByteArray());
      }
    } catch (KvException e) {
      return e.getMessage();
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    KeyValue keyValue = (KeyValue) o;
    return Arrays.equals(key, keyValue.key) && Objects.equals(value, keyValue.value);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(key) + Objects.hashCode(value);
  }

  @Override
  public String toString() {
    return printable(key) + "=" + prettyValue();
  }
}
