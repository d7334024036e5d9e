package io.github.panghy.lionrock.kv.client;

import com.apple.foundationdb.tuple.Tuple;
import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.Parser;
import io.github.panghy.lionrock.kv.proto.Value;
import io.github.panghy.lionrock.kv.proto.ValueType;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Encodes application values into tagged {@link Value}s and decodes them back. Numbers and timestamps are stored as
 * FoundationDB tuples so that their encoding is order-preserving.
 *
 * @author Clement Pang
 */
public abstract class Values {

  /**
   * Marshal an application value. Supported types are {@link Value} (used as-is), integral boxed types, floating point
   * boxed types, {@link Boolean} (stored as an INT of 0 or 1), {@code byte[]}, {@link ByteString}, {@link String},
   * {@link Instant} and protobuf {@link Message}s.
   *
   * @throws KvException with {@link KvErrorCodes#error_code_value_encoding} for anything else.
   */
  public static Value marshal(Object value) {
    if (value instanceof Value) {
      return (Value) value;
    } else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ofInt(((Number) value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      return ofFloat(((Number) value).doubleValue());
    } else if (value instanceof Boolean) {
      return ofInt((Boolean) value ? 1 : 0);
    } else if (value instanceof byte[]) {
      return ofBytes((byte[]) value);
    } else if (value instanceof ByteString) {
      return Value.newBuilder().setTag(ValueType.BYTES).setRawBytes((ByteString) value).build();
    } else if (value instanceof String) {
      return ofBytes(((String) value).getBytes(StandardCharsets.UTF_8));
    } else if (value instanceof Instant) {
      return ofTime((Instant) value);
    } else if (value instanceof Message) {
      return ofProto((Message) value);
    }
    throw new KvException("unable to marshal value of type: " +
        (value == null ? "null" : value.getClass().getName()), KvErrorCodes.error_code_value_encoding);
  }

  /**
   * Marshal a key, either a {@code byte[]}, a {@link ByteString} or a {@link String} (UTF-8).
   */
  public static ByteString marshalKey(Object key) {
    if (key instanceof byte[]) {
      return ByteString.copyFrom((byte[]) key);
    } else if (key instanceof ByteString) {
      return (ByteString) key;
    } else if (key instanceof String) {
      return ByteString.copyFromUtf8((String) key);
    }
    throw new KvException("unable to marshal key of type: " +
        (key == null ? "null" : key.getClass().getName()), KvErrorCodes.error_code_value_encoding);
  }

  public static Value ofInt(long value) {
    return Value.newBuilder().
        setTag(ValueType.INT).
        setRawBytes(ByteString.copyFrom(Tuple.from(value).pack())).
        build();
  }

  public static Value ofFloat(double value) {
    return Value.newBuilder().
        setTag(ValueType.FLOAT).
        setRawBytes(ByteString.copyFrom(Tuple.from(value).pack())).
        build();
  }

  public static Value ofBytes(byte[] value) {
    return Value.newBuilder().
        setTag(ValueType.BYTES).
        setRawBytes(ByteString.copyFrom(value)).
        build();
  }

  public static Value ofTime(Instant value) {
    return Value.newBuilder().
        setTag(ValueType.TIME).
        setRawBytes(ByteString.copyFrom(Tuple.from(value.getEpochSecond(), (long) value.getNano()).pack())).
        build();
  }

  public static Value ofProto(Message message) {
    return Value.newBuilder().
        setTag(ValueType.PROTO).
        setRawBytes(message.toByteString()).
        build();
  }

  public static long getInt(Value value) {
    return decodeTuple(value, ValueType.INT).getLong(0);
  }

  public static double getFloat(Value value) {
    return decodeTuple(value, ValueType.FLOAT).getDouble(0);
  }

  public static byte[] getBytes(Value value) {
    checkTag(value, ValueType.BYTES);
    return value.getRawBytes().toByteArray();
  }

  public static Instant getTime(Value value) {
    Tuple tuple = decodeTuple(value, ValueType.TIME);
    return Instant.ofEpochSecond(tuple.getLong(0), tuple.getLong(1));
  }

  public static <T extends Message> T getProto(Value value, Parser<T> parser) {
    checkTag(value, ValueType.PROTO);
    try {
      return parser.parseFrom(value.getRawBytes());
    } catch (InvalidProtocolBufferException e) {
      throw new KvException("unable to parse proto value", KvErrorCodes.error_code_value_encoding, e);
    }
  }

  private static Tuple decodeTuple(Value value, ValueType expected) {
    checkTag(value, expected);
    try {
      return Tuple.fromBytes(value.getRawBytes().toByteArray());
    } catch (IllegalArgumentException e) {
      throw new KvException("malformed " + expected + " value", KvErrorCodes.error_code_value_encoding, e);
    }
  }

  private static void checkTag(Value value, ValueType expected) {
    if (value.getTag() != expected) {
      throw new KvException("value type is not " + expected + ": " + value.getTag(),
          KvErrorCodes.error_code_value_type_mismatch);
    }
  }
}
