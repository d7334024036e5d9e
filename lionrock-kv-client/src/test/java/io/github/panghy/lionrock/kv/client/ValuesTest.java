package io.github.panghy.lionrock.kv.client;

import com.google.protobuf.ByteString;
import io.github.panghy.lionrock.kv.proto.Span;
import io.github.panghy.lionrock.kv.proto.Value;
import io.github.panghy.lionrock.kv.proto.ValueType;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ValuesTest {

  @Test
  void marshal_tagsByType() {
    assertEquals(ValueType.INT, Values.marshal(5).getTag());
    assertEquals(ValueType.INT, Values.marshal(5L).getTag());
    assertEquals(ValueType.INT, Values.marshal(true).getTag());
    assertEquals(ValueType.FLOAT, Values.marshal(1.5d).getTag());
    assertEquals(ValueType.BYTES, Values.marshal("hello").getTag());
    assertEquals(ValueType.BYTES, Values.marshal(new byte[]{1, 2}).getTag());
    assertEquals(ValueType.TIME, Values.marshal(Instant.ofEpochSecond(10)).getTag());
    assertEquals(ValueType.PROTO, Values.marshal(Span.getDefaultInstance()).getTag());

    Value raw = Value.newBuilder().setTag(ValueType.BYTES).setRawBytes(ByteString.copyFromUtf8("x")).build();
    assertSame(raw, Values.marshal(raw));
  }

  @Test
  void marshal_unsupported() {
    KvException e = assertThrows(KvException.class, () -> Values.marshal(new Object()));
    assertEquals(KvErrorCodes.error_code_value_encoding, e.getCode());
    e = assertThrows(KvException.class, () -> Values.marshal(null));
    assertEquals(KvErrorCodes.error_code_value_encoding, e.getCode());
  }

  @Test
  void marshalKey() {
    assertEquals(ByteString.copyFromUtf8("abc"), Values.marshalKey("abc"));
    assertEquals(ByteString.copyFrom(new byte[]{1, 2}), Values.marshalKey(new byte[]{1, 2}));

    KvException e = assertThrows(KvException.class, () -> Values.marshalKey(42));
    assertEquals(KvErrorCodes.error_code_value_encoding, e.getCode());
  }

  @Test
  void decode() {
    assertEquals(-42, Values.getInt(Values.marshal(-42)));
    assertEquals(2.25, Values.getFloat(Values.marshal(2.25d)));
    assertArrayEquals("hi".getBytes(StandardCharsets.UTF_8), Values.getBytes(Values.marshal("hi")));
    Instant now = Instant.ofEpochSecond(1_600_000_000L, 123);
    assertEquals(now, Values.getTime(Values.marshal(now)));
    Span span = Span.newBuilder().setKey(ByteString.copyFromUtf8("a")).build();
    assertEquals(span, Values.getProto(Values.marshal(span), Span.parser()));
  }

  @Test
  void decode_typeMismatch() {
    KvException e = assertThrows(KvException.class, () -> Values.getInt(Values.marshal("not a number")));
    assertEquals(KvErrorCodes.error_code_value_type_mismatch, e.getCode());
  }

  @Test
  void keyValue() {
    KeyValue missing = new KeyValue("k".getBytes(StandardCharsets.UTF_8), null);
    assertFalse(missing.exists());
    assertEquals(0, missing.valueInt());
    assertNull(missing.valueBytes());
    assertEquals("nil", missing.prettyValue());
    assertEquals(Span.getDefaultInstance(), missing.valueProto(Span.parser()));

    KeyValue counter = new KeyValue("k".getBytes(StandardCharsets.UTF_8), Values.ofInt(7));
    assertTrue(counter.exists());
    assertEquals(7, counter.valueInt());
    assertEquals("7", counter.prettyValue());
    assertEquals(new KeyValue("k".getBytes(StandardCharsets.UTF_8), Values.ofInt(7)), counter);
    assertEquals("k=7", counter.toString());
  }
}
