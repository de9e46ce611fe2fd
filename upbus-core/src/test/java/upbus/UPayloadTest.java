package upbus;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class UPayloadTest {

  @Test
  void fromStringEncodesUtf8() {
    UPayload payload = UPayload.fromString("héllo");

    assertArrayEquals("héllo".getBytes(StandardCharsets.UTF_8), payload.bytes());
    assertEquals(UPayloadFormat.TEXT, payload.format());
    assertEquals(Optional.of("héllo"), payload.asString());
  }

  @Test
  void fromBytesCopiesInput() {
    byte[] data = {72, 105};
    UPayload payload = UPayload.fromBytes(data);
    data[0] = 0;

    assertEquals(UPayloadFormat.RAW, payload.format());
    assertEquals(Optional.of("Hi"), payload.asString());
  }

  @Test
  void bytesAccessorReturnsCopy() {
    UPayload payload = UPayload.fromString("abc");
    payload.bytes()[0] = 'z';

    assertEquals(Optional.of("abc"), payload.asString());
  }

  @Test
  void invalidUtf8HasNoStringView() {
    UPayload payload = UPayload.fromBytes(new byte[] {(byte) 0xC3, (byte) 0x28});

    assertTrue(payload.asString().isEmpty());
    assertEquals(2, payload.size());
  }

  @Test
  void emptyPayloadIsValid() {
    UPayload payload = UPayload.fromBytes(new byte[0]);

    assertTrue(payload.isEmpty());
    assertEquals(Optional.of(""), payload.asString());
  }

  @Test
  void equalityCoversBytesAndFormat() {
    byte[] bytes = "x".getBytes(StandardCharsets.UTF_8);

    assertEquals(UPayload.fromString("x"), UPayload.of(bytes, UPayloadFormat.TEXT));
    assertNotEquals(UPayload.fromString("x"), UPayload.fromBytes(bytes));
  }

  @Test
  void nullInputsThrow() {
    assertThrows(NullPointerException.class, () -> UPayload.fromString(null));
    assertThrows(NullPointerException.class, () -> UPayload.fromBytes(null));
    assertThrows(NullPointerException.class, () -> UPayload.of(new byte[0], null));
  }
}
