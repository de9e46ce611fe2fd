package upbus.network;

import org.junit.jupiter.api.Test;
import upbus.UMessage;
import upbus.UPayload;
import upbus.UPayloadFormat;
import upbus.UUri;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class BinaryUMessageCodecTest {

  private static final UUri TOPIC = new UUri("veh", 0xA34B, 1, 0x8001);
  private static final UUri DESTINATION = new UUri("cloud", 0xFFFF_FFFE, 0xFF, 0);

  private final UMessageCodec codec = UMessageCodec.getDefault();

  @Test
  void getDefaultReturnsSingleton() {
    assertSame(BinaryUMessageCodec.INSTANCE, UMessageCodec.getDefault());
  }

  @Test
  void publishWithTextPayloadSurvivesEncoding() {
    UMessage message = UMessage.publish(TOPIC).payload(UPayload.fromString("héllo")).build();

    UMessage decoded = codec.decode(codec.encode(message));

    assertEquals(message, decoded);
    assertEquals("héllo", decoded.extractString().orElseThrow());
    assertEquals(UPayloadFormat.TEXT, decoded.payload().orElseThrow().format());
  }

  @Test
  void notificationKeepsDestinationAndRawPayload() {
    byte[] data = {0, (byte) 0xFF, 0x10};
    UMessage message = UMessage.notification(TOPIC, DESTINATION)
        .id("custom-id")
        .payload(UPayload.fromBytes(data))
        .build();

    UMessage decoded = codec.decode(codec.encode(message));

    assertEquals("custom-id", decoded.id());
    assertEquals(DESTINATION, decoded.destination().orElseThrow());
    assertArrayEquals(data, decoded.payload().orElseThrow().bytes());
    assertEquals(UPayloadFormat.RAW, decoded.payload().orElseThrow().format());
  }

  @Test
  void absentAndEmptyPayloadStayDistinct() {
    UMessage none = UMessage.publish(TOPIC).build();
    UMessage empty = UMessage.publish(TOPIC).payload(UPayload.fromBytes(new byte[0])).build();

    assertTrue(codec.decode(codec.encode(none)).payload().isEmpty());
    assertTrue(codec.decode(codec.encode(empty)).payload().orElseThrow().isEmpty());
  }

  @Test
  void rejectsForeignBytes() {
    assertThrows(IllegalArgumentException.class, () -> codec.decode(new byte[] {1, 2, 3, 4}));
    assertThrows(IllegalArgumentException.class, () -> codec.decode(new byte[0]));
  }

  @Test
  void rejectsTruncatedFrame() {
    byte[] frame = codec.encode(UMessage.publish(TOPIC).payload(UPayload.fromString("hello")).build());

    for (int length = 0; length < frame.length; length++) {
      byte[] truncated = Arrays.copyOf(frame, length);
      assertThrows(IllegalArgumentException.class, () -> codec.decode(truncated), "length " + length);
    }
  }

  @Test
  void rejectsTrailingBytes() {
    byte[] frame = codec.encode(UMessage.publish(TOPIC).build());
    byte[] padded = Arrays.copyOf(frame, frame.length + 1);

    assertThrows(IllegalArgumentException.class, () -> codec.decode(padded));
  }

  @Test
  void rejectsUnknownVersionAndType() {
    byte[] frame = codec.encode(UMessage.publish(TOPIC).build());

    byte[] badVersion = frame.clone();
    badVersion[2] = 9;
    assertThrows(IllegalArgumentException.class, () -> codec.decode(badVersion));

    byte[] badType = frame.clone();
    badType[3] = 7;
    assertThrows(IllegalArgumentException.class, () -> codec.decode(badType));
  }

  @Test
  void rejectsNotificationWithoutDestination() {
    byte[] frame = codec.encode(UMessage.publish(TOPIC).build());
    frame[3] = 1; // NOTIFICATION

    assertThrows(IllegalArgumentException.class, () -> codec.decode(frame));
  }

  @Test
  void rejectsFieldsTooLongForTheFrame() {
    UMessage longId = UMessage.publish(TOPIC).id("x".repeat(70_000)).build();
    UMessage longAuthority = UMessage.publish(new UUri("a".repeat(70_000), 1, 1, 0x8001)).build();

    assertThrows(IllegalArgumentException.class, () -> codec.encode(longId));
    assertThrows(IllegalArgumentException.class, () -> codec.encode(longAuthority));
  }
}
