package upbus;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class UMessageTest {

  private static final UUri TOPIC = new UUri("veh", 0xA34B, 1, 0x8001);
  private static final UUri RECIPIENT = new UUri("veh", 0xB000, 1, 0);

  @Test
  void publishHasNoDestination() {
    UMessage message = UMessage.publish(TOPIC).payload(UPayload.fromString("hi")).build();

    assertEquals(UMessageType.PUBLISH, message.type());
    assertEquals(TOPIC, message.source());
    assertTrue(message.destination().isEmpty());
    assertEquals(Optional.of("hi"), message.extractString());
  }

  @Test
  void notificationCarriesDestination() {
    UMessage message = UMessage.notification(TOPIC, RECIPIENT).build();

    assertEquals(UMessageType.NOTIFICATION, message.type());
    assertEquals(Optional.of(RECIPIENT), message.destination());
    assertTrue(message.payload().isEmpty());
    assertTrue(message.extractString().isEmpty());
  }

  @Test
  void notificationRequiresDestination() {
    assertThrows(NullPointerException.class, () -> UMessage.notification(TOPIC, null).build());
  }

  @Test
  void publishRejectsDestination() {
    assertThrows(IllegalArgumentException.class, () ->
        UMessage.builder(UMessageType.PUBLISH, TOPIC, RECIPIENT).build());
  }

  @Test
  void sourceIsRequired() {
    assertThrows(NullPointerException.class, () -> UMessage.publish(null).build());
  }

  @Test
  void generatesDistinctIds() {
    UMessage first = UMessage.publish(TOPIC).build();
    UMessage second = UMessage.publish(TOPIC).build();

    assertEquals(26, first.id().length());
    assertNotEquals(first.id(), second.id());
  }

  @Test
  void customIdIsKept() {
    UMessage message = UMessage.publish(TOPIC).id("msg-1").build();

    assertEquals("msg-1", message.id());
    assertThrows(IllegalArgumentException.class, () -> UMessage.publish(TOPIC).id("").build());
  }

  @Test
  void emptyPayloadDiffersFromNoPayload() {
    UMessage empty = UMessage.publish(TOPIC).id("a").payload(UPayload.fromBytes(new byte[0])).build();
    UMessage none = UMessage.publish(TOPIC).id("a").build();

    assertTrue(empty.payload().isPresent());
    assertNotEquals(empty, none);
  }
}
