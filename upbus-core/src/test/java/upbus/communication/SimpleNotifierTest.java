package upbus.communication;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import upbus.ListenerNotFoundException;
import upbus.LocalTransport;
import upbus.StaticUriProvider;
import upbus.UListener;
import upbus.UMessage;
import upbus.UMessageType;
import upbus.UPayload;
import upbus.UUri;
import upbus.registry.ListenerRegistration;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimpleNotifierTest {

  private final StaticUriProvider uriProvider = new StaticUriProvider("my-vehicle", 0xA34B, 0x01);
  private final LocalTransport transport = new LocalTransport();
  private final SimpleNotifier notifier = new SimpleNotifier(transport, uriProvider);

  @AfterEach
  void tearDown() {
    transport.close();
  }

  @Test
  void notifyReachesListenerOnResourceTopic() {
    List<UMessage> received = new ArrayList<>();
    UUri topic = uriProvider.getResourceUri(0xD100);
    notifier.startListening(topic, received::add);

    notifier.notify(0xD100, uriProvider.getSourceUri(), UPayload.fromString("hello"));

    assertEquals(1, received.size());
    UMessage message = received.get(0);
    assertEquals(UMessageType.NOTIFICATION, message.type());
    assertEquals(topic, message.source());
    assertEquals(uriProvider.getSourceUri(), message.destination().orElseThrow());
    assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), message.payload().orElseThrow().bytes());
  }

  @Test
  void stoppedListenerIsNotInvoked() {
    List<UMessage> received = new ArrayList<>();
    UUri topic = uriProvider.getResourceUri(0xD100);
    UListener listener = received::add;
    notifier.startListening(topic, listener);
    notifier.stopListening(topic, listener);

    notifier.notify(0xD100, uriProvider.getSourceUri(), UPayload.fromString("hello"));

    assertTrue(received.isEmpty());
  }

  @Test
  void stopListeningWhileUnregisteredThrows() {
    UUri topic = uriProvider.getResourceUri(0xD100);
    UListener listener = msg -> {};

    assertThrows(ListenerNotFoundException.class, () -> notifier.stopListening(topic, listener));

    notifier.startListening(topic, listener);
    notifier.stopListening(topic, listener);
    assertThrows(ListenerNotFoundException.class, () -> notifier.stopListening(topic, listener));
  }

  @Test
  void startListeningTwiceIsIdempotent() {
    List<UMessage> received = new ArrayList<>();
    UUri topic = uriProvider.getResourceUri(0xD100);
    UListener listener = received::add;

    ListenerRegistration first = notifier.startListening(topic, listener);
    ListenerRegistration second = notifier.startListening(topic, listener);
    notifier.notify(0xD100, uriProvider.getSourceUri(), null);

    assertSame(first, second);
    assertEquals(1, received.size());
  }

  @Test
  void stopListeningByHandle() {
    List<UMessage> received = new ArrayList<>();
    ListenerRegistration registration =
        notifier.startListening(uriProvider.getResourceUri(0xD100), received::add);

    notifier.stopListening(registration);
    notifier.notify(0xD100, uriProvider.getSourceUri(), UPayload.fromString("hello"));

    assertTrue(received.isEmpty());
  }

  @Test
  void notifyRequiresDestination() {
    assertThrows(NullPointerException.class, () -> notifier.notify(0xD100, null, null));
  }
}
