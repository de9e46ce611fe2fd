package upbus.network.udp;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class UdpMulticastSessionTest {

  @Test
  void datagramCarriesKeyAndFrame() throws IOException {
    byte[] datagram = UdpMulticastSession.encodeDatagram("up/veh/A34B/1/8001", new byte[] {1, 2, 3});

    UdpMulticastSession.Datagram decoded = UdpMulticastSession.decodeDatagram(datagram);

    assertEquals("up/veh/A34B/1/8001", decoded.key);
    assertArrayEquals(new byte[] {1, 2, 3}, decoded.frame);
  }

  @Test
  void emptyFrameIsAllowed() throws IOException {
    byte[] datagram = UdpMulticastSession.encodeDatagram("k", new byte[0]);

    assertEquals(0, UdpMulticastSession.decodeDatagram(datagram).frame.length);
  }

  @Test
  void oversizedFrameIsRejected() {
    byte[] frame = new byte[UdpMulticastSession.MAX_DATAGRAM];

    assertThrows(IOException.class, () -> UdpMulticastSession.encodeDatagram("k", frame));
  }

  @Test
  void malformedDatagramIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> UdpMulticastSession.decodeDatagram(new byte[] {0}));
    assertThrows(IllegalArgumentException.class,
        () -> UdpMulticastSession.decodeDatagram(new byte[] {0, 5, 'a'}));
  }

  @Test
  void openRejectsUnicastGroup() {
    assertThrows(IOException.class, () -> UdpMulticastSession.open("127.0.0.1", 17447, 0));
  }

  @Test
  void openValidatesPortAndTtl() {
    assertThrows(IllegalArgumentException.class,
        () -> UdpMulticastSession.open(UdpMulticastSession.DEFAULT_GROUP, 0, 1));
    assertThrows(IllegalArgumentException.class,
        () -> UdpMulticastSession.open(UdpMulticastSession.DEFAULT_GROUP, 17447, 256));
  }

  @Test
  void deliversOverMulticastWhenAvailable() throws Exception {
    UdpMulticastSession session;
    try {
      session = UdpMulticastSession.open(UdpMulticastSession.DEFAULT_GROUP, 17447, 0);
    } catch (IOException e) {
      assumeTrue(false, "multicast not available: " + e.getMessage());
      return;
    }
    try (session) {
      BlockingQueue<byte[]> received = new LinkedBlockingQueue<>();
      session.subscribe("up/test", received::add);

      try {
        session.put("up/test", new byte[] {42});
      } catch (IOException e) {
        assumeTrue(false, "multicast send not available: " + e.getMessage());
      }

      byte[] frame = received.poll(2, TimeUnit.SECONDS);
      assumeTrue(frame != null, "multicast loopback not delivered on this host");
      assertArrayEquals(new byte[] {42}, frame);
    }
  }
}
