package upbus.network.loopback;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import upbus.network.PubSubSession;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LoopbackNetworkTest {

  private final LoopbackNetwork network = new LoopbackNetwork();

  @AfterEach
  void tearDown() {
    network.close();
  }

  @Test
  void frameReachesSubscribersInAllSessions() throws Exception {
    PubSubSession publisher = network.openSession("a");
    PubSubSession subscriber = network.openSession("b");
    BlockingQueue<byte[]> own = new LinkedBlockingQueue<>();
    BlockingQueue<byte[]> remote = new LinkedBlockingQueue<>();
    publisher.subscribe("up/k", own::add);
    subscriber.subscribe("up/k", remote::add);

    publisher.put("up/k", new byte[] {7});

    assertArrayEquals(new byte[] {7}, remote.poll(5, TimeUnit.SECONDS));
    assertArrayEquals(new byte[] {7}, own.poll(5, TimeUnit.SECONDS));
  }

  @Test
  void framesAreCopied() throws Exception {
    PubSubSession session = network.openSession("a");
    BlockingQueue<byte[]> received = new LinkedBlockingQueue<>();
    session.subscribe("up/k", received::add);
    byte[] frame = {1, 2};

    session.put("up/k", frame);
    frame[0] = 9;

    assertArrayEquals(new byte[] {1, 2}, received.poll(5, TimeUnit.SECONDS));
  }

  @Test
  void closedSubscriptionStopsDelivery() throws Exception {
    PubSubSession session = network.openSession("a");
    BlockingQueue<byte[]> closed = new LinkedBlockingQueue<>();
    BlockingQueue<byte[]> marker = new LinkedBlockingQueue<>();
    PubSubSession.Subscription subscription = session.subscribe("up/k", closed::add);
    session.subscribe("up/marker", marker::add);

    subscription.close();
    subscription.close();
    session.put("up/k", new byte[] {1});
    session.put("up/marker", new byte[] {2});

    assertNotNull(marker.poll(5, TimeUnit.SECONDS));
    assertTrue(closed.isEmpty());
    assertEquals("up/k", subscription.key());
  }

  @Test
  void closedSessionRejectsUse() throws Exception {
    PubSubSession session = network.openSession("a");

    session.close();

    assertFalse(session.isOpen());
    assertEquals(0, network.sessionCount());
    assertThrows(IOException.class, () -> session.put("up/k", new byte[0]));
    assertThrows(IOException.class, () -> session.subscribe("up/k", frame -> {}));
  }

  @Test
  void closingNetworkClosesSessions() throws Exception {
    PubSubSession first = network.openSession("a");
    PubSubSession second = network.openSession("b");

    network.close();

    assertFalse(first.isOpen());
    assertFalse(second.isOpen());
    assertThrows(IOException.class, () -> network.openSession("c"));
  }

  @Test
  void failingHandlerDoesNotStopDelivery() throws Exception {
    PubSubSession session = network.openSession("a");
    BlockingQueue<byte[]> received = new LinkedBlockingQueue<>();
    session.subscribe("up/k", frame -> {
      throw new IllegalStateException("boom");
    });
    session.subscribe("up/k", received::add);

    session.put("up/k", new byte[] {3});

    assertNotNull(received.poll(5, TimeUnit.SECONDS));
  }

  @Test
  void subscribeRacingCloseOfLastSubscriptionStaysLive() throws Exception {
    PubSubSession session = network.openSession("a");
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      for (int round = 0; round < 200; round++) {
        String key = "up/race/" + round;
        PubSubSession.Subscription old = session.subscribe(key, frame -> {});
        BlockingQueue<byte[]> received = new LinkedBlockingQueue<>();
        CyclicBarrier barrier = new CyclicBarrier(2);
        Future<?> closing = pool.submit(() -> {
          barrier.await();
          old.close();
          return null;
        });
        Future<?> subscribing = pool.submit(() -> {
          barrier.await();
          return session.subscribe(key, received::add);
        });
        closing.get(5, TimeUnit.SECONDS);
        subscribing.get(5, TimeUnit.SECONDS);

        session.put(key, new byte[] {(byte) round});

        assertArrayEquals(new byte[] {(byte) round}, received.poll(5, TimeUnit.SECONDS), key);
      }
    } finally {
      pool.shutdownNow();
    }
  }
}
