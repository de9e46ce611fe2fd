package upbus.network.loopback;

import upbus.network.PubSubSession;
import upbus.network.PubSubSessionFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * In-memory pub/sub network connecting {@link PubSubSession}s opened from the same
 * instance. Stands in for a real network in tests and single-process setups.
 *
 * <p>A frame put by any session is copied to every subscription on the same key across
 * all open sessions, including the publishing one. Each session delivers on its own
 * single daemon thread, in the order frames were put.
 */
public final class LoopbackNetwork implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(LoopbackNetwork.class.getName());

  private final Set<LoopbackSession> sessions = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean open = new AtomicBoolean(true);

  /**
   * Opens a new session on this network.
   *
   * @param authority the authority of the session owner, used for thread naming
   * @return the session
   * @throws IOException if the network is closed
   */
  public PubSubSession openSession(String authority) throws IOException {
    if (!open.get()) {
      throw new IOException("Loopback network is closed");
    }
    LoopbackSession session = new LoopbackSession(this, authority);
    sessions.add(session);
    logger.fine(() -> "Opened loopback session for " + authority);
    return session;
  }

  /**
   * Returns a factory opening sessions on this network.
   *
   * @return the factory
   */
  public PubSubSessionFactory sessionFactory() {
    return this::openSession;
  }

  public int sessionCount() {
    return sessions.size();
  }

  void route(String key, byte[] frame) {
    for (LoopbackSession session : sessions) {
      session.deliver(key, frame);
    }
  }

  void detach(LoopbackSession session) {
    sessions.remove(session);
  }

  /**
   * Closes every session opened on this network. Idempotent.
   */
  @Override
  public void close() {
    if (open.compareAndSet(true, false)) {
      List<LoopbackSession> snapshot = new ArrayList<>(sessions);
      for (LoopbackSession session : snapshot) {
        session.close();
      }
    }
  }
}
