package upbus.network;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Network pub/sub substrate underneath a {@link NetworkTransport}: moves opaque frames
 * between processes, keyed by {@linkplain KeyExpressions key expressions}.
 *
 * <p>Implementations must be thread-safe. Subscription handlers are invoked on a thread
 * owned by the session, never on the thread calling {@link #put}; frames for one key are
 * handed to a handler in the order the session received them. Delivery across processes
 * is best effort: a frame published while no session is listening is lost.
 *
 * @see upbus.network.loopback.LoopbackNetwork
 * @see upbus.network.udp.UdpMulticastSession
 */
public interface PubSubSession extends AutoCloseable {

  /**
   * Publishes a frame under a key.
   *
   * @param key   the key expression
   * @param frame the frame bytes; the session does not keep a reference after returning
   * @throws IOException if the frame cannot be handed to the network
   */
  void put(String key, byte[] frame) throws IOException;

  /**
   * Subscribes to frames published under a key, including frames this session publishes.
   *
   * @param key     the key expression
   * @param handler receives each frame
   * @return the subscription, closed to stop delivery
   * @throws IOException if the subscription cannot be established
   */
  Subscription subscribe(String key, Consumer<byte[]> handler) throws IOException;

  boolean isOpen();

  /**
   * Closes the session and all of its subscriptions. Idempotent.
   */
  @Override
  void close();

  /**
   * An active subscription of a {@link PubSubSession}.
   */
  interface Subscription extends AutoCloseable {

    String key();

    /**
     * Stops delivery to this subscription's handler. Idempotent.
     */
    @Override
    void close();
  }
}
