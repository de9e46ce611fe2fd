package upbus.network;

import upbus.ConfigurationException;
import upbus.InvalidTopicException;
import upbus.MessageEncodingException;
import upbus.TransportUnavailableException;
import upbus.UListener;
import upbus.UMessage;
import upbus.UTransport;
import upbus.UUri;
import upbus.network.udp.UdpMulticastSession;
import upbus.registry.DefaultListenerRegistry;
import upbus.registry.ListenerRegistration;
import upbus.registry.ListenerRegistry;
import upbus.spi.MetricsExporter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link UTransport} that moves messages between processes over a {@link PubSubSession}.
 *
 * <p>Sent messages are encoded with a {@link UMessageCodec} and published under the
 * {@linkplain KeyExpressions key} of their source topic. Publish and notification messages
 * are both routed by source; a notification's destination travels inside the frame. The
 * transport holds one session subscription per topic with at least one local listener:
 * the first listener on a topic subscribes, removing the last one closes the subscription.
 *
 * <p>Received frames are decoded and dispatched on the session's delivery thread, never on
 * the sender's. Frames that fail to decode are logged and dropped. A transport receives
 * its own messages when it has listeners on their topic.
 *
 * <p>Create instances via {@link #builder(String)}. This class is thread-safe.
 *
 * @see NetworkTransport.Builder
 */
public final class NetworkTransport implements UTransport {
  private static final Logger logger = Logger.getLogger(NetworkTransport.class.getName());

  private final String authority;
  private final PubSubSession session;
  private final UMessageCodec codec;
  private final MetricsExporter metrics;
  private final ListenerRegistry registry;
  private final Map<UUri, PubSubSession.Subscription> subscriptions = new ConcurrentHashMap<>();
  private final AtomicBoolean open = new AtomicBoolean(true);

  private NetworkTransport(String authority, PubSubSession session, Builder builder) {
    this.authority = authority;
    this.session = session;
    this.codec = builder.codec != null ? builder.codec : UMessageCodec.getDefault();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.registry = new DefaultListenerRegistry(metrics);
  }

  /**
   * Starts building a transport for a device.
   *
   * @param authority the local authority, non-blank and without {@code '/'}
   * @return a new builder
   */
  public static Builder builder(String authority) {
    return new Builder(authority);
  }

  public String authority() {
    return authority;
  }

  @Override
  public void send(UMessage message) {
    Objects.requireNonNull(message, "message");
    ensureOpen();
    UUri topic = message.source();
    if (!topic.isTopic()) {
      metrics.incrementSendFailure();
      throw new InvalidTopicException(topic);
    }
    byte[] frame;
    try {
      frame = codec.encode(message);
    } catch (IllegalArgumentException | UncheckedIOException e) {
      metrics.incrementSendFailure();
      throw new MessageEncodingException("Failed to encode message on " + topic, e);
    }
    try {
      session.put(KeyExpressions.of(topic), frame);
    } catch (IOException e) {
      metrics.incrementSendFailure();
      throw new TransportUnavailableException("Failed to send " + message.id() + " on " + topic, e);
    }
    metrics.incrementSent();
    logger.finest(() -> "Sent " + message.id() + " (" + frame.length + " bytes) on " + topic);
  }

  @Override
  public ListenerRegistration registerListener(UUri topic, UListener listener) {
    ensureOpen();
    ListenerRegistration registration = registry.register(topic, listener);
    try {
      subscriptions.computeIfAbsent(topic, this::subscribe);
    } catch (UncheckedIOException e) {
      registry.unregister(registration);
      throw new TransportUnavailableException("Failed to subscribe to " + topic, e.getCause());
    }
    return registration;
  }

  @Override
  public void unregisterListener(UUri topic, UListener listener) {
    ensureOpen();
    registry.unregister(topic, listener);
    releaseIfUnused(topic);
  }

  @Override
  public void unregisterListener(ListenerRegistration registration) {
    ensureOpen();
    registry.unregister(registration);
    releaseIfUnused(registration.topic());
  }

  /**
   * Returns the number of local listeners registered for a topic.
   *
   * @param topic the topic
   * @return the listener count
   */
  public int listenerCount(UUri topic) {
    return registry.listenerCount(topic);
  }

  /**
   * Returns whether the transport holds a session subscription for a topic.
   *
   * @param topic the topic
   * @return {@code true} while at least one listener is registered on the topic
   */
  public boolean isSubscribed(UUri topic) {
    return subscriptions.containsKey(topic);
  }

  public boolean isOpen() {
    return open.get() && session.isOpen();
  }

  /**
   * Closes all subscriptions, forgets all listeners and closes the session. Idempotent.
   */
  @Override
  public void close() {
    if (!open.compareAndSet(true, false)) {
      return;
    }
    List<UUri> topics = new ArrayList<>(subscriptions.keySet());
    for (UUri topic : topics) {
      PubSubSession.Subscription subscription = subscriptions.remove(topic);
      if (subscription != null) {
        closeQuietly(subscription);
      }
    }
    registry.clear();
    session.close();
    logger.fine(() -> "Network transport closed for authority " + authority);
  }

  private PubSubSession.Subscription subscribe(UUri topic) {
    String key = KeyExpressions.of(topic);
    try {
      PubSubSession.Subscription subscription = session.subscribe(key, frame -> onFrame(topic, frame));
      logger.fine(() -> "Subscribed to " + key);
      return subscription;
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private void releaseIfUnused(UUri topic) {
    subscriptions.computeIfPresent(topic, (key, subscription) -> {
      if (registry.hasListeners(key)) {
        return subscription;
      }
      closeQuietly(subscription);
      logger.fine(() -> "Unsubscribed from " + subscription.key());
      return null;
    });
  }

  private void onFrame(UUri topic, byte[] frame) {
    if (!open.get()) {
      return;
    }
    UMessage message;
    try {
      message = codec.decode(frame);
    } catch (RuntimeException e) {
      metrics.incrementDroppedFrame();
      logger.log(Level.WARNING, "Dropping undecodable frame on " + topic, e);
      return;
    }
    if (!topic.equals(message.source())) {
      metrics.incrementDroppedFrame();
      logger.warning(() -> "Dropping message " + message.id() + " from " + message.source()
          + " received on " + topic);
      return;
    }
    int delivered = registry.dispatch(topic, message);
    metrics.recordDelivered(delivered);
  }

  private static void closeQuietly(PubSubSession.Subscription subscription) {
    try {
      subscription.close();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to close subscription " + subscription.key(), e);
    }
  }

  private void ensureOpen() {
    if (!isOpen()) {
      throw new TransportUnavailableException("Network transport is closed for authority " + authority);
    }
  }

  /**
   * Builder for {@link NetworkTransport}.
   *
   * <p>Without a {@link #sessionFactory(PubSubSessionFactory) session factory} the transport
   * joins the UDP multicast group {@value UdpMulticastSession#DEFAULT_GROUP} on port
   * {@value UdpMulticastSession#DEFAULT_PORT}.
   */
  public static final class Builder {
    private final String authority;
    private PubSubSessionFactory sessionFactory;
    private UMessageCodec codec;
    private MetricsExporter metrics;

    private Builder(String authority) {
      this.authority = authority;
    }

    /**
     * Sets the factory opening the transport's session.
     *
     * @param sessionFactory the session factory
     * @return this builder
     */
    public Builder sessionFactory(PubSubSessionFactory sessionFactory) {
      this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
      return this;
    }

    /**
     * Sets the frame codec. Optional; defaults to {@link UMessageCodec#getDefault()}.
     *
     * @param codec the codec
     * @return this builder
     */
    public Builder codec(UMessageCodec codec) {
      this.codec = Objects.requireNonNull(codec, "codec");
      return this;
    }

    /**
     * Sets the metrics exporter. Optional; defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    /**
     * Opens the session and builds the transport.
     *
     * @return a new, open transport
     * @throws ConfigurationException if the authority is invalid or the session cannot be opened
     */
    public NetworkTransport build() {
      if (authority == null || authority.isBlank() || authority.indexOf('/') >= 0) {
        throw new ConfigurationException("Invalid authority: " + authority);
      }
      PubSubSessionFactory factory = sessionFactory != null
          ? sessionFactory
          : UdpMulticastSession.factory(UdpMulticastSession.DEFAULT_GROUP,
              UdpMulticastSession.DEFAULT_PORT, UdpMulticastSession.DEFAULT_TTL);
      PubSubSession session;
      try {
        session = factory.open(authority);
      } catch (IOException | RuntimeException e) {
        throw new ConfigurationException("Failed to open network session for authority " + authority, e);
      }
      if (session == null || !session.isOpen()) {
        throw new ConfigurationException("Session factory returned no open session for authority " + authority);
      }
      logger.info(() -> "Network transport opened for authority " + authority);
      return new NetworkTransport(authority, session, this);
    }
  }
}
