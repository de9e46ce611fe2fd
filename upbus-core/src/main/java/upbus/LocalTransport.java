package upbus;

import upbus.registry.DefaultListenerRegistry;
import upbus.registry.ListenerRegistration;
import upbus.registry.ListenerRegistry;
import upbus.spi.MetricsExporter;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * In-process {@link UTransport}: hands sent messages directly to listeners registered in
 * the same address space, without serialization.
 *
 * <p>Both publish and notification messages are routed by their source topic; a
 * notification's destination is carried for the receiver and does not affect routing.
 * Delivery is synchronous on the sender's thread, so messages from one sender reach each
 * listener in program order. The same message instance is passed to every listener.
 *
 * <p>The transport and its registry live as long as the owner keeps the instance; there is
 * no process-wide registry. After {@link #close()} every operation fails with
 * {@link TransportUnavailableException}.
 *
 * <pre>{@code
 * try (LocalTransport transport = new LocalTransport()) {
 *   transport.registerListener(topic, msg -> System.out.println(msg.extractString()));
 *   transport.send(UMessage.publish(topic).payload(UPayload.fromString("hi")).build());
 * }
 * }</pre>
 */
public final class LocalTransport implements UTransport {
  private static final Logger logger = Logger.getLogger(LocalTransport.class.getName());

  private final ListenerRegistry registry;
  private final MetricsExporter metrics;
  private final AtomicBoolean open = new AtomicBoolean(true);

  public LocalTransport() {
    this(new Builder());
  }

  private LocalTransport(Builder builder) {
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.registry = new DefaultListenerRegistry(metrics);
  }

  public static Builder builder() {
    return new Builder();
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
    int delivered = registry.dispatch(topic, message);
    metrics.incrementSent();
    metrics.recordDelivered(delivered);
    logger.finest(() -> "Delivered " + message.id() + " to " + delivered + " listener(s) on " + topic);
  }

  @Override
  public ListenerRegistration registerListener(UUri topic, UListener listener) {
    ensureOpen();
    return registry.register(topic, listener);
  }

  @Override
  public void unregisterListener(UUri topic, UListener listener) {
    ensureOpen();
    registry.unregister(topic, listener);
  }

  @Override
  public void unregisterListener(ListenerRegistration registration) {
    ensureOpen();
    registry.unregister(registration);
  }

  /**
   * Returns the number of listeners currently registered for a topic.
   *
   * @param topic the topic
   * @return the listener count
   */
  public int listenerCount(UUri topic) {
    return registry.listenerCount(topic);
  }

  public boolean isOpen() {
    return open.get();
  }

  @Override
  public void close() {
    if (open.compareAndSet(true, false)) {
      registry.clear();
      logger.fine("Local transport closed");
    }
  }

  private void ensureOpen() {
    if (!open.get()) {
      throw new TransportUnavailableException("Local transport is closed");
    }
  }

  /** Builder for {@link LocalTransport}. */
  public static final class Builder {
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public LocalTransport build() {
      return new LocalTransport(this);
    }
  }
}
