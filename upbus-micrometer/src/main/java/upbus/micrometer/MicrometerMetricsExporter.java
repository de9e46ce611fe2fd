package upbus.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import upbus.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a gauge with a {@link MeterRegistry} so transport activity can
 * be exported to Prometheus or any other Micrometer backend.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code upbus.send}: messages handed to the transport</li>
 *   <li>{@code upbus.send.failure}: sends rejected or failed</li>
 *   <li>{@code upbus.delivery}: listener invocations</li>
 *   <li>{@code upbus.listener.failure}: listener invocations that threw</li>
 *   <li>{@code upbus.frame.dropped}: received network frames discarded</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code upbus.listeners.registered}: listeners currently registered</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_PREFIX = "upbus";

  private final MeterRegistry registry;
  private final Counter sent;
  private final Counter sendFailures;
  private final Counter deliveries;
  private final Counter listenerFailures;
  private final Counter droppedFrames;
  private final Gauge registeredGauge;

  private final AtomicInteger registeredListeners = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@value #DEFAULT_PREFIX}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several transports
   * against one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "vehicle.upbus"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.sent = Counter.builder(namePrefix + ".send")
        .description("Messages handed to the transport")
        .register(registry);
    this.sendFailures = Counter.builder(namePrefix + ".send.failure")
        .description("Sends rejected or failed")
        .register(registry);
    this.deliveries = Counter.builder(namePrefix + ".delivery")
        .description("Listener invocations")
        .register(registry);
    this.listenerFailures = Counter.builder(namePrefix + ".listener.failure")
        .description("Listener invocations that threw")
        .register(registry);
    this.droppedFrames = Counter.builder(namePrefix + ".frame.dropped")
        .description("Received frames discarded as undecodable or misrouted")
        .register(registry);

    this.registeredGauge = Gauge.builder(namePrefix + ".listeners.registered",
            registeredListeners, AtomicInteger::get)
        .description("Listeners currently registered")
        .register(registry);
  }

  @Override
  public void incrementSent() {
    if (closed) return;
    sent.increment();
  }

  @Override
  public void incrementSendFailure() {
    if (closed) return;
    sendFailures.increment();
  }

  @Override
  public void recordDelivered(int listeners) {
    if (closed || listeners <= 0) return;
    deliveries.increment(listeners);
  }

  @Override
  public void incrementListenerFailure() {
    if (closed) return;
    listenerFailures.increment();
  }

  @Override
  public void incrementDroppedFrame() {
    if (closed) return;
    droppedFrames.increment();
  }

  @Override
  public void recordRegisteredListeners(int count) {
    if (closed) return;
    registeredListeners.set(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the transport using the exporter is closed so no stale gauge remains.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(sent, sendFailures, deliveries, listenerFailures,
        droppedFrames, registeredGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
