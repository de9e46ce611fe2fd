package upbus.spi;

/**
 * Observability hook for exporting transport counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of messages accepted by a transport's send path.
   */
  void incrementSent();

  /**
   * Increments the count of messages rejected by a transport's send path.
   */
  void incrementSendFailure();

  /**
   * Records one dispatch and the number of listeners it invoked.
   *
   * @param listeners listeners invoked (zero for a topic nobody listens to)
   */
  void recordDelivered(int listeners);

  /**
   * Increments the count of listener invocations that threw.
   */
  void incrementListenerFailure();

  /**
   * Increments the count of inbound network frames dropped because they could not be decoded.
   */
  default void incrementDroppedFrame() {
  }

  /**
   * Records the number of listener registrations currently held by a registry.
   *
   * @param count registrations across all topics
   */
  default void recordRegisteredListeners(int count) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementSent() {
    }

    @Override
    public void incrementSendFailure() {
    }

    @Override
    public void recordDelivered(int listeners) {
    }

    @Override
    public void incrementListenerFailure() {
    }
  }
}
