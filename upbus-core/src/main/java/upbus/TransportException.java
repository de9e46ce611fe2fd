package upbus;

/**
 * Base of all failures reported by a {@link UTransport} and the components layered on it.
 *
 * <p>Failures are returned to the immediate caller and never retried internally;
 * retry or backoff, if wanted, is the caller's policy.
 *
 * @see InvalidTopicException
 * @see ListenerNotFoundException
 * @see TransportUnavailableException
 * @see ConfigurationException
 */
public class TransportException extends RuntimeException {

  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
