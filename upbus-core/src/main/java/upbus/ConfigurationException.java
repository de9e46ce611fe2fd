package upbus;

/**
 * Thrown by transport builders given an invalid configuration, or when the configured
 * backend cannot be opened. A builder that throws this never hands out a transport.
 */
public final class ConfigurationException extends TransportException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
