package upbus;

/**
 * Thrown when the transport backend cannot serve a request, for example because it was
 * closed or its network session is gone.
 */
public final class TransportUnavailableException extends TransportException {

  public TransportUnavailableException(String message) {
    super(message);
  }

  public TransportUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
