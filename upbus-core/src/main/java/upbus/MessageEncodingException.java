package upbus;

/**
 * Thrown when a message cannot be encoded for the wire, for example because a field exceeds
 * the frame format's limits. Nothing is sent.
 */
public final class MessageEncodingException extends TransportException {

  public MessageEncodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
