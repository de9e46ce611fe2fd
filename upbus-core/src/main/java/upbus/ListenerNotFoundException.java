package upbus;

/**
 * Thrown when unregistering a (topic, listener) pair or registration handle that is not
 * currently registered. Other listeners of the topic are unaffected.
 */
public final class ListenerNotFoundException extends TransportException {
  private final UUri topic;

  public ListenerNotFoundException(UUri topic) {
    super("No matching listener registered for topic " + topic);
    this.topic = topic;
  }

  public UUri topic() {
    return topic;
  }
}
