package upbus;

/**
 * Thrown when a {@link UUri} used as a topic is malformed.
 *
 * @see UUri#isTopic()
 */
public final class InvalidTopicException extends TransportException {
  private final UUri topic;

  public InvalidTopicException(UUri topic) {
    super("Invalid topic: " + topic);
    this.topic = topic;
  }

  public UUri topic() {
    return topic;
  }

  /**
   * Checks that {@code topic} is a well-formed topic.
   *
   * @param topic the URI to check
   * @return the topic
   * @throws NullPointerException   if {@code topic} is null
   * @throws InvalidTopicException  if {@code topic} is not a well-formed topic
   */
  public static UUri requireTopic(UUri topic) {
    if (topic == null) {
      throw new NullPointerException("topic");
    }
    if (!topic.isTopic()) {
      throw new InvalidTopicException(topic);
    }
    return topic;
  }
}
