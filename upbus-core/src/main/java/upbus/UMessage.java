package upbus;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable message envelope handed to a {@link UTransport}.
 *
 * <p>For {@link UMessageType#PUBLISH} the {@code source} is the topic and there is no
 * destination. For {@link UMessageType#NOTIFICATION} the {@code source} is the notifying
 * resource's topic and {@code destination} addresses the recipient.
 *
 * <p>Each message gets a monotonic ULID {@code id} unless the builder sets one.
 * Create instances with {@link #publish(UUri)} or {@link #notification(UUri, UUri)}.
 */
public final class UMessage {
  private final String id;
  private final UMessageType type;
  private final UUri source;
  private final UUri destination;
  private final UPayload payload;

  private UMessage(Builder builder) {
    this.id = builder.id == null ? newMessageId() : builder.id;
    if (this.id.isEmpty()) {
      throw new IllegalArgumentException("id cannot be empty");
    }
    this.type = builder.type;
    this.source = Objects.requireNonNull(builder.source, "source");
    if (type == UMessageType.NOTIFICATION) {
      this.destination = Objects.requireNonNull(builder.destination, "destination");
    } else {
      if (builder.destination != null) {
        throw new IllegalArgumentException("A " + type + " message cannot have a destination");
      }
      this.destination = null;
    }
    this.payload = builder.payload;
  }

  /**
   * Starts a publish message on a topic.
   *
   * @param topic the topic, which becomes the message source
   * @return a new builder
   */
  public static Builder publish(UUri topic) {
    return new Builder(UMessageType.PUBLISH, topic, null);
  }

  /**
   * Starts a notification message.
   *
   * @param source      the notifying resource's topic
   * @param destination the addressed recipient
   * @return a new builder
   */
  public static Builder notification(UUri source, UUri destination) {
    return new Builder(UMessageType.NOTIFICATION, source, destination);
  }

  /**
   * Starts a message of the given type. Used by codecs restoring a message off the wire.
   *
   * @param type        the message type
   * @param source      the source topic
   * @param destination the destination, {@code null} for publish messages
   * @return a new builder
   */
  public static Builder builder(UMessageType type, UUri source, UUri destination) {
    return new Builder(Objects.requireNonNull(type, "type"), source, destination);
  }

  public String id() {
    return id;
  }

  public UMessageType type() {
    return type;
  }

  public UUri source() {
    return source;
  }

  public Optional<UUri> destination() {
    return Optional.ofNullable(destination);
  }

  public Optional<UPayload> payload() {
    return Optional.ofNullable(payload);
  }

  /**
   * Returns the payload as text.
   *
   * @return the UTF-8 decoded payload, or empty if there is no payload or it is not valid UTF-8
   */
  public Optional<String> extractString() {
    return payload == null ? Optional.empty() : payload.asString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof UMessage)) return false;
    UMessage other = (UMessage) o;
    return id.equals(other.id)
        && type == other.type
        && source.equals(other.source)
        && Objects.equals(destination, other.destination)
        && Objects.equals(payload, other.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, type, source, destination, payload);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("UMessage{id=").append(id)
        .append(", type=").append(type)
        .append(", source=").append(source);
    if (destination != null) {
      sb.append(", destination=").append(destination);
    }
    if (payload != null) {
      sb.append(", payload=").append(payload);
    }
    return sb.append('}').toString();
  }

  /**
   * Builder for {@link UMessage}.
   */
  public static final class Builder {
    private final UMessageType type;
    private final UUri source;
    private final UUri destination;
    private String id;
    private UPayload payload;

    private Builder(UMessageType type, UUri source, UUri destination) {
      this.type = type;
      this.source = source;
      this.destination = destination;
    }

    /**
     * Sets a custom message id. Optional; defaults to a monotonic ULID.
     *
     * @param id the message id
     * @return this builder
     */
    public Builder id(String id) {
      this.id = id;
      return this;
    }

    /**
     * Sets the payload. Optional; {@code null} means no payload.
     *
     * @param payload the payload
     * @return this builder
     */
    public Builder payload(UPayload payload) {
      this.payload = payload;
      return this;
    }

    /**
     * Builds an immutable {@link UMessage}.
     *
     * @return a new message
     * @throws NullPointerException     if the source, or a notification's destination, is missing
     * @throws IllegalArgumentException if a publish message has a destination or the id is empty
     */
    public UMessage build() {
      return new UMessage(this);
    }
  }

  private static String newMessageId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
