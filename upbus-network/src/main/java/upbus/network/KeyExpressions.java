package upbus.network;

import upbus.UUri;

import java.util.Locale;
import java.util.Objects;

/**
 * Maps topics to the key expressions sessions route frames by.
 *
 * <p>The key of a topic is {@code up/<authority>/<ENTITY>/<VERSION>/<RESOURCE>} with
 * upper-case hexadecimal numbers; equal topics always map to equal keys.
 */
public final class KeyExpressions {
  public static final String PREFIX = "up/";

  private KeyExpressions() {}

  /**
   * Returns the key expression of a topic.
   *
   * @param topic the topic
   * @return the key
   */
  public static String of(UUri topic) {
    Objects.requireNonNull(topic, "topic");
    return PREFIX + topic.authority() + '/'
        + hex(topic.entityId()) + '/'
        + hex(topic.version()) + '/'
        + hex(topic.resourceId());
  }

  private static String hex(int value) {
    return Integer.toHexString(value).toUpperCase(Locale.ROOT);
  }
}
