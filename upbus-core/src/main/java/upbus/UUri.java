package upbus;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable structured address of a resource: authority, entity id, version and resource id.
 *
 * <p>Equality is structural; two {@code UUri}s naming the same logical topic are equal and
 * share one entry in a {@linkplain upbus.registry.ListenerRegistry listener registry}.
 *
 * <p>The textual form is {@code up://<authority>/<ENTITY>/<VERSION>/<RESOURCE>} with
 * upper-case hexadecimal numbers, for example {@code up://veh/A34B/1/8001}.
 *
 * @see UriProvider
 */
public final class UUri {
  public static final String SCHEME = "up:";
  public static final int MAX_VERSION = 0xFF;
  public static final int MAX_RESOURCE_ID = 0xFFFF;
  public static final int MIN_TOPIC_ID = 0x8000;
  public static final int MAX_TOPIC_ID = 0xFFFE;

  private final String authority;
  private final int entityId;
  private final int version;
  private final int resourceId;

  /**
   * Creates a URI.
   *
   * @param authority  device or host name, may be empty for a local reference
   * @param entityId   entity identifier, interpreted as unsigned 32-bit
   * @param version    major version, 0..255
   * @param resourceId resource identifier, 0..0xFFFF
   * @throws IllegalArgumentException if version or resource id are out of range
   */
  public UUri(String authority, int entityId, int version, int resourceId) {
    this.authority = Objects.requireNonNull(authority, "authority");
    if (version < 0 || version > MAX_VERSION) {
      throw new IllegalArgumentException("version must be within 0.." + MAX_VERSION + ": " + version);
    }
    if (resourceId < 0 || resourceId > MAX_RESOURCE_ID) {
      throw new IllegalArgumentException("resourceId must be within 0.." + MAX_RESOURCE_ID + ": " + resourceId);
    }
    this.entityId = entityId;
    this.version = version;
    this.resourceId = resourceId;
  }

  /**
   * Parses the textual form produced by {@link #toUri()}.
   *
   * <p>The scheme is optional and {@code /<ENTITY>/<VERSION>/<RESOURCE>} (no authority)
   * is accepted as well.
   *
   * @param uri the URI string
   * @return the parsed URI
   * @throws IllegalArgumentException if the string is not a valid URI
   */
  public static UUri parse(String uri) {
    Objects.requireNonNull(uri, "uri");
    String rest = uri.startsWith(SCHEME) ? uri.substring(SCHEME.length()) : uri;
    String authority = "";
    if (rest.startsWith("//")) {
      int slash = rest.indexOf('/', 2);
      if (slash < 0) {
        throw new IllegalArgumentException("Missing path in URI: " + uri);
      }
      authority = rest.substring(2, slash);
      rest = rest.substring(slash);
    }
    if (!rest.startsWith("/")) {
      throw new IllegalArgumentException("URI path must start with '/': " + uri);
    }
    String[] segments = rest.substring(1).split("/", -1);
    if (segments.length != 3) {
      throw new IllegalArgumentException("URI path must have entity, version and resource: " + uri);
    }
    try {
      int entityId = Integer.parseUnsignedInt(segments[0], 16);
      int version = Integer.parseInt(segments[1], 16);
      int resourceId = Integer.parseInt(segments[2], 16);
      return new UUri(authority, entityId, version, resourceId);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number in URI: " + uri, e);
    }
  }

  public String authority() {
    return authority;
  }

  /**
   * Returns the entity id; use {@link Integer#toUnsignedLong(int)} for its numeric value.
   *
   * @return the raw entity id
   */
  public int entityId() {
    return entityId;
  }

  public int version() {
    return version;
  }

  public int resourceId() {
    return resourceId;
  }

  /**
   * Returns whether this URI can serve as a publish/subscribe topic: a non-blank authority
   * without {@code '/'} and a resource id within {@value #MIN_TOPIC_ID}..{@value #MAX_TOPIC_ID}.
   *
   * @return {@code true} for a well-formed topic
   */
  public boolean isTopic() {
    return !authority.isBlank()
        && authority.indexOf('/') < 0
        && resourceId >= MIN_TOPIC_ID
        && resourceId <= MAX_TOPIC_ID;
  }

  /**
   * Returns a copy of this URI addressing another resource of the same entity.
   *
   * @param resourceId the resource id
   * @return the derived URI
   */
  public UUri withResourceId(int resourceId) {
    return new UUri(authority, entityId, version, resourceId);
  }

  public String toUri() {
    return SCHEME + "//" + authority + '/'
        + Integer.toHexString(entityId).toUpperCase(Locale.ROOT) + '/'
        + Integer.toHexString(version).toUpperCase(Locale.ROOT) + '/'
        + Integer.toHexString(resourceId).toUpperCase(Locale.ROOT);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof UUri)) return false;
    UUri other = (UUri) o;
    return entityId == other.entityId
        && version == other.version
        && resourceId == other.resourceId
        && authority.equals(other.authority);
  }

  @Override
  public int hashCode() {
    return Objects.hash(authority, entityId, version, resourceId);
  }

  @Override
  public String toString() {
    return toUri();
  }
}
