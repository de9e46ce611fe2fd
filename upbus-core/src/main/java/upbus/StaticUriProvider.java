package upbus;

import java.util.Objects;

/**
 * {@link UriProvider} for an entity with a fixed authority, entity id and version.
 *
 * <pre>{@code
 * UriProvider provider = new StaticUriProvider("veh", 0xA34B, 0x01);
 * UUri topic = provider.getResourceUri(0x8001);   // up://veh/A34B/1/8001
 * }</pre>
 */
public final class StaticUriProvider implements UriProvider {
  private final UUri sourceUri;

  /**
   * Creates a provider.
   *
   * @param authority the authority name, non-blank
   * @param entityId  the entity id, unsigned 32-bit
   * @param version   the major version, 0..255
   * @throws IllegalArgumentException if the authority is blank or the version is out of range
   */
  public StaticUriProvider(String authority, int entityId, int version) {
    Objects.requireNonNull(authority, "authority");
    if (authority.isBlank()) {
      throw new IllegalArgumentException("authority cannot be blank");
    }
    this.sourceUri = new UUri(authority, entityId, version, 0);
  }

  @Override
  public String getAuthority() {
    return sourceUri.authority();
  }

  @Override
  public UUri getSourceUri() {
    return sourceUri;
  }

  @Override
  public UUri getResourceUri(int resourceId) {
    return sourceUri.withResourceId(resourceId);
  }

  @Override
  public String toString() {
    return "StaticUriProvider{" + sourceUri + '}';
  }
}
