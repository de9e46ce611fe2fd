package upbus;

/**
 * Resolves an entity's static identity into full {@link UUri}s.
 *
 * @see StaticUriProvider
 */
public interface UriProvider {

  /**
   * Returns the authority of the entity.
   *
   * @return the authority name
   */
  String getAuthority();

  /**
   * Returns the identity URI of the entity, with resource id 0.
   *
   * @return the source URI
   */
  UUri getSourceUri();

  /**
   * Returns the URI of one of the entity's resources.
   *
   * @param resourceId the resource id
   * @return the resource URI
   * @throws IllegalArgumentException if the resource id is out of range
   */
  UUri getResourceUri(int resourceId);
}
