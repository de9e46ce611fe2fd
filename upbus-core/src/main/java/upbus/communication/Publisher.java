package upbus.communication;

import upbus.UPayload;

/**
 * Publishes messages on the topics of one entity's resources.
 *
 * @see SimplePublisher
 */
public interface Publisher {

  /**
   * Publishes a message on the topic of a resource.
   *
   * @param resourceId the resource id, resolved to a topic by the entity's URI provider
   * @param payload    the payload, or {@code null} for a message without content
   * @throws upbus.TransportException if the transport rejects the message
   */
  void publish(int resourceId, UPayload payload);
}
