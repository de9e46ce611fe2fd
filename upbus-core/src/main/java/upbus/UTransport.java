package upbus;

import upbus.registry.ListenerRegistration;

/**
 * Capability interface of a message transport.
 *
 * <p>Publishers, notifiers and applications depend on this interface only, so backends
 * ({@link LocalTransport}, the network transport, a test fake) can be swapped without
 * changing application logic.
 *
 * <p>Publish and notification messages are fire-and-forget: {@link #send} succeeds for a
 * well-formed message whether or not anybody listens.
 *
 * @see LocalTransport
 */
public interface UTransport extends AutoCloseable {

  /**
   * Sends a message, routed by its {@linkplain UMessage#source() source} topic.
   *
   * @param message the message
   * @throws InvalidTopicException          if the message source is not a well-formed topic
   * @throws TransportUnavailableException  if the transport is closed or not ready
   */
  void send(UMessage message);

  /**
   * Registers a listener for messages on a topic. Registering the same listener instance for
   * the same topic twice returns the existing registration and causes no double delivery.
   *
   * @param topic    the topic
   * @param listener the listener
   * @return the registration handle
   * @throws InvalidTopicException          if the topic is malformed
   * @throws TransportUnavailableException  if the transport is closed or not ready
   */
  ListenerRegistration registerListener(UUri topic, UListener listener);

  /**
   * Unregisters a listener instance from a topic.
   *
   * @param topic    the topic
   * @param listener the listener instance passed to {@link #registerListener}
   * @throws ListenerNotFoundException      if the pair is not registered
   * @throws InvalidTopicException          if the topic is malformed
   * @throws TransportUnavailableException  if the transport is closed
   */
  void unregisterListener(UUri topic, UListener listener);

  /**
   * Unregisters by the handle returned from {@link #registerListener}.
   *
   * @param registration the registration handle
   * @throws ListenerNotFoundException      if the registration is no longer active
   * @throws TransportUnavailableException  if the transport is closed
   */
  void unregisterListener(ListenerRegistration registration);

  /**
   * Releases the transport and drops every registration. Idempotent.
   */
  @Override
  void close();
}
