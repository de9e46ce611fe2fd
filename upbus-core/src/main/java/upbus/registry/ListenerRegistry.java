package upbus.registry;

import upbus.UListener;
import upbus.UMessage;
import upbus.UUri;

import java.util.Set;

/**
 * Index of listeners by topic, shared by all operations issued against one transport.
 *
 * <p>A listener appears at most once per topic. Registration, unregistration and dispatch
 * may run concurrently; a dispatch always works on a consistent snapshot of the topic's
 * listeners taken when it starts.
 *
 * @see DefaultListenerRegistry
 */
public interface ListenerRegistry {

  /**
   * Registers a listener for a topic. Registering the same listener instance for the same
   * topic again returns the existing registration.
   *
   * @param topic    the topic
   * @param listener the listener
   * @return the registration handle
   * @throws upbus.InvalidTopicException if the topic is malformed
   */
  ListenerRegistration register(UUri topic, UListener listener);

  /**
   * Removes the registration of a listener instance for a topic.
   *
   * @param topic    the topic
   * @param listener the listener instance that was registered
   * @throws upbus.InvalidTopicException     if the topic is malformed
   * @throws upbus.ListenerNotFoundException if the pair is not registered
   */
  void unregister(UUri topic, UListener listener);

  /**
   * Removes a registration by handle.
   *
   * @param registration the handle returned by {@link #register}
   * @throws upbus.ListenerNotFoundException if the registration is no longer active
   */
  void unregister(ListenerRegistration registration);

  /**
   * Invokes every listener registered for {@code topic} when the call began, synchronously
   * on the calling thread. A topic without listeners is a no-op.
   *
   * @param topic   the topic to dispatch on
   * @param message the message handed to each listener
   * @return the number of listeners invoked
   */
  int dispatch(UUri topic, UMessage message);

  /**
   * Returns whether the registration is still active.
   *
   * @param registration the handle
   * @return {@code true} if active
   */
  boolean isRegistered(ListenerRegistration registration);

  /**
   * Returns the number of listeners currently registered for a topic.
   *
   * @param topic the topic
   * @return the listener count, zero if none
   */
  int listenerCount(UUri topic);

  default boolean hasListeners(UUri topic) {
    return listenerCount(topic) > 0;
  }

  /**
   * Returns the topics that have at least one listener.
   *
   * @return an immutable snapshot
   */
  Set<UUri> topics();

  /**
   * Removes every registration.
   */
  void clear();
}
