package upbus.communication;

import upbus.UListener;
import upbus.UPayload;
import upbus.UUri;
import upbus.registry.ListenerRegistration;

/**
 * Sends notifications to other entities and listens for notifications on topics.
 *
 * <p>Listening follows a two-state cycle per (topic, listener) pair: {@code startListening}
 * moves it to registered (idempotently), {@code stopListening} moves it back and fails with
 * {@link upbus.ListenerNotFoundException} if it was not registered.
 *
 * @see SimpleNotifier
 */
public interface Notifier {

  /**
   * Sends a notification from one of the entity's resources to a destination.
   *
   * @param resourceId  the notifying resource id
   * @param destination the recipient address
   * @param payload     the payload, or {@code null}
   * @throws upbus.TransportException if the transport rejects the message
   */
  void notify(int resourceId, UUri destination, UPayload payload);

  /**
   * Starts delivering notifications on {@code topic} to {@code listener}.
   *
   * @param topic    the topic
   * @param listener the listener
   * @return the registration handle
   * @throws upbus.TransportException if registration fails
   */
  ListenerRegistration startListening(UUri topic, UListener listener);

  /**
   * Stops delivering notifications on {@code topic} to {@code listener}.
   *
   * @param topic    the topic
   * @param listener the listener instance passed to {@link #startListening}
   * @throws upbus.ListenerNotFoundException if the pair is not registered
   */
  void stopListening(UUri topic, UListener listener);

  /**
   * Stops the registration identified by a handle.
   *
   * @param registration the handle returned by {@link #startListening}
   * @throws upbus.ListenerNotFoundException if the registration is no longer active
   */
  void stopListening(ListenerRegistration registration);
}
