package upbus;

/**
 * Callback invoked by a {@link UTransport} when a message arrives on a registered topic.
 *
 * <h2>Execution Model</h2>
 * <p>{@link LocalTransport} calls listeners <b>synchronously</b> on the sender's thread, so a
 * listener that blocks also blocks the sender. Network transports call listeners on their
 * delivery thread.
 *
 * <h2>Identity</h2>
 * <p>Listeners are compared by object identity. Unregister with the same instance that was
 * registered, or better with the {@link upbus.registry.ListenerRegistration} returned by
 * registration.
 *
 * <h2>Error Handling</h2>
 * <p>A runtime exception thrown by a listener is logged and does not prevent delivery to the
 * remaining listeners; it is never reported to the sender.
 *
 * @see UTransport#registerListener(UUri, UListener)
 */
@FunctionalInterface
public interface UListener {

  /**
   * Handles a received message.
   *
   * @param message the message, shared with other listeners and never to be mutated
   */
  void onReceive(UMessage message);
}
