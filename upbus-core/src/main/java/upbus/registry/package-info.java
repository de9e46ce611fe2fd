/**
 * Listener routing by topic.
 *
 * <p>The registry maps each topic {@link upbus.UUri} to the set of
 * {@link upbus.UListener}s registered for it. Dispatching on a topic with no
 * listeners is a valid no-op.
 *
 * @see upbus.registry.ListenerRegistry
 * @see upbus.registry.DefaultListenerRegistry
 */
package upbus.registry;
