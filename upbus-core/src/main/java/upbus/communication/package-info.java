/**
 * Convenience layer for applications: {@link upbus.communication.Publisher} and
 * {@link upbus.communication.Notifier} resolve an entity's resource ids into topics and
 * delegate to any {@link upbus.UTransport}.
 */
package upbus.communication;
