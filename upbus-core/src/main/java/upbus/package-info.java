/**
 * Root API of upbus: publish/subscribe and notification messaging addressed by
 * structured URIs, independent of the transport that carries the messages.
 *
 * <h2>Core Design</h2>
 * <p>Every resource is addressed by a {@link upbus.UUri} (authority, entity id, version,
 * resource id). Messages ({@link upbus.UMessage}) are handed to a {@link upbus.UTransport},
 * which routes them by their source topic to the {@link upbus.UListener}s registered for
 * it. {@link upbus.LocalTransport} delivers within the process, synchronously and without
 * serialization; the {@code upbus-network} module provides a transport that carries the
 * same messages over a network pub/sub substrate.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>upbus-core</b>: URIs, messages, registry, local transport, publisher and notifier</li>
 *   <li><b>upbus-network</b>: network transport, wire codec and session implementations</li>
 *   <li><b>upbus-micrometer</b>: Micrometer {@linkplain upbus.spi.MetricsExporter metrics}</li>
 *   <li><b>upbus-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var uriProvider = new StaticUriProvider("veh", 0xA34B, 0x01);
 *
 * try (var transport = new LocalTransport()) {
 *   var notifier = new SimpleNotifier(transport, uriProvider);
 *   notifier.startListening(uriProvider.getResourceUri(0xD100),
 *       msg -> System.out.println("Received: " + msg.extractString().orElse("")));
 *
 *   notifier.notify(0xD100, uriProvider.getSourceUri(), UPayload.fromString("hello"));
 *
 *   var publisher = new SimplePublisher(transport, uriProvider);
 *   publisher.publish(0x8001, UPayload.fromString("hi"));
 * }
 * }</pre>
 *
 * @see upbus.UTransport
 * @see upbus.LocalTransport
 * @see upbus.communication.SimplePublisher
 * @see upbus.communication.SimpleNotifier
 */
package upbus;
