/**
 * UDP multicast session, the default substrate of {@link upbus.network.NetworkTransport}.
 */
package upbus.network.udp;
