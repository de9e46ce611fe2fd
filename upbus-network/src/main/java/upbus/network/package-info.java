/**
 * Inter-process transport: {@link upbus.network.NetworkTransport} on top of a pluggable
 * {@link upbus.network.PubSubSession}, with the binary frame codec and key mapping it uses.
 */
package upbus.network;
