/**
 * In-memory pub/sub network for tests and single-process wiring.
 */
package upbus.network.loopback;
