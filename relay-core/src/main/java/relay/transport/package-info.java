/**
 * Connector endpoint configuration and the bundled HTTP transport.
 */
package relay.transport;
