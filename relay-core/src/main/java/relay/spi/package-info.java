/**
 * Service provider interfaces consumed by the control plane: delivery persistence, the audit
 * log, policy storage, connector transports and metrics.
 */
package relay.spi;
