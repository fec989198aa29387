/**
 * Audit trail of deliveries, policy changes and guardian actions.
 *
 * <p>{@link relay.audit.AuditPayload} is a closed set of typed event bodies with an
 * {@link relay.audit.AuditPayload.Unrecognized} fallback for event types this version does not know.
 */
package relay.audit;
