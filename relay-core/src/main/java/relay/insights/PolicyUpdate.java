package relay.insights;

import relay.backpressure.PolicyPatch;

import java.time.Instant;

/**
 * One applied backpressure change, reconstructed from the audit log.
 */
public record PolicyUpdate(Instant appliedAt, String actor, long policyVersion, PolicyPatch applied) {
}
