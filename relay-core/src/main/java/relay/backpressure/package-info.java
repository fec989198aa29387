/**
 * Backpressure policy: per-connector drain limits, the draft and approval lifecycle that changes
 * them, what-if simulation and tuning advice.
 *
 * <p>{@link relay.backpressure.BackpressureGate} is the single function that turns a queue
 * summary and a policy into a drain limit; the pump and the simulator both call it.
 *
 * @see relay.backpressure.PolicyLifecycle
 * @see relay.backpressure.BackpressureGate
 */
package relay.backpressure;
