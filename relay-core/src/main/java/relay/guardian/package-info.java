/**
 * Reliability guardian: turns risk rankings into rate-limited queue drains and dead-letter redrives.
 *
 * @see relay.guardian.GuardianController
 * @see relay.guardian.ActionPlanner
 */
package relay.guardian;
