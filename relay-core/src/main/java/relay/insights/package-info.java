/**
 * Failure insights and windowed outcome trends computed from delivery snapshots.
 */
package relay.insights;
