/**
 * Delivery records, statuses and queue summaries.
 */
package relay.model;
