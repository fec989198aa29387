/**
 * Risk scoring and ranking of a project's connectors.
 *
 * @see relay.reliability.ReliabilityRanker
 */
package relay.reliability;
