/**
 * Micrometer bridge for exporting control-plane metrics.
 *
 * @see relay.micrometer.MicrometerMetricsExporter
 */
package relay.micrometer;
