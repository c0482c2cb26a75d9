/**
 * Micrometer bridge for campaign engine metrics.
 *
 * @see campaign.micrometer.MicrometerMetricsExporter
 */
package campaign.micrometer;
