/**
 * Micrometer bridge for change-feed metrics.
 *
 * @see chatfeed.micrometer.MicrometerMetricsExporter
 */
package chatfeed.micrometer;
