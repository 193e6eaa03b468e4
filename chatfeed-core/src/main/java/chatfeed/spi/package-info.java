/**
 * Service provider interfaces implemented per database or per metrics backend.
 *
 * @see chatfeed.spi.ChangeChannel
 * @see chatfeed.spi.TriggerInstaller
 * @see chatfeed.spi.ConnectionProvider
 * @see chatfeed.spi.MetricsExporter
 */
package chatfeed.spi;
