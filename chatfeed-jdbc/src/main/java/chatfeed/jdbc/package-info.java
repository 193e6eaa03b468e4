/**
 * PostgreSQL implementations of the change-feed SPI.
 *
 * <p>{@link chatfeed.jdbc.PostgresTriggerInstaller} creates the function and trigger that
 * publish row changes; {@link chatfeed.jdbc.PostgresChangeChannel} listens for them with
 * pgjdbc.
 *
 * @see chatfeed.jdbc.PostgresChangeChannel
 * @see chatfeed.jdbc.PostgresTriggerInstaller
 * @see chatfeed.jdbc.DataSourceConnectionProvider
 */
package chatfeed.jdbc;
