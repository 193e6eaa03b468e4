package chatfeed.spi;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Database-specific access to an asynchronous notification channel.
 *
 * <p>All methods operate on a caller-supplied connection and never close it.
 * The listener calls {@link #listen}, then repeatedly {@link #receive} on a
 * connection it owns exclusively; {@link #send} is issued on a separate connection.
 *
 * @see chatfeed.jdbc.PostgresChangeChannel
 */
public interface ChangeChannel {

  /**
   * Subscribes the connection to a channel.
   *
   * @param conn    the dedicated listener connection
   * @param channel the channel name
   * @throws SQLException if the subscription fails
   */
  void listen(Connection conn, String channel) throws SQLException;

  /**
   * Removes the connection's subscription to a channel.
   *
   * @param conn    the dedicated listener connection
   * @param channel the channel name
   * @throws SQLException if the statement fails
   */
  void unlisten(Connection conn, String channel) throws SQLException;

  /**
   * Waits up to {@code timeoutMs} for notifications and returns the payloads
   * received on {@code channel}, in arrival order. Returns an empty list on timeout.
   *
   * @param conn      the dedicated listener connection
   * @param channel   the channel name
   * @param timeoutMs maximum wait in milliseconds (&gt; 0)
   * @return payloads received, never {@code null}
   * @throws SQLException if the connection is broken or closed
   */
  List<String> receive(Connection conn, String channel, int timeoutMs) throws SQLException;

  /**
   * Publishes a payload on a channel.
   *
   * @param conn    any open connection
   * @param channel the channel name
   * @param payload the payload text
   * @throws SQLException if the statement fails
   */
  void send(Connection conn, String channel, String payload) throws SQLException;
}
