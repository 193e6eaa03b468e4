package chatfeed.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the change listener.
 *
 * <p>The listener asks for one connection per listen session and keeps it for the
 * whole session; a test notification asks for a short-lived second one. Callers
 * are responsible for closing the returned connection.
 *
 * @see chatfeed.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
