package chatfeed.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Installs the database-side function and trigger that emit change notifications.
 *
 * <p>Implementations must be idempotent (replace-if-exists): the listener runs
 * the installer on every connect and every reconnect, so a trigger that was
 * dropped by hand or by a migration heals itself on the next connect.
 *
 * @see chatfeed.jdbc.PostgresTriggerInstaller
 */
@FunctionalInterface
public interface TriggerInstaller {

  /** Installer that does nothing, for schemas managed by migrations. */
  TriggerInstaller NONE = conn -> {
  };

  /**
   * (Re)creates the notification function and trigger.
   *
   * @param conn the listener connection
   * @throws SQLException if the DDL fails; the failure aborts the connect attempt
   */
  void install(Connection conn) throws SQLException;
}
