package chatfeed.jdbc;

import chatfeed.spi.ChangeChannel;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ChangeChannel} on PostgreSQL {@code LISTEN} / {@code NOTIFY}.
 *
 * <p>Channel names are validated with {@link TriggerNames#validate} and double-quoted in
 * {@code LISTEN}, so they match the exact string passed to {@code pg_notify}. Notifications
 * are read with pgjdbc's {@link PGConnection#getNotifications(int)}, which blocks on the
 * socket for at most the given timeout. Works through pool wrappers that implement
 * {@link Connection#unwrap}.
 */
public final class PostgresChangeChannel implements ChangeChannel {
  private static final Logger logger = Logger.getLogger(PostgresChangeChannel.class.getName());

  @Override
  public void listen(Connection conn, String channel) throws SQLException {
    execute(conn, "LISTEN \"" + TriggerNames.validate(channel) + "\"");
  }

  @Override
  public void unlisten(Connection conn, String channel) throws SQLException {
    execute(conn, "UNLISTEN \"" + TriggerNames.validate(channel) + "\"");
  }

  @Override
  public List<String> receive(Connection conn, String channel, int timeoutMs) throws SQLException {
    if (timeoutMs <= 0) {
      throw new IllegalArgumentException("timeoutMs must be > 0");
    }
    PGNotification[] notifications = conn.unwrap(PGConnection.class).getNotifications(timeoutMs);
    if (notifications == null || notifications.length == 0) {
      return List.of();
    }
    List<String> payloads = new ArrayList<>(notifications.length);
    for (PGNotification notification : notifications) {
      if (channel.equals(notification.getName())) {
        payloads.add(notification.getParameter());
      } else {
        logger.log(Level.FINE, "Ignoring notification on channel {0}", notification.getName());
      }
    }
    return payloads;
  }

  @Override
  public void send(Connection conn, String channel, String payload) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement("SELECT pg_notify(?, ?)")) {
      ps.setString(1, TriggerNames.validate(channel));
      ps.setString(2, payload);
      ps.execute();
    }
  }

  private static void execute(Connection conn, String sql) throws SQLException {
    try (Statement statement = conn.createStatement()) {
      statement.execute(sql);
    }
  }
}
