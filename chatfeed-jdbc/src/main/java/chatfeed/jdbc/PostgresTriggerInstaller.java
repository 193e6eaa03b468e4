package chatfeed.jdbc;

import chatfeed.spi.TriggerInstaller;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Installs the PL/pgSQL function and row trigger that publish every change on the
 * messages table as a JSON notification.
 *
 * <p>Payload per operation:
 * <ul>
 *   <li>INSERT: {@code operation, table, id, group_uuid, sender_uuid, content, file,
 *       created_date, is_deleted} from the new row</li>
 *   <li>UPDATE: the INSERT fields from the new row, plus {@code old_id, old_content,
 *       old_is_deleted} from the old row</li>
 *   <li>DELETE: {@code operation, table, id, group_uuid, sender_uuid} from the old row</li>
 * </ul>
 *
 * <p>Installation is {@code CREATE OR REPLACE FUNCTION}, {@code DROP TRIGGER IF EXISTS},
 * {@code CREATE TRIGGER}, run in one transaction so no row change slips through between
 * drop and create. Running it repeatedly leaves exactly one trigger.
 *
 * <p>PostgreSQL rejects notification payloads of 8000 bytes or more, and the error aborts
 * the writing transaction; message content must stay well below that.
 */
public final class PostgresTriggerInstaller implements TriggerInstaller {
  private static final Logger logger = Logger.getLogger(PostgresTriggerInstaller.class.getName());

  private final String tableName;
  private final String functionName;
  private final String triggerName;
  private final String channel;

  public PostgresTriggerInstaller() {
    this(TriggerNames.DEFAULT_TABLE, TriggerNames.DEFAULT_FUNCTION,
        TriggerNames.DEFAULT_TRIGGER, TriggerNames.DEFAULT_CHANNEL);
  }

  /**
   * @param tableName    table the trigger is attached to
   * @param functionName name of the trigger function
   * @param triggerName  name of the trigger
   * @param channel      notification channel the function publishes on
   */
  public PostgresTriggerInstaller(String tableName, String functionName, String triggerName, String channel) {
    this.tableName = TriggerNames.validate(tableName);
    this.functionName = TriggerNames.validate(functionName);
    this.triggerName = TriggerNames.validate(triggerName);
    this.channel = TriggerNames.validate(channel);
  }

  @Override
  public void install(Connection conn) throws SQLException {
    Objects.requireNonNull(conn, "conn");
    boolean autoCommit = conn.getAutoCommit();
    conn.setAutoCommit(false);
    try (Statement statement = conn.createStatement()) {
      for (String sql : statements()) {
        statement.execute(sql);
      }
      conn.commit();
    } catch (SQLException | RuntimeException e) {
      try {
        conn.rollback();
      } catch (SQLException rollbackFailure) {
        e.addSuppressed(rollbackFailure);
      }
      throw e;
    } finally {
      conn.setAutoCommit(autoCommit);
    }
    logger.log(Level.INFO, "Installed trigger {0} on {1} notifying channel {2}",
        new Object[]{triggerName, tableName, channel});
  }

  List<String> statements() {
    return List.of(functionSql(), dropTriggerSql(), createTriggerSql());
  }

  String functionSql() {
    return "CREATE OR REPLACE FUNCTION " + functionName + "() RETURNS trigger AS $$\n"
        + "DECLARE\n"
        + "  payload json;\n"
        + "BEGIN\n"
        + "  IF TG_OP = 'DELETE' THEN\n"
        + "    payload := json_build_object(\n"
        + "      'operation', TG_OP,\n"
        + "      'table', TG_TABLE_NAME,\n"
        + "      'id', OLD.id,\n"
        + "      'group_uuid', OLD.group_uuid,\n"
        + "      'sender_uuid', OLD.sender_uuid);\n"
        + "  ELSIF TG_OP = 'UPDATE' THEN\n"
        + "    payload := json_build_object(\n"
        + "      'operation', TG_OP,\n"
        + "      'table', TG_TABLE_NAME,\n"
        + "      'id', NEW.id,\n"
        + "      'group_uuid', NEW.group_uuid,\n"
        + "      'sender_uuid', NEW.sender_uuid,\n"
        + "      'content', NEW.content,\n"
        + "      'file', NEW.file,\n"
        + "      'created_date', NEW.created_date,\n"
        + "      'is_deleted', NEW.is_deleted,\n"
        + "      'old_id', OLD.id,\n"
        + "      'old_content', OLD.content,\n"
        + "      'old_is_deleted', OLD.is_deleted);\n"
        + "  ELSE\n"
        + "    payload := json_build_object(\n"
        + "      'operation', TG_OP,\n"
        + "      'table', TG_TABLE_NAME,\n"
        + "      'id', NEW.id,\n"
        + "      'group_uuid', NEW.group_uuid,\n"
        + "      'sender_uuid', NEW.sender_uuid,\n"
        + "      'content', NEW.content,\n"
        + "      'file', NEW.file,\n"
        + "      'created_date', NEW.created_date,\n"
        + "      'is_deleted', NEW.is_deleted);\n"
        + "  END IF;\n"
        + "  PERFORM pg_notify('" + channel + "', payload::text);\n"
        + "  RETURN COALESCE(NEW, OLD);\n"
        + "END;\n"
        + "$$ LANGUAGE plpgsql";
  }

  String dropTriggerSql() {
    return "DROP TRIGGER IF EXISTS " + triggerName + " ON " + tableName;
  }

  String createTriggerSql() {
    return "CREATE TRIGGER " + triggerName
        + " AFTER INSERT OR UPDATE OR DELETE ON " + tableName
        + " FOR EACH ROW EXECUTE FUNCTION " + functionName + "()";
  }

  public String tableName() {
    return tableName;
  }

  public String functionName() {
    return functionName;
  }

  public String triggerName() {
    return triggerName;
  }

  public String channel() {
    return channel;
  }
}
