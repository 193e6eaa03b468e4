package chatfeed.jdbc;

import chatfeed.ChangeEvent;
import chatfeed.Operation;
import chatfeed.listener.MessageChangeListener;
import chatfeed.supervisor.FixedBackoffReconnectPolicy;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.Statement;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the listener on connections borrowed from a HikariCP pool, where the JDBC
 * connection is a proxy that has to be unwrapped to reach pgjdbc.
 */
@DockerAvailable
@Testcontainers
class HikariCPIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("chatfeed_pool_test");

  private HikariDataSource hikariDs;
  private MessageChangeListener listener;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(postgres.getJdbcUrl());
    config.setUsername(postgres.getUsername());
    config.setPassword(postgres.getPassword());
    config.setMaximumPoolSize(3);
    config.setMinimumIdle(1);
    config.setPoolName("chatfeed-test-pool");
    hikariDs = new HikariDataSource(config);

    try (Connection conn = hikariDs.getConnection(); Statement statement = conn.createStatement()) {
      statement.execute("CREATE TABLE IF NOT EXISTS messages ("
          + "id SERIAL PRIMARY KEY, group_uuid UUID NOT NULL, sender_uuid UUID NOT NULL, "
          + "content TEXT NOT NULL, file VARCHAR(255), "
          + "created_date TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP, "
          + "is_deleted BOOLEAN NOT NULL DEFAULT FALSE)");
    }

    listener = MessageChangeListener.builder()
        .connectionProvider(new DataSourceConnectionProvider(hikariDs))
        .changeChannel(new PostgresChangeChannel())
        .triggerInstaller(new PostgresTriggerInstaller())
        .reconnectPolicy(new FixedBackoffReconnectPolicy(200, 400))
        .pollTimeoutMs(100)
        .build();
  }

  @AfterEach
  void tearDown() {
    if (listener != null) {
      listener.close();
    }
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void deliversThroughPooledConnection() throws Exception {
    BlockingQueue<ChangeEvent> received = new LinkedBlockingQueue<>();
    listener.subscribe(received::add);
    listener.connect();

    try (Connection conn = hikariDs.getConnection(); Statement statement = conn.createStatement()) {
      statement.execute("INSERT INTO messages (group_uuid, sender_uuid, content) "
          + "VALUES (gen_random_uuid(), gen_random_uuid(), 'pooled')");
    }

    ChangeEvent event = received.poll(5, TimeUnit.SECONDS);
    assertNotNull(event);
    assertEquals(Operation.INSERT, event.operation());
    assertEquals("pooled", event.content());
  }

  @Test
  void testNotificationBorrowsSecondPooledConnection() throws Exception {
    BlockingQueue<ChangeEvent> received = new LinkedBlockingQueue<>();
    listener.subscribe(received::add);
    listener.connect();

    listener.testNotification("from pool");

    ChangeEvent event = received.poll(5, TimeUnit.SECONDS);
    assertNotNull(event);
    assertEquals("from pool", event.message());
    assertEquals(1, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void disconnectReturnsConnectionToPool() throws Exception {
    listener.connect();
    assertEquals(1, hikariDs.getHikariPoolMXBean().getActiveConnections());

    listener.disconnect();

    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }
}
