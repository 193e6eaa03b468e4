package chatfeed.demo.starter;

import chatfeed.ConnectionNotReadyException;
import chatfeed.listener.MessageChangeListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/test")
public class TestController {

    private static final Logger log = LoggerFactory.getLogger(TestController.class);
    private static final String TEST_USER = "Test User";

    private final MessageChangeListener listener;
    private final JdbcTemplate jdbcTemplate;

    public TestController(MessageChangeListener listener, JdbcTemplate jdbcTemplate) {
        this.listener = listener;
        this.jdbcTemplate = jdbcTemplate;
    }

    @PostMapping("/notification")
    public ResponseEntity<Map<String, Object>> sendTestNotification() {
        try {
            listener.testNotification();
            return ResponseEntity.ok(Map.of(
                    "message", "Test notification sent successfully",
                    "timestamp", Instant.now().toString()));
        } catch (ConnectionNotReadyException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                    "error", e.getMessage(),
                    "state", e.state().name(),
                    "timestamp", Instant.now().toString()));
        } catch (SQLException e) {
            log.error("Test notification failed", e);
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", e.getMessage(),
                    "timestamp", Instant.now().toString()));
        }
    }

    @GetMapping("/listener-status")
    public Map<String, Object> listenerStatus() {
        return Map.of(
                "status", listener.isListening() ? "Active" : "Inactive",
                "isListening", listener.isListening(),
                "state", listener.state().name(),
                "timestamp", Instant.now().toString());
    }

    /**
     * Makes sure a test user, group and membership exist, then inserts a message so
     * the trigger publishes an INSERT notification.
     */
    @PostMapping("/simulate-message")
    @Transactional
    public Map<String, Object> simulateMessage() {
        UUID userId = findOrCreateUser();
        UUID groupId = findOrCreateGroup();
        jdbcTemplate.update(
                "INSERT INTO group_participants (group_uuid, user_uuid) VALUES (?, ?) ON CONFLICT DO NOTHING",
                groupId, userId);

        String content = "Test message at " + Instant.now();
        Long messageId = jdbcTemplate.queryForObject(
                "INSERT INTO messages (group_uuid, sender_uuid, content) VALUES (?, ?, ?) RETURNING id",
                Long.class, groupId, userId, content);

        return Map.of(
                "message", "Test message created successfully",
                "messageId", messageId,
                "content", content,
                "timestamp", Instant.now().toString());
    }

    private UUID findOrCreateUser() {
        List<UUID> existing = jdbcTemplate.queryForList(
                "SELECT uuid FROM users WHERE name = ? LIMIT 1", UUID.class, TEST_USER);
        if (!existing.isEmpty()) {
            return existing.get(0);
        }
        return jdbcTemplate.queryForObject(
                "INSERT INTO users (name) VALUES (?) RETURNING uuid", UUID.class, TEST_USER);
    }

    private UUID findOrCreateGroup() {
        List<UUID> existing = jdbcTemplate.queryForList("SELECT uuid FROM groups LIMIT 1", UUID.class);
        if (!existing.isEmpty()) {
            return existing.get(0);
        }
        return jdbcTemplate.queryForObject("INSERT INTO groups DEFAULT VALUES RETURNING uuid", UUID.class);
    }
}
