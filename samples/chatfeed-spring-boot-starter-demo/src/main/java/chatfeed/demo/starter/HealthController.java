package chatfeed.demo.starter;

import chatfeed.listener.MessageChangeListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/health")
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final JdbcTemplate jdbcTemplate;
    private final MessageChangeListener listener;

    public HealthController(JdbcTemplate jdbcTemplate, MessageChangeListener listener) {
        this.jdbcTemplate = jdbcTemplate;
        this.listener = listener;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            body.put("status", "OK");
            body.put("database", "Connected");
            body.put("listener", listener.isListening() ? "Active" : "Inactive");
            body.put("timestamp", Instant.now().toString());
            return ResponseEntity.ok(body);
        } catch (DataAccessException e) {
            log.warn("Health check failed", e);
            body.put("status", "Error");
            body.put("database", "Disconnected");
            body.put("error", e.getMessage());
            body.put("timestamp", Instant.now().toString());
            return ResponseEntity.internalServerError().body(body);
        }
    }

    @GetMapping("/detailed")
    public ResponseEntity<Map<String, Object>> detailed() {
        Map<String, Object> body = new LinkedHashMap<>();
        try {
            long start = System.nanoTime();
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            long latencyMs = (System.nanoTime() - start) / 1_000_000;

            body.put("status", "OK");
            body.put("database", Map.of("status", "Connected", "latency", latencyMs + "ms"));
            body.put("listener", Map.of(
                    "isListening", listener.isListening(),
                    "state", listener.state().name(),
                    "channel", listener.channel()));
            body.put("timestamp", Instant.now().toString());
            return ResponseEntity.ok(body);
        } catch (DataAccessException e) {
            log.warn("Detailed health check failed", e);
            body.put("status", "Error");
            body.put("error", e.getMessage());
            body.put("timestamp", Instant.now().toString());
            return ResponseEntity.internalServerError().body(body);
        }
    }
}
