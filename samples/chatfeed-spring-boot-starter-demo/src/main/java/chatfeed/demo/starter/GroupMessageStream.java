package chatfeed.demo.starter;

import chatfeed.ChangeEvent;
import chatfeed.ChangeHandler;
import chatfeed.spring.boot.MessageChangeHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Fans message changes out to server-sent-event clients, one set of emitters per group.
 *
 * <p>Each change goes only to the clients of its {@code group_uuid}, as a named event
 * ({@code new_message}, {@code updated_message}, {@code deleted_message}). Test
 * notifications carry no group and are not streamed. A client whose send fails is dropped.
 */
@Component
@MessageChangeHandler
public class GroupMessageStream implements ChangeHandler {

  private static final Logger log = LoggerFactory.getLogger(GroupMessageStream.class);

  private final Map<UUID, Set<SseEmitter>> clients = new ConcurrentHashMap<>();
  private final long timeoutMs;

  public GroupMessageStream(@Value("${chatfeed.demo.stream-timeout-ms:1800000}") long timeoutMs) {
    this.timeoutMs = timeoutMs;
  }

  /**
   * Opens a stream for one group and sends the initial {@code connected} event.
   */
  public SseEmitter open(UUID groupId) {
    Objects.requireNonNull(groupId, "groupId");
    SseEmitter emitter = new SseEmitter(timeoutMs);
    register(groupId, emitter);
    try {
      emitter.send(SseEmitter.event()
          .name("connected")
          .data(Map.of("type", "connected", "group_uuid", groupId.toString()), MediaType.APPLICATION_JSON));
    } catch (IOException e) {
      remove(groupId, emitter);
      emitter.completeWithError(e);
    }
    return emitter;
  }

  void register(UUID groupId, SseEmitter emitter) {
    clients.computeIfAbsent(groupId, id -> new CopyOnWriteArraySet<>()).add(emitter);
    emitter.onCompletion(() -> remove(groupId, emitter));
    emitter.onTimeout(() -> remove(groupId, emitter));
    emitter.onError(e -> remove(groupId, emitter));
    log.info("[Stream] client joined group {} ({} open)", groupId, clientCount(groupId));
  }

  public int clientCount(UUID groupId) {
    Set<SseEmitter> emitters = clients.get(groupId);
    return emitters == null ? 0 : emitters.size();
  }

  @Override
  public void onChange(ChangeEvent event) {
    String name = eventName(event);
    if (name == null || event.groupId() == null) {
      return;
    }
    Set<SseEmitter> emitters = clients.get(event.groupId());
    if (emitters == null || emitters.isEmpty()) {
      return;
    }
    Map<String, Object> body = body(event);
    for (SseEmitter emitter : emitters) {
      try {
        emitter.send(SseEmitter.event()
            .id(event.eventId())
            .name(name)
            .data(body, MediaType.APPLICATION_JSON));
      } catch (IOException | IllegalStateException e) {
        log.debug("[Stream] dropping client of group {}", event.groupId(), e);
        remove(event.groupId(), emitter);
      }
    }
  }

  private void remove(UUID groupId, SseEmitter emitter) {
    clients.computeIfPresent(groupId, (id, emitters) -> {
      emitters.remove(emitter);
      return emitters.isEmpty() ? null : emitters;
    });
  }

  private static String eventName(ChangeEvent event) {
    return switch (event.operation()) {
      case INSERT -> "new_message";
      case UPDATE -> "updated_message";
      case DELETE -> "deleted_message";
      case TEST -> null;
    };
  }

  private static Map<String, Object> body(ChangeEvent event) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("operation", event.operation().name());
    body.put("id", event.id());
    body.put("group_uuid", event.groupId().toString());
    body.put("sender_uuid", event.senderId() == null ? null : event.senderId().toString());
    body.put("content", event.content());
    body.put("file", event.file());
    body.put("created_date", event.createdDate() == null ? null : event.createdDate().toString());
    body.put("is_deleted", event.deleted());
    return body;
  }
}
