package chatfeed.demo.starter;

import chatfeed.ChangeEvent;
import chatfeed.Operation;

import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class GroupMessageStreamTest {

  private final GroupMessageStream stream = new GroupMessageStream(60_000);
  private final UUID groupA = UUID.randomUUID();
  private final UUID groupB = UUID.randomUUID();

  private static ChangeEvent change(Operation operation, UUID groupId, long id) {
    return ChangeEvent.builder(operation)
        .id(id)
        .groupId(groupId)
        .senderId(UUID.randomUUID())
        .content("hello")
        .deleted(operation == Operation.DELETE)
        .build();
  }

  @Test
  void openRegistersClientWithConfiguredTimeout() {
    SseEmitter emitter = stream.open(groupA);

    assertEquals(60_000L, emitter.getTimeout());
    assertEquals(1, stream.clientCount(groupA));
    assertEquals(0, stream.clientCount(groupB));
  }

  @Test
  void deliversOnlyToClientsOfTheEventsGroup() {
    RecordingEmitter inA = new RecordingEmitter();
    RecordingEmitter inB = new RecordingEmitter();
    stream.register(groupA, inA);
    stream.register(groupB, inB);

    stream.onChange(change(Operation.INSERT, groupA, 7));

    assertEquals(1, inA.frames.size());
    assertTrue(inA.frames.get(0).contains("event:new_message"));
    assertTrue(inA.frames.get(0).contains("id=7"));
    assertTrue(inB.frames.isEmpty());
  }

  @Test
  void namesEventsByOperation() {
    RecordingEmitter client = new RecordingEmitter();
    stream.register(groupA, client);

    stream.onChange(change(Operation.UPDATE, groupA, 1));
    stream.onChange(change(Operation.DELETE, groupA, 1));

    assertEquals(2, client.frames.size());
    assertTrue(client.frames.get(0).contains("event:updated_message"));
    assertTrue(client.frames.get(1).contains("event:deleted_message"));
  }

  @Test
  void testNotificationsAreNotStreamed() {
    RecordingEmitter client = new RecordingEmitter();
    stream.register(groupA, client);

    stream.onChange(ChangeEvent.test("ping"));

    assertTrue(client.frames.isEmpty());
  }

  @Test
  void clientWhoseSendFailsIsDropped() {
    RecordingEmitter healthy = new RecordingEmitter();
    RecordingEmitter gone = new RecordingEmitter();
    gone.broken = true;
    stream.register(groupA, healthy);
    stream.register(groupA, gone);

    stream.onChange(change(Operation.INSERT, groupA, 1));
    stream.onChange(change(Operation.INSERT, groupA, 2));

    assertEquals(1, stream.clientCount(groupA));
    assertEquals(2, healthy.frames.size());
  }

  /** Captures each event as its SSE text instead of writing to a response. */
  private static final class RecordingEmitter extends SseEmitter {
    final List<String> frames = new CopyOnWriteArrayList<>();
    volatile boolean broken;

    @Override
    public void send(SseEventBuilder builder) throws IOException {
      if (broken) {
        throw new IOException("Broken pipe");
      }
      StringBuilder frame = new StringBuilder();
      builder.build().forEach(part -> frame.append(part.getData()));
      frames.add(frame.toString());
    }
  }
}
