package chatfeed.codec;

import chatfeed.ChangeEvent;
import chatfeed.Operation;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DefaultChangeEventCodecTest {

  private static final UUID GROUP = UUID.fromString("7c9e6679-7425-40de-944b-e07fc1f90ae7");
  private static final UUID SENDER = UUID.fromString("16fd2706-8baf-433b-82eb-8c7fada847da");

  private final ChangeEventCodec codec = ChangeEventCodec.getDefault();

  @Test
  void decodesInsertAsBuiltByTrigger() {
    String payload = "{\"operation\" : \"INSERT\", \"table\" : \"messages\", \"id\" : 42, "
        + "\"group_uuid\" : \"" + GROUP + "\", \"sender_uuid\" : \"" + SENDER + "\", "
        + "\"content\" : \"hi\", \"file\" : null, "
        + "\"created_date\" : \"2024-05-01T10:00:00.123+00:00\", \"is_deleted\" : false}";

    ChangeEvent event = codec.decode(payload);

    assertEquals(Operation.INSERT, event.operation());
    assertEquals("messages", event.table());
    assertEquals(42L, event.id());
    assertEquals(GROUP, event.groupId());
    assertEquals(SENDER, event.senderId());
    assertEquals("hi", event.content());
    assertNull(event.file());
    assertEquals(Instant.parse("2024-05-01T10:00:00.123Z"), event.createdDate());
    assertEquals(Boolean.FALSE, event.deleted());
    assertNull(event.previousId());
    assertNotNull(event.eventId());
    assertNotNull(event.receivedAt());
  }

  @Test
  void decodesSoftDeleteUpdate() {
    String payload = "{\"operation\":\"UPDATE\",\"table\":\"messages\",\"id\":42,"
        + "\"group_uuid\":\"" + GROUP + "\",\"sender_uuid\":\"" + SENDER + "\","
        + "\"content\":\"hi\",\"file\":null,\"created_date\":\"2024-05-01T10:00:00+02:00\","
        + "\"is_deleted\":true,\"old_id\":42,\"old_content\":\"hi\",\"old_is_deleted\":false}";

    ChangeEvent event = codec.decode(payload);

    assertEquals(Operation.UPDATE, event.operation());
    assertEquals(Instant.parse("2024-05-01T08:00:00Z"), event.createdDate());
    assertEquals(42L, event.previousId());
    assertEquals("hi", event.previousContent());
    assertEquals(Boolean.FALSE, event.previousDeleted());
    assertTrue(event.isSoftDelete());
    assertFalse(event.isRestore());
    assertFalse(event.isContentEdit());
  }

  @Test
  void decodesContentEdit() {
    String payload = "{\"operation\":\"UPDATE\",\"id\":1,\"content\":\"new\",\"is_deleted\":false,"
        + "\"old_id\":1,\"old_content\":\"old\",\"old_is_deleted\":false}";

    ChangeEvent event = codec.decode(payload);

    assertTrue(event.isContentEdit());
    assertFalse(event.isSoftDelete());
  }

  @Test
  void decodesHardDeleteWithIdentityFieldsOnly() {
    String payload = "{\"operation\":\"DELETE\",\"table\":\"messages\",\"id\":9,"
        + "\"group_uuid\":\"" + GROUP + "\",\"sender_uuid\":\"" + SENDER + "\"}";

    ChangeEvent event = codec.decode(payload);

    assertEquals(Operation.DELETE, event.operation());
    assertEquals(9L, event.id());
    assertEquals(GROUP, event.groupId());
    assertNull(event.content());
    assertNull(event.deleted());
  }

  @Test
  void decodesTestNotification() {
    ChangeEvent event = codec.decode(
        "{\"operation\":\"TEST\",\"table\":\"messages\",\"message\":\"Test notification\"}");

    assertEquals(Operation.TEST, event.operation());
    assertEquals("Test notification", event.message());
    assertNull(event.id());
  }

  @Test
  void oldFieldsOutsideUpdateAreIgnored() {
    ChangeEvent event = codec.decode("{\"operation\":\"INSERT\",\"id\":1,\"old_id\":1}");

    assertNull(event.previousId());
  }

  @Test
  void timestampWithoutOffsetIsUtc() {
    ChangeEvent event = codec.decode(
        "{\"operation\":\"INSERT\",\"id\":1,\"created_date\":\"2024-05-01T10:00:00.5\"}");

    assertEquals(Instant.parse("2024-05-01T10:00:00.500Z"), event.createdDate());
  }

  @Test
  void parsesShortOffsetAndSpaceSeparator() {
    assertEquals(Instant.parse("2024-05-01T07:00:00Z"),
        DefaultChangeEventCodec.parseTimestamp("2024-05-01 10:00:00+03"));
    assertEquals(Instant.parse("2024-05-01T10:00:00Z"),
        DefaultChangeEventCodec.parseTimestamp("2024-05-01T10:00:00Z"));
  }

  @Test
  void eachDecodeAssignsFreshEventId() {
    String payload = "{\"operation\":\"TEST\",\"message\":\"m\"}";

    assertNotEquals(codec.decode(payload).eventId(), codec.decode(payload).eventId());
  }

  @Test
  void rejectsNonJson() {
    MalformedPayloadException e = assertThrows(MalformedPayloadException.class,
        () -> codec.decode("definitely not json"));

    assertEquals("definitely not json", e.payload());
  }

  @Test
  void rejectsEmptyPayload() {
    assertThrows(MalformedPayloadException.class, () -> codec.decode(""));
    assertThrows(MalformedPayloadException.class, () -> codec.decode("{}"));
    assertThrows(MalformedPayloadException.class, () -> codec.decode(null));
  }

  @Test
  void rejectsMissingOrUnknownOperation() {
    assertThrows(MalformedPayloadException.class, () -> codec.decode("{\"id\":1}"));
    assertThrows(MalformedPayloadException.class, () -> codec.decode("{\"operation\":\"TRUNCATE\"}"));
    assertThrows(MalformedPayloadException.class, () -> codec.decode("{\"operation\":1}"));
  }

  @Test
  void rejectsWrongFieldTypes() {
    assertThrows(MalformedPayloadException.class,
        () -> codec.decode("{\"operation\":\"INSERT\",\"id\":\"seven\"}"));
    assertThrows(MalformedPayloadException.class,
        () -> codec.decode("{\"operation\":\"INSERT\",\"id\":1.5}"));
    assertThrows(MalformedPayloadException.class,
        () -> codec.decode("{\"operation\":\"INSERT\",\"group_uuid\":\"not-a-uuid\"}"));
    assertThrows(MalformedPayloadException.class,
        () -> codec.decode("{\"operation\":\"INSERT\",\"is_deleted\":\"no\"}"));
    assertThrows(MalformedPayloadException.class,
        () -> codec.decode("{\"operation\":\"INSERT\",\"created_date\":\"yesterday\"}"));
    assertThrows(MalformedPayloadException.class,
        () -> codec.decode("{\"operation\":\"INSERT\",\"table\":\"\"}"));
  }

  @Test
  void malformedPayloadIsIllegalArgument() {
    assertThrows(IllegalArgumentException.class, () -> codec.decode("{"));
  }

  @Test
  void encodesTestNotificationInTriggerFormat() {
    assertEquals("{\"operation\":\"TEST\",\"table\":\"messages\",\"message\":\"Test notification\"}",
        codec.encode(ChangeEvent.test("Test notification")));
  }

  @Test
  void encodesDeleteWithIdentityFieldsOnly() {
    ChangeEvent event = ChangeEvent.builder(Operation.DELETE)
        .id(3L).groupId(GROUP).senderId(SENDER).content("ignored").build();

    assertEquals("{\"operation\":\"DELETE\",\"table\":\"messages\",\"id\":3,"
        + "\"group_uuid\":\"" + GROUP + "\",\"sender_uuid\":\"" + SENDER + "\"}", codec.encode(event));
  }

  @Test
  void encodedUpdateDecodesToSameAttributes() {
    ChangeEvent original = ChangeEvent.builder(Operation.UPDATE)
        .id(5L).groupId(GROUP).senderId(SENDER).content("edited").file("a.png")
        .createdDate(Instant.parse("2024-05-01T10:00:00Z")).deleted(false)
        .previousId(5L).previousContent("draft").previousDeleted(false)
        .build();

    ChangeEvent decoded = codec.decode(codec.encode(original));

    assertEquals(original.id(), decoded.id());
    assertEquals(original.content(), decoded.content());
    assertEquals(original.file(), decoded.file());
    assertEquals(original.createdDate(), decoded.createdDate());
    assertEquals(original.previousContent(), decoded.previousContent());
    assertTrue(decoded.isContentEdit());
  }
}
