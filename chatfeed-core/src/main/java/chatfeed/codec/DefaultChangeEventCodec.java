package chatfeed.codec;

import chatfeed.ChangeEvent;
import chatfeed.Operation;
import chatfeed.util.JsonCodec;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Codec for the flat JSON object built by the {@code messages} trigger.
 *
 * <p>Field names:
 * <pre>
 * operation, table, id, group_uuid, sender_uuid, content, file, created_date, is_deleted,
 * old_id, old_content, old_is_deleted   (UPDATE only)
 * message                               (TEST only)
 * </pre>
 *
 * <p>{@code created_date} is read as ISO-8601 with an offset; a value without an offset
 * is taken as UTC. {@code old_*} fields are ignored unless the operation is UPDATE.
 */
public final class DefaultChangeEventCodec implements ChangeEventCodec {
  public static final String OPERATION = "operation";
  public static final String TABLE = "table";
  public static final String ID = "id";
  public static final String GROUP_UUID = "group_uuid";
  public static final String SENDER_UUID = "sender_uuid";
  public static final String CONTENT = "content";
  public static final String FILE = "file";
  public static final String CREATED_DATE = "created_date";
  public static final String IS_DELETED = "is_deleted";
  public static final String OLD_ID = "old_id";
  public static final String OLD_CONTENT = "old_content";
  public static final String OLD_IS_DELETED = "old_is_deleted";
  public static final String MESSAGE = "message";

  static final DefaultChangeEventCodec INSTANCE = new DefaultChangeEventCodec(JsonCodec.getDefault());

  private final JsonCodec jsonCodec;

  public DefaultChangeEventCodec(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public ChangeEvent decode(String payload) {
    Map<String, Object> fields;
    try {
      fields = jsonCodec.parseObject(payload);
    } catch (IllegalArgumentException e) {
      throw new MalformedPayloadException("Payload is not a JSON object (" + e.getMessage() + ")", payload, e);
    }
    if (fields.isEmpty()) {
      throw new MalformedPayloadException("Payload is empty", payload);
    }

    String literal = string(fields, OPERATION, payload);
    if (literal == null) {
      throw new MalformedPayloadException("Missing '" + OPERATION + "'", payload);
    }
    Operation operation;
    try {
      operation = Operation.fromWire(literal);
    } catch (IllegalArgumentException e) {
      throw new MalformedPayloadException(e.getMessage(), payload, e);
    }

    ChangeEvent.Builder builder = ChangeEvent.builder(operation)
        .table(string(fields, TABLE, payload))
        .id(longValue(fields, ID, payload))
        .groupId(uuid(fields, GROUP_UUID, payload))
        .senderId(uuid(fields, SENDER_UUID, payload))
        .content(string(fields, CONTENT, payload))
        .file(string(fields, FILE, payload))
        .createdDate(instant(fields, CREATED_DATE, payload))
        .deleted(bool(fields, IS_DELETED, payload))
        .message(string(fields, MESSAGE, payload));
    if (operation == Operation.UPDATE) {
      builder.previousId(longValue(fields, OLD_ID, payload))
          .previousContent(string(fields, OLD_CONTENT, payload))
          .previousDeleted(bool(fields, OLD_IS_DELETED, payload));
    }
    try {
      return builder.build();
    } catch (IllegalArgumentException e) {
      throw new MalformedPayloadException(e.getMessage(), payload, e);
    }
  }

  @Override
  public String encode(ChangeEvent event) {
    Objects.requireNonNull(event, "event");
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(OPERATION, event.operation().wireName());
    fields.put(TABLE, event.table());
    switch (event.operation()) {
      case INSERT, UPDATE -> {
        fields.put(ID, event.id());
        fields.put(GROUP_UUID, event.groupId());
        fields.put(SENDER_UUID, event.senderId());
        fields.put(CONTENT, event.content());
        fields.put(FILE, event.file());
        fields.put(CREATED_DATE, event.createdDate());
        fields.put(IS_DELETED, event.deleted());
        if (event.operation() == Operation.UPDATE) {
          fields.put(OLD_ID, event.previousId());
          fields.put(OLD_CONTENT, event.previousContent());
          fields.put(OLD_IS_DELETED, event.previousDeleted());
        }
      }
      case DELETE -> {
        fields.put(ID, event.id());
        fields.put(GROUP_UUID, event.groupId());
        fields.put(SENDER_UUID, event.senderId());
      }
      case TEST -> fields.put(MESSAGE, event.message());
    }
    return jsonCodec.toJson(fields);
  }

  private static String string(Map<String, Object> fields, String key, String payload) {
    Object value = fields.get(key);
    if (value == null || value instanceof String) {
      return (String) value;
    }
    throw new MalformedPayloadException("Field '" + key + "' must be a string", payload);
  }

  private static Long longValue(Map<String, Object> fields, String key, String payload) {
    Object value = fields.get(key);
    if (value == null || value instanceof Long) {
      return (Long) value;
    }
    if (value instanceof BigDecimal d) {
      try {
        return d.longValueExact();
      } catch (ArithmeticException e) {
        throw new MalformedPayloadException("Field '" + key + "' must be an integer", payload, e);
      }
    }
    throw new MalformedPayloadException("Field '" + key + "' must be a number", payload);
  }

  private static Boolean bool(Map<String, Object> fields, String key, String payload) {
    Object value = fields.get(key);
    if (value == null || value instanceof Boolean) {
      return (Boolean) value;
    }
    throw new MalformedPayloadException("Field '" + key + "' must be a boolean", payload);
  }

  private static UUID uuid(Map<String, Object> fields, String key, String payload) {
    String text = string(fields, key, payload);
    if (text == null) {
      return null;
    }
    try {
      return UUID.fromString(text);
    } catch (IllegalArgumentException e) {
      throw new MalformedPayloadException("Field '" + key + "' is not a UUID", payload, e);
    }
  }

  private static Instant instant(Map<String, Object> fields, String key, String payload) {
    String text = string(fields, key, payload);
    if (text == null) {
      return null;
    }
    try {
      return parseTimestamp(text);
    } catch (DateTimeParseException e) {
      throw new MalformedPayloadException("Field '" + key + "' is not an ISO-8601 timestamp", payload, e);
    }
  }

  static Instant parseTimestamp(String text) {
    String normalized = text.trim().replace(' ', 'T');
    // PostgreSQL may render a whole-hour offset as "+00"
    if (normalized.matches(".*[+-]\\d{2}$")) {
      normalized = normalized + ":00";
    }
    if (normalized.endsWith("Z") || normalized.matches(".*[+-]\\d{2}:\\d{2}$")) {
      return OffsetDateTime.parse(normalized).toInstant();
    }
    return LocalDateTime.parse(normalized).toInstant(ZoneOffset.UTC);
  }
}
