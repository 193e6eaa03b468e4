package chatfeed;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable description of one row change on the {@code messages} table.
 *
 * <p>Instances are built by the payload codec from a notification received on the
 * change channel and handed to the event bus; they are never persisted. Which
 * attributes are present depends on the {@link Operation}:
 * <ul>
 *   <li>{@code INSERT}: all new-row fields</li>
 *   <li>{@code UPDATE}: all new-row fields plus the {@code previous*} pre-image fields</li>
 *   <li>{@code DELETE}: {@code id}, {@code groupId} and {@code senderId} only</li>
 *   <li>{@code TEST}: {@code table} and {@code message} only</li>
 * </ul>
 * Absent attributes are {@code null}.
 *
 * <p>{@link #eventId()} and {@link #receivedAt()} are assigned on the receiving side
 * (ULID and wall clock) and are not part of the wire payload.
 *
 * @see Operation
 * @see chatfeed.codec.ChangeEventCodec
 */
public final class ChangeEvent {
  public static final String MESSAGES_TABLE = "messages";

  private final String eventId;
  private final Operation operation;
  private final String table;
  private final Long id;
  private final UUID groupId;
  private final UUID senderId;
  private final String content;
  private final String file;
  private final Instant createdDate;
  private final Boolean deleted;
  private final Long previousId;
  private final String previousContent;
  private final Boolean previousDeleted;
  private final String message;
  private final Instant receivedAt;

  private ChangeEvent(Builder builder) {
    this.operation = Objects.requireNonNull(builder.operation, "operation");
    this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
    this.table = builder.table == null ? MESSAGES_TABLE : builder.table;
    if (this.table.isEmpty()) {
      throw new IllegalArgumentException("table cannot be empty");
    }
    if (operation != Operation.UPDATE
        && (builder.previousId != null || builder.previousContent != null || builder.previousDeleted != null)) {
      throw new IllegalArgumentException("previous* fields are only allowed on UPDATE, got " + operation);
    }
    this.id = builder.id;
    this.groupId = builder.groupId;
    this.senderId = builder.senderId;
    this.content = builder.content;
    this.file = builder.file;
    this.createdDate = builder.createdDate;
    this.deleted = builder.deleted;
    this.previousId = builder.previousId;
    this.previousContent = builder.previousContent;
    this.previousDeleted = builder.previousDeleted;
    this.message = builder.message;
    this.receivedAt = builder.receivedAt == null ? Instant.now() : builder.receivedAt;
  }

  /**
   * Creates a builder for the given operation.
   *
   * @param operation the row operation
   * @return a new builder
   */
  public static Builder builder(Operation operation) {
    return new Builder(operation);
  }

  /**
   * Creates a synthetic {@code TEST} event.
   *
   * @param message human-readable test message
   * @return a new test event
   */
  public static ChangeEvent test(String message) {
    return builder(Operation.TEST).message(message).build();
  }

  public String eventId() {
    return eventId;
  }

  public Operation operation() {
    return operation;
  }

  public String table() {
    return table;
  }

  /** Message primary key; {@code null} for {@code TEST}. */
  public Long id() {
    return id;
  }

  public UUID groupId() {
    return groupId;
  }

  public UUID senderId() {
    return senderId;
  }

  public String content() {
    return content;
  }

  public String file() {
    return file;
  }

  public Instant createdDate() {
    return createdDate;
  }

  /** Soft-delete flag of the new row; {@code null} for {@code DELETE} and {@code TEST}. */
  public Boolean deleted() {
    return deleted;
  }

  public Long previousId() {
    return previousId;
  }

  public String previousContent() {
    return previousContent;
  }

  public Boolean previousDeleted() {
    return previousDeleted;
  }

  /** Text of a {@code TEST} event. */
  public String message() {
    return message;
  }

  public Instant receivedAt() {
    return receivedAt;
  }

  /**
   * Returns {@code true} for an update that flipped the soft-delete flag from
   * {@code false} to {@code true}.
   */
  public boolean isSoftDelete() {
    return operation == Operation.UPDATE
        && Boolean.FALSE.equals(previousDeleted)
        && Boolean.TRUE.equals(deleted);
  }

  /**
   * Returns {@code true} for an update that flipped the soft-delete flag back to {@code false}.
   */
  public boolean isRestore() {
    return operation == Operation.UPDATE
        && Boolean.TRUE.equals(previousDeleted)
        && Boolean.FALSE.equals(deleted);
  }

  /**
   * Returns {@code true} for an update whose content differs from the pre-image.
   */
  public boolean isContentEdit() {
    return operation == Operation.UPDATE && !Objects.equals(previousContent, content);
  }

  private static String newEventId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("ChangeEvent{")
        .append("eventId=").append(eventId)
        .append(", operation=").append(operation)
        .append(", table=").append(table);
    if (id != null) {
      sb.append(", id=").append(id);
    }
    if (groupId != null) {
      sb.append(", groupId=").append(groupId);
    }
    if (deleted != null) {
      sb.append(", deleted=").append(deleted);
    }
    if (previousDeleted != null) {
      sb.append(", previousDeleted=").append(previousDeleted);
    }
    if (message != null) {
      sb.append(", message=").append(message);
    }
    return sb.append('}').toString();
  }

  /** Builder for {@link ChangeEvent}. */
  public static final class Builder {
    private final Operation operation;
    private String eventId;
    private String table;
    private Long id;
    private UUID groupId;
    private UUID senderId;
    private String content;
    private String file;
    private Instant createdDate;
    private Boolean deleted;
    private Long previousId;
    private String previousContent;
    private Boolean previousDeleted;
    private String message;
    private Instant receivedAt;

    private Builder(Operation operation) {
      this.operation = operation;
    }

    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    public Builder table(String table) {
      this.table = table;
      return this;
    }

    public Builder id(Long id) {
      this.id = id;
      return this;
    }

    public Builder groupId(UUID groupId) {
      this.groupId = groupId;
      return this;
    }

    public Builder senderId(UUID senderId) {
      this.senderId = senderId;
      return this;
    }

    public Builder content(String content) {
      this.content = content;
      return this;
    }

    public Builder file(String file) {
      this.file = file;
      return this;
    }

    public Builder createdDate(Instant createdDate) {
      this.createdDate = createdDate;
      return this;
    }

    public Builder deleted(Boolean deleted) {
      this.deleted = deleted;
      return this;
    }

    public Builder previousId(Long previousId) {
      this.previousId = previousId;
      return this;
    }

    public Builder previousContent(String previousContent) {
      this.previousContent = previousContent;
      return this;
    }

    public Builder previousDeleted(Boolean previousDeleted) {
      this.previousDeleted = previousDeleted;
      return this;
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder receivedAt(Instant receivedAt) {
      this.receivedAt = receivedAt;
      return this;
    }

    public ChangeEvent build() {
      return new ChangeEvent(this);
    }
  }
}
