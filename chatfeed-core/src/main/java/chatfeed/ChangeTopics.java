package chatfeed;

import java.util.Objects;

/**
 * Topics on which the change listener publishes decoded events.
 *
 * <p>Every event is published once on {@link #MESSAGE_CHANGE} and once on the
 * topic for its operation, so a subscriber that only cares about inserts can
 * subscribe to {@link #MESSAGE_INSERT} without filtering.
 */
public final class ChangeTopics {

  /** Every decoded change, regardless of operation. */
  public static final Topic MESSAGE_CHANGE = Topic.of("message_change");

  public static final Topic MESSAGE_INSERT = Topic.of("message_insert");
  public static final Topic MESSAGE_UPDATE = Topic.of("message_update");
  public static final Topic MESSAGE_DELETE = Topic.of("message_delete");
  public static final Topic MESSAGE_TEST = Topic.of("message_test");

  private ChangeTopics() {}

  /**
   * Returns the operation-specific topic.
   *
   * @param operation the row operation
   * @return the topic events of that operation are published on
   */
  public static Topic forOperation(Operation operation) {
    Objects.requireNonNull(operation, "operation");
    return switch (operation) {
      case INSERT -> MESSAGE_INSERT;
      case UPDATE -> MESSAGE_UPDATE;
      case DELETE -> MESSAGE_DELETE;
      case TEST -> MESSAGE_TEST;
    };
  }
}
