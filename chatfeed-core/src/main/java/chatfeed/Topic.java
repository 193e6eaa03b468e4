package chatfeed;

import java.util.Objects;

/**
 * Name of an event-bus topic.
 *
 * <p>Topics are compared by name. Well-known topics live in {@link ChangeTopics};
 * use {@link #of(String)} for application-defined ones.
 *
 * <pre>{@code
 * Topic audit = Topic.of("message_audit");
 * bus.subscribe(audit, event -> auditLog.append(event));
 * }</pre>
 */
public final class Topic {

  private final String name;

  private Topic(String name) {
    this.name = Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Topic name cannot be empty");
    }
  }

  /**
   * Creates a topic from a string.
   *
   * @param name the topic name
   * @return the topic
   * @throws NullPointerException if name is null
   * @throws IllegalArgumentException if name is empty
   */
  public static Topic of(String name) {
    return new Topic(name);
  }

  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Topic)) return false;
    Topic that = (Topic) o;
    return name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
