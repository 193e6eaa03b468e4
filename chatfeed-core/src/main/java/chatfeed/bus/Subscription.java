package chatfeed.bus;

import chatfeed.ChangeHandler;
import chatfeed.Topic;

import java.util.Objects;

/**
 * Handle for one handler registration on an {@link EventBus}.
 *
 * <p>Handles compare by identity, so two registrations of the same handler on the
 * same topic remain distinguishable.
 */
public final class Subscription {
  private final EventBus bus;
  private final Topic topic;
  private final ChangeHandler handler;

  Subscription(EventBus bus, Topic topic, ChangeHandler handler) {
    this.bus = Objects.requireNonNull(bus, "bus");
    this.topic = Objects.requireNonNull(topic, "topic");
    this.handler = Objects.requireNonNull(handler, "handler");
  }

  public Topic topic() {
    return topic;
  }

  public ChangeHandler handler() {
    return handler;
  }

  /**
   * Removes this registration from its bus. Calling it more than once is harmless.
   *
   * @return {@code true} if the registration was still present
   */
  public boolean cancel() {
    return bus.unsubscribe(this);
  }

  @Override
  public String toString() {
    return "Subscription{topic=" + topic + ", handler=" + handler + "}";
  }
}
