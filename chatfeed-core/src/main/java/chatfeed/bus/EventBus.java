package chatfeed.bus;

import chatfeed.ChangeEvent;
import chatfeed.ChangeHandler;
import chatfeed.Topic;

/**
 * In-process publish/subscribe register for {@link ChangeEvent}s.
 *
 * <p>Delivery is synchronous: {@link #publish} returns after every handler that was
 * registered for the topic at publish time has run, in registration order. Events
 * published on a topic with no subscribers are dropped; nothing is buffered or replayed.
 *
 * @see DefaultEventBus
 */
public interface EventBus {

  /**
   * Registers a handler for a topic.
   *
   * <p>Registering the same handler twice yields two independent subscriptions,
   * and the handler is invoked twice per event.
   *
   * @param topic   the topic
   * @param handler the handler
   * @return a handle that identifies this registration
   */
  Subscription subscribe(Topic topic, ChangeHandler handler);

  /**
   * Removes a registration by handle identity.
   *
   * @param subscription the handle returned by {@link #subscribe}
   * @return {@code true} if the registration was present
   */
  boolean unsubscribe(Subscription subscription);

  /**
   * Removes the earliest registration of {@code handler} on {@code topic}.
   *
   * @param topic   the topic
   * @param handler the handler, compared by identity
   * @return {@code true} if a registration was removed
   */
  boolean unsubscribe(Topic topic, ChangeHandler handler);

  /**
   * Removes every registration for one topic.
   *
   * @param topic the topic
   */
  void unsubscribeAll(Topic topic);

  /**
   * Removes every registration on every topic.
   */
  void unsubscribeAll();

  /**
   * Delivers an event to the handlers currently registered for a topic.
   *
   * <p>A handler that throws, including an {@link Error} such as a failed assertion, is
   * logged and does not stop delivery to later handlers.
   *
   * @param topic the topic
   * @param event the event
   * @return number of handlers that completed without throwing
   */
  int publish(Topic topic, ChangeEvent event);

  /**
   * Returns the number of registrations for a topic.
   *
   * @param topic the topic
   * @return registration count, 0 if none
   */
  int subscriberCount(Topic topic);
}
