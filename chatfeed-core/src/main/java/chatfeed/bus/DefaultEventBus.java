package chatfeed.bus;

import chatfeed.ChangeEvent;
import chatfeed.ChangeHandler;
import chatfeed.Topic;
import chatfeed.spi.MetricsExporter;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe {@link EventBus} backed by one copy-on-write list per topic.
 *
 * <p>Handlers are invoked in registration order. Each publish iterates a snapshot,
 * so a handler that subscribes or unsubscribes during delivery affects the next
 * publish, not the current one.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EventBus bus = new DefaultEventBus();
 * Subscription sub = bus.subscribe(ChangeTopics.MESSAGE_CHANGE, event -> sse.push(event));
 * bus.subscribe(ChangeTopics.MESSAGE_DELETE, event -> cache.evict(event.id()));
 * ...
 * sub.cancel();
 * }</pre>
 *
 * @see EventBus
 */
public final class DefaultEventBus implements EventBus {
  private static final Logger logger = Logger.getLogger(DefaultEventBus.class.getName());

  private final Map<Topic, CopyOnWriteArrayList<Subscription>> subscriptions = new ConcurrentHashMap<>();
  private final MetricsExporter metrics;

  public DefaultEventBus() {
    this(MetricsExporter.NOOP);
  }

  public DefaultEventBus(MetricsExporter metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public Subscription subscribe(Topic topic, ChangeHandler handler) {
    Subscription subscription = new Subscription(this, topic, handler);
    subscriptions.computeIfAbsent(topic, ignored -> new CopyOnWriteArrayList<>()).add(subscription);
    return subscription;
  }

  @Override
  public boolean unsubscribe(Subscription subscription) {
    Objects.requireNonNull(subscription, "subscription");
    CopyOnWriteArrayList<Subscription> list = subscriptions.get(subscription.topic());
    if (list == null) {
      return false;
    }
    // Subscription does not override equals, so remove() matches by identity
    return list.remove(subscription);
  }

  @Override
  public boolean unsubscribe(Topic topic, ChangeHandler handler) {
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(handler, "handler");
    CopyOnWriteArrayList<Subscription> list = subscriptions.get(topic);
    if (list == null) {
      return false;
    }
    for (Subscription subscription : list) {
      if (subscription.handler() == handler) {
        return list.remove(subscription);
      }
    }
    return false;
  }

  @Override
  public void unsubscribeAll(Topic topic) {
    Objects.requireNonNull(topic, "topic");
    subscriptions.remove(topic);
  }

  @Override
  public void unsubscribeAll() {
    subscriptions.clear();
  }

  @Override
  public int publish(Topic topic, ChangeEvent event) {
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(event, "event");
    CopyOnWriteArrayList<Subscription> list = subscriptions.get(topic);
    if (list == null || list.isEmpty()) {
      logger.log(Level.FINE, "No subscribers on {0}; dropping {1}", new Object[]{topic, event.eventId()});
      return 0;
    }
    int delivered = 0;
    for (Subscription subscription : list) {
      try {
        subscription.handler().onChange(event);
        delivered++;
      } catch (Throwable t) {
        metrics.incrementSubscriberFailures();
        logger.log(Level.WARNING, "Handler " + subscription.handler() + " failed on topic "
            + topic + " for eventId=" + event.eventId(), t);
      }
    }
    return delivered;
  }

  @Override
  public int subscriberCount(Topic topic) {
    CopyOnWriteArrayList<Subscription> list = subscriptions.get(topic);
    return list == null ? 0 : list.size();
  }
}
