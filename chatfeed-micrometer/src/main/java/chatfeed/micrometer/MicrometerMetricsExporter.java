package chatfeed.micrometer;

import chatfeed.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code chatfeed.notifications.received}: notifications read from the channel</li>
 *   <li>{@code chatfeed.notifications.malformed}: notifications dropped as undecodable</li>
 *   <li>{@code chatfeed.events.published}: decoded events published on the bus</li>
 *   <li>{@code chatfeed.subscriber.failures}: handler invocations that threw</li>
 *   <li>{@code chatfeed.reconnect.attempts}: reconnect attempts started</li>
 *   <li>{@code chatfeed.reconnect.failures}: reconnect attempts that failed</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code chatfeed.listening}: 1 while the listener can deliver events, otherwise 0</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_PREFIX = "chatfeed";

  private final MeterRegistry registry;
  private final Counter notificationsReceived;
  private final Counter notificationsMalformed;
  private final Counter eventsPublished;
  private final Counter subscriberFailures;
  private final Counter reconnectAttempts;
  private final Counter reconnectFailures;
  private final Gauge listeningGauge;

  private final AtomicInteger listening = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "chatfeed"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several listeners in one process.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "support.chatfeed"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.notificationsReceived = Counter.builder(namePrefix + ".notifications.received")
        .description("Notifications read from the change channel")
        .register(registry);
    this.notificationsMalformed = Counter.builder(namePrefix + ".notifications.malformed")
        .description("Notifications dropped because the payload could not be decoded")
        .register(registry);
    this.eventsPublished = Counter.builder(namePrefix + ".events.published")
        .description("Change events published on the event bus")
        .register(registry);
    this.subscriberFailures = Counter.builder(namePrefix + ".subscriber.failures")
        .description("Handler invocations that threw")
        .register(registry);
    this.reconnectAttempts = Counter.builder(namePrefix + ".reconnect.attempts")
        .description("Reconnect attempts started")
        .register(registry);
    this.reconnectFailures = Counter.builder(namePrefix + ".reconnect.failures")
        .description("Reconnect attempts that failed and were rescheduled")
        .register(registry);
    this.listeningGauge = Gauge.builder(namePrefix + ".listening", listening, AtomicInteger::get)
        .description("1 while the change listener is listening, otherwise 0")
        .register(registry);
  }

  @Override
  public void incrementNotificationsReceived() {
    if (closed) return;
    notificationsReceived.increment();
  }

  @Override
  public void incrementNotificationsMalformed() {
    if (closed) return;
    notificationsMalformed.increment();
  }

  @Override
  public void incrementEventsPublished() {
    if (closed) return;
    eventsPublished.increment();
  }

  @Override
  public void incrementSubscriberFailures() {
    if (closed) return;
    subscriberFailures.increment();
  }

  @Override
  public void incrementReconnectAttempts() {
    if (closed) return;
    reconnectAttempts.increment();
  }

  @Override
  public void incrementReconnectFailures() {
    if (closed) return;
    reconnectFailures.increment();
  }

  @Override
  public void recordListening(boolean listening) {
    if (closed) return;
    this.listening.set(listening ? 1 : 0);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(notificationsReceived, notificationsMalformed, eventsPublished,
        subscriberFailures, reconnectAttempts, reconnectFailures, listeningGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
