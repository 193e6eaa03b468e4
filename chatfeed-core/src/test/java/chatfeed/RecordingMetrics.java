package chatfeed;

import chatfeed.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link MetricsExporter} that keeps counts in memory for assertions.
 */
public final class RecordingMetrics implements MetricsExporter {
  public final AtomicInteger notificationsReceived = new AtomicInteger();
  public final AtomicInteger notificationsMalformed = new AtomicInteger();
  public final AtomicInteger eventsPublished = new AtomicInteger();
  public final AtomicInteger subscriberFailures = new AtomicInteger();
  public final AtomicInteger reconnectAttempts = new AtomicInteger();
  public final AtomicInteger reconnectFailures = new AtomicInteger();
  public final AtomicBoolean listening = new AtomicBoolean();
  /** Number of upcoming {@link #incrementEventsPublished()} calls that throw instead of counting. */
  public final AtomicInteger failNextEventsPublished = new AtomicInteger();

  @Override
  public void incrementNotificationsReceived() {
    notificationsReceived.incrementAndGet();
  }

  @Override
  public void incrementNotificationsMalformed() {
    notificationsMalformed.incrementAndGet();
  }

  @Override
  public void incrementEventsPublished() {
    if (failNextEventsPublished.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
      throw new IllegalStateException("metrics registry unavailable");
    }
    eventsPublished.incrementAndGet();
  }

  @Override
  public void incrementSubscriberFailures() {
    subscriberFailures.incrementAndGet();
  }

  @Override
  public void incrementReconnectAttempts() {
    reconnectAttempts.incrementAndGet();
  }

  @Override
  public void incrementReconnectFailures() {
    reconnectFailures.incrementAndGet();
  }

  @Override
  public void recordListening(boolean value) {
    listening.set(value);
  }
}
