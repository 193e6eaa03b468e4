package chatfeed.spi;

/**
 * Observability hook for exporting change-feed counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of raw notifications received on the channel.
   */
  void incrementNotificationsReceived();

  /**
   * Increments the count of notifications dropped because the payload could not be decoded.
   */
  void incrementNotificationsMalformed();

  /**
   * Increments the count of decoded events published on the bus.
   */
  void incrementEventsPublished();

  /**
   * Increments the count of handler invocations that threw.
   */
  void incrementSubscriberFailures();

  /**
   * Increments the count of reconnect attempts started.
   */
  void incrementReconnectAttempts();

  /**
   * Increments the count of reconnect attempts that failed and were rescheduled.
   */
  void incrementReconnectFailures();

  /**
   * Records whether the listener is currently able to deliver events.
   *
   * @param listening {@code true} while in the listening state
   */
  void recordListening(boolean listening);

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementNotificationsReceived() {
    }

    @Override
    public void incrementNotificationsMalformed() {
    }

    @Override
    public void incrementEventsPublished() {
    }

    @Override
    public void incrementSubscriberFailures() {
    }

    @Override
    public void incrementReconnectAttempts() {
    }

    @Override
    public void incrementReconnectFailures() {
    }

    @Override
    public void recordListening(boolean listening) {
    }
  }
}
