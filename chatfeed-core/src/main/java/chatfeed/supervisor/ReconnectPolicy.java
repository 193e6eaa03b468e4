package chatfeed.supervisor;

/**
 * Strategy for computing the wait before a reconnect attempt.
 *
 * @see FixedBackoffReconnectPolicy
 */
@FunctionalInterface
public interface ReconnectPolicy {

  /**
   * Computes the delay in milliseconds before the given reconnect attempt.
   *
   * @param attempt the attempt number (1-based) within the current outage
   * @return delay in milliseconds (non-negative)
   */
  long delayBeforeAttemptMs(int attempt);
}
