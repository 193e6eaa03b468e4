package chatfeed.supervisor;

/**
 * Two-step fixed backoff: the first attempt of an outage waits {@code initialDelayMs},
 * every later attempt waits {@code retryDelayMs}. No cap on attempts and no jitter,
 * which suits a single listener per database; many listeners reconnecting to the
 * same server would retry in lockstep.
 */
public final class FixedBackoffReconnectPolicy implements ReconnectPolicy {
  public static final long DEFAULT_INITIAL_DELAY_MS = 5_000;
  public static final long DEFAULT_RETRY_DELAY_MS = 10_000;

  private final long initialDelayMs;
  private final long retryDelayMs;

  public FixedBackoffReconnectPolicy() {
    this(DEFAULT_INITIAL_DELAY_MS, DEFAULT_RETRY_DELAY_MS);
  }

  /**
   * @param initialDelayMs wait before the first attempt of an outage (milliseconds)
   * @param retryDelayMs   wait before each subsequent attempt (milliseconds)
   */
  public FixedBackoffReconnectPolicy(long initialDelayMs, long retryDelayMs) {
    if (initialDelayMs < 0) {
      throw new IllegalArgumentException("initialDelayMs must be >= 0, got: " + initialDelayMs);
    }
    if (retryDelayMs < 0) {
      throw new IllegalArgumentException("retryDelayMs must be >= 0, got: " + retryDelayMs);
    }
    this.initialDelayMs = initialDelayMs;
    this.retryDelayMs = retryDelayMs;
  }

  @Override
  public long delayBeforeAttemptMs(int attempt) {
    if (attempt <= 1) {
      return initialDelayMs;
    }
    return retryDelayMs;
  }

  public long initialDelayMs() {
    return initialDelayMs;
  }

  public long retryDelayMs() {
    return retryDelayMs;
  }
}
