package chatfeed.supervisor;

import chatfeed.spi.MetricsExporter;
import chatfeed.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the {@link ConnectionStateMachine} of one listener and restores its connection
 * after an unexpected loss.
 *
 * <p>Guarantees:
 * <ul>
 *   <li>At most one reconnect attempt chain runs per outage. Loss reports arriving while a
 *       chain is already scheduled are ignored.</li>
 *   <li>After {@link #disconnect()} no further attempt starts, and an attempt already in
 *       flight discards the connection it opened instead of going back to LISTENING. This
 *       holds even when a new connect follows the disconnect before the old attempt
 *       returns: every chain carries a generation number, and an attempt whose generation
 *       is no longer current only ever releases its own connection.</li>
 *   <li>Attempts never give up; each failure schedules the next attempt after the
 *       {@link ReconnectPolicy} delay.</li>
 * </ul>
 *
 * <p>Attempts run on a single daemon thread named {@code chatfeed-reconnect-N}.
 *
 * <p>The target releases the lost connection itself before calling
 * {@link #connectionLost(Throwable)}.
 *
 * <p>This class is thread-safe.
 *
 * @param <S> handle of one connection opened by the target
 */
public final class ReconnectSupervisor<S> implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ReconnectSupervisor.class.getName());

  private final ReconnectTarget<S> target;
  private final ReconnectPolicy policy;
  private final MetricsExporter metrics;
  private final ConnectionStateMachine stateMachine;
  private final ScheduledExecutorService scheduler;

  private volatile boolean suppressed = true;
  private volatile boolean closed;
  private final AtomicLong generation = new AtomicLong();
  private ScheduledFuture<?> pendingAttempt;

  /**
   * @param target  the component whose connection is restored
   * @param policy  delay strategy between attempts
   * @param metrics metrics exporter, or {@code null} for {@link MetricsExporter#NOOP}
   */
  public ReconnectSupervisor(ReconnectTarget<S> target, ReconnectPolicy policy, MetricsExporter metrics) {
    this.target = Objects.requireNonNull(target, "target");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.stateMachine = new ConnectionStateMachine();
    this.stateMachine.addObserver((from, to) -> this.metrics.recordListening(to == ConnectionState.LISTENING));
    this.scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("chatfeed-reconnect-"));
  }

  public ConnectionState state() {
    return stateMachine.current();
  }

  public ConnectionStateMachine stateMachine() {
    return stateMachine;
  }

  /**
   * Claims the initial connect. Clears the suppression flag set by a previous disconnect.
   *
   * @return {@code true} if the caller now owns the connect sequence; {@code false} if the
   *     listener is not in {@link ConnectionState#DISCONNECTED}
   */
  public boolean beginConnect() {
    if (closed) {
      throw new IllegalStateException("ReconnectSupervisor has been closed");
    }
    if (!stateMachine.transition(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING)) {
      return false;
    }
    suppressed = false;
    return true;
  }

  /**
   * Completes the initial connect.
   *
   * @return {@code true} if the state moved to LISTENING; {@code false} if a concurrent
   *     {@link #disconnect()} won, in which case the caller must drop its connection
   */
  public boolean connectSucceeded() {
    return stateMachine.transition(ConnectionState.CONNECTING, ConnectionState.LISTENING);
  }

  /**
   * Aborts the initial connect and returns to DISCONNECTED. No retry is scheduled.
   */
  public void connectFailed() {
    stateMachine.transition(ConnectionState.CONNECTING, ConnectionState.DISCONNECTED);
  }

  /**
   * Reports that the live connection failed or ended.
   *
   * @param cause the failure, may be {@code null} for a clean end of stream
   * @return {@code true} if this report started a reconnect chain
   */
  public boolean connectionLost(Throwable cause) {
    if (suppressed || closed) {
      return false;
    }
    if (!stateMachine.transition(ConnectionState.LISTENING, ConnectionState.RECONNECTING)) {
      return false;
    }
    logger.log(Level.WARNING, "Change listener connection lost, scheduling reconnect", cause);
    long chain;
    synchronized (this) {
      chain = generation.incrementAndGet();
    }
    schedule(chain, 1);
    return true;
  }

  private synchronized void schedule(long chain, int attempt) {
    if (isStale(chain)) {
      return;
    }
    long delayMs = policy.delayBeforeAttemptMs(attempt);
    try {
      pendingAttempt = scheduler.schedule(() -> attempt(chain, attempt), delayMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Reconnect scheduler shut down, dropping attempt " + attempt, e);
    }
  }

  private boolean isStale(long chain) {
    return suppressed || closed || generation.get() != chain;
  }

  private void attempt(long chain, int attempt) {
    if (isStale(chain) || stateMachine.current() != ConnectionState.RECONNECTING) {
      return;
    }
    metrics.incrementReconnectAttempts();
    logger.log(Level.INFO, "Reconnect attempt {0}", attempt);
    S opened;
    try {
      opened = target.reopen();
    } catch (Exception e) {
      metrics.incrementReconnectFailures();
      logger.log(Level.WARNING, "Reconnect attempt " + attempt + " failed", e);
      schedule(chain, attempt + 1);
      return;
    }
    boolean resumed;
    synchronized (this) {
      resumed = !isStale(chain)
          && stateMachine.transition(ConnectionState.RECONNECTING, ConnectionState.LISTENING);
    }
    if (!resumed) {
      // disconnect() ran while the attempt was in flight
      target.discard(opened);
      return;
    }
    logger.log(Level.INFO, "Change listener reconnected after {0} attempt(s)", attempt);
    target.activate(opened);
  }

  /**
   * Stops any reconnect activity and moves to DISCONNECTED. The suppression flag is raised
   * before the pending timer is cancelled, so an attempt that already fired sees it.
   */
  public void disconnect() {
    suppressed = true;
    synchronized (this) {
      generation.incrementAndGet();
      if (pendingAttempt != null) {
        pendingAttempt.cancel(false);
        pendingAttempt = null;
      }
    }
    stateMachine.forceDisconnected();
  }

  /**
   * Disconnects and shuts down the reconnect thread.
   */
  @Override
  public void close() {
    disconnect();
    closed = true;
    scheduler.shutdownNow();
    try {
      scheduler.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
