package chatfeed.supervisor;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds the current {@link ConnectionState} and applies compare-and-set transitions.
 *
 * <p>Concurrent callers racing for the same transition (for example an error callback
 * and a close callback both reporting a lost connection) see exactly one winner, so at
 * most one reconnect loop can be started per outage.
 */
public final class ConnectionStateMachine {
  private static final Logger logger = Logger.getLogger(ConnectionStateMachine.class.getName());

  private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
  private final List<StateObserver> observers = new CopyOnWriteArrayList<>();

  /**
   * Callback for observed transitions. Invoked on the thread that performed the transition.
   */
  @FunctionalInterface
  public interface StateObserver {
    void onTransition(ConnectionState from, ConnectionState to);
  }

  public ConnectionState current() {
    return state.get();
  }

  /**
   * Adds an observer notified after every successful transition.
   *
   * @param observer the observer
   */
  public void addObserver(StateObserver observer) {
    observers.add(Objects.requireNonNull(observer, "observer"));
  }

  /**
   * Moves from {@code from} to {@code to} if the current state is {@code from}.
   *
   * @param from expected current state
   * @param to   next state
   * @return {@code true} if this call performed the transition
   * @throws IllegalArgumentException if {@code from -> to} is not a legal transition
   */
  public boolean transition(ConnectionState from, ConnectionState to) {
    if (!from.canTransitionTo(to)) {
      throw new IllegalArgumentException("Illegal transition " + from + " -> " + to);
    }
    if (!state.compareAndSet(from, to)) {
      return false;
    }
    fire(from, to);
    return true;
  }

  /**
   * Moves to {@link ConnectionState#DISCONNECTED} from whatever the current state is.
   *
   * @return the state before the call
   */
  public ConnectionState forceDisconnected() {
    ConnectionState previous = state.getAndSet(ConnectionState.DISCONNECTED);
    if (previous != ConnectionState.DISCONNECTED) {
      fire(previous, ConnectionState.DISCONNECTED);
    }
    return previous;
  }

  private void fire(ConnectionState from, ConnectionState to) {
    logger.log(Level.FINE, "Connection state {0} -> {1}", new Object[]{from, to});
    for (StateObserver observer : observers) {
      try {
        observer.onTransition(from, to);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "State observer failed on " + from + " -> " + to, e);
      }
    }
  }
}
