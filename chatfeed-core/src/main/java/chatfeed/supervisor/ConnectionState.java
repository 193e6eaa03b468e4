package chatfeed.supervisor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of the change listener connection.
 *
 * <pre>
 * DISCONNECTED --connect()--> CONNECTING --ok--> LISTENING
 *                                  |                 |  connection lost
 *                                  +--failure--+     v
 *                                              | RECONNECTING --ok--> LISTENING
 * any state --disconnect()--> DISCONNECTED <---+
 * </pre>
 */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  LISTENING,
  RECONNECTING;

  /**
   * Returns whether a direct transition from this state to {@code target} is legal.
   *
   * @param target the next state
   * @return {@code true} if the transition is allowed
   */
  public boolean canTransitionTo(ConnectionState target) {
    return successors().contains(target);
  }

  private Set<ConnectionState> successors() {
    return switch (this) {
      case DISCONNECTED -> EnumSet.of(CONNECTING);
      case CONNECTING -> EnumSet.of(LISTENING, DISCONNECTED);
      case LISTENING -> EnumSet.of(RECONNECTING, DISCONNECTED);
      case RECONNECTING -> EnumSet.of(LISTENING, DISCONNECTED);
    };
  }
}
