package chatfeed;

import chatfeed.supervisor.ConnectionState;

/**
 * Thrown when an operation needs an active listener connection but the
 * listener is not in {@link ConnectionState#LISTENING}.
 */
public final class ConnectionNotReadyException extends IllegalStateException {
  private final ConnectionState state;

  public ConnectionNotReadyException(ConnectionState state) {
    super("Change listener connection not ready (state=" + state + ")");
    this.state = state;
  }

  public ConnectionState state() {
    return state;
  }
}
