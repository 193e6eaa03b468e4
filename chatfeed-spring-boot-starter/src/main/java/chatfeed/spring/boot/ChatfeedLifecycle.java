package chatfeed.spring.boot;

import chatfeed.listener.MessageChangeListener;

import org.springframework.context.SmartLifecycle;

import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Connects the {@link MessageChangeListener} once the context has refreshed and
 * disconnects it on shutdown.
 *
 * <p>Starts in the last lifecycle phase, after web servers and message handler
 * registration, so no change is published before subscribers exist.
 */
public class ChatfeedLifecycle implements SmartLifecycle {
  private static final Logger logger = Logger.getLogger(ChatfeedLifecycle.class.getName());

  private final MessageChangeListener listener;
  private final boolean autoConnect;
  private final boolean failFast;
  private volatile boolean running;

  public ChatfeedLifecycle(MessageChangeListener listener, boolean autoConnect, boolean failFast) {
    this.listener = Objects.requireNonNull(listener, "listener");
    this.autoConnect = autoConnect;
    this.failFast = failFast;
  }

  @Override
  public void start() {
    running = true;
    if (!autoConnect) {
      logger.log(Level.INFO, "chatfeed.auto-connect is false, change listener left disconnected");
      return;
    }
    try {
      listener.connect();
    } catch (SQLException e) {
      if (failFast) {
        running = false;
        throw new IllegalStateException("Change listener failed to connect on channel "
            + listener.channel(), e);
      }
      logger.log(Level.WARNING, "Change listener failed to connect, continuing without change feed", e);
    }
  }

  @Override
  public void stop() {
    running = false;
    listener.disconnect();
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public int getPhase() {
    return Integer.MAX_VALUE - 1000;
  }
}
