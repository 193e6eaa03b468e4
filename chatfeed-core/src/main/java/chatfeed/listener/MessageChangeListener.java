package chatfeed.listener;

import chatfeed.ChangeEvent;
import chatfeed.ChangeHandler;
import chatfeed.ChangeTopics;
import chatfeed.ConnectionNotReadyException;
import chatfeed.Topic;
import chatfeed.bus.DefaultEventBus;
import chatfeed.bus.EventBus;
import chatfeed.bus.Subscription;
import chatfeed.codec.ChangeEventCodec;
import chatfeed.codec.MalformedPayloadException;
import chatfeed.spi.ChangeChannel;
import chatfeed.spi.ConnectionProvider;
import chatfeed.spi.MetricsExporter;
import chatfeed.spi.TriggerInstaller;
import chatfeed.supervisor.ConnectionState;
import chatfeed.supervisor.FixedBackoffReconnectPolicy;
import chatfeed.supervisor.ReconnectPolicy;
import chatfeed.supervisor.ReconnectSupervisor;
import chatfeed.supervisor.ReconnectTarget;
import chatfeed.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds one dedicated database connection subscribed to the change channel and turns each
 * notification into a {@link ChangeEvent} on the {@link EventBus}.
 *
 * <p>Every decoded event is published twice: on {@link ChangeTopics#MESSAGE_CHANGE} and on the
 * operation topic from {@link ChangeTopics#forOperation}. Payloads that fail to decode are
 * logged and dropped; the connection stays up.
 *
 * <p>The connect sequence is: open a connection from the {@link ConnectionProvider}, run the
 * {@link TriggerInstaller}, then LISTEN. If the connection later fails, a
 * {@link ReconnectSupervisor} repeats that sequence on a fixed backoff until it succeeds or
 * {@link #disconnect()} is called. A failure of the first {@link #connect()} is thrown to the
 * caller and is not retried.
 *
 * <p>Notifications are received on a daemon thread named {@code chatfeed-listener-N}; handlers
 * run on that thread, one event at a time. A dispatch that fails is logged and the thread
 * moves on to the next notification.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see MessageChangeListener.Builder
 */
public final class MessageChangeListener implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MessageChangeListener.class.getName());

  public static final String DEFAULT_CHANNEL = "message_changes";
  public static final String DEFAULT_TEST_MESSAGE = "Test notification";

  private final ConnectionProvider connectionProvider;
  private final ChangeChannel changeChannel;
  private final TriggerInstaller triggerInstaller;
  private final EventBus eventBus;
  private final ChangeEventCodec codec;
  private final int pollTimeoutMs;
  private final String channel;
  private final MetricsExporter metrics;
  private final ReconnectSupervisor<ListenerSession> supervisor;
  private final ExecutorService receiver;
  private final AtomicReference<ListenerSession> session = new AtomicReference<>();

  private MessageChangeListener(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.changeChannel = Objects.requireNonNull(builder.changeChannel, "changeChannel");
    this.channel = Objects.requireNonNull(builder.channel, "channel");
    if (channel.isEmpty()) {
      throw new IllegalArgumentException("channel cannot be empty");
    }
    if (builder.pollTimeoutMs <= 0) {
      throw new IllegalArgumentException("pollTimeoutMs must be > 0");
    }
    this.pollTimeoutMs = builder.pollTimeoutMs;
    this.triggerInstaller = builder.triggerInstaller != null ? builder.triggerInstaller : TriggerInstaller.NONE;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.eventBus = builder.eventBus != null ? builder.eventBus : new DefaultEventBus(metrics);
    this.codec = builder.codec != null ? builder.codec : ChangeEventCodec.getDefault();
    ReconnectPolicy policy = builder.reconnectPolicy != null
        ? builder.reconnectPolicy : new FixedBackoffReconnectPolicy();
    this.supervisor = new ReconnectSupervisor<>(new SessionTarget(), policy, metrics);
    this.receiver = Executors.newSingleThreadExecutor(new DaemonThreadFactory("chatfeed-listener-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Opens the dedicated connection, installs the trigger and starts listening.
   * A no-op if the listener is not {@link ConnectionState#DISCONNECTED}.
   *
   * @throws SQLException if any step fails; the listener returns to DISCONNECTED
   * @throws IllegalStateException if the listener has been closed
   */
  public void connect() throws SQLException {
    if (!supervisor.beginConnect()) {
      logger.log(Level.FINE, "connect() ignored in state {0}", supervisor.state());
      return;
    }
    logger.log(Level.INFO, "Connecting change listener on channel {0}", channel);
    ListenerSession opened;
    try {
      opened = new ListenerSession(openConnection());
    } catch (SQLException | RuntimeException e) {
      supervisor.connectFailed();
      logger.log(Level.SEVERE, "Change listener failed to connect on channel " + channel, e);
      throw e;
    }
    ListenerSession previous = session.getAndSet(opened);
    if (previous != null) {
      release(previous);
    }
    if (!supervisor.connectSucceeded()) {
      discardSession(opened);
      return;
    }
    startReceiving(opened);
    logger.log(Level.INFO, "Change listener listening on channel {0}", channel);
  }

  /**
   * Stops listening: suppresses reconnects, issues UNLISTEN and closes the connection.
   * Safe to call in any state.
   */
  public void disconnect() {
    supervisor.disconnect();
    ListenerSession current = session.getAndSet(null);
    if (current == null) {
      return;
    }
    current.active = false;
    try {
      changeChannel.unlisten(current.connection, channel);
    } catch (SQLException e) {
      logger.log(Level.FINE, "UNLISTEN failed on channel " + channel, e);
    }
    closeQuietly(current.connection);
    logger.log(Level.INFO, "Change listener disconnected from channel {0}", channel);
  }

  /**
   * Sends a TEST notification with the default message.
   *
   * @throws ConnectionNotReadyException if the listener is not LISTENING
   * @throws SQLException if the notification cannot be sent
   * @see #testNotification(String)
   */
  public void testNotification() throws SQLException {
    testNotification(DEFAULT_TEST_MESSAGE);
  }

  /**
   * Sends a TEST notification directly on the channel, bypassing the table trigger.
   * The notification goes out on a separate connection from the provider.
   *
   * @param message text carried in the payload
   * @throws ConnectionNotReadyException if the listener is not LISTENING
   * @throws SQLException if the notification cannot be sent
   */
  public void testNotification(String message) throws SQLException {
    ConnectionState current = supervisor.state();
    if (current != ConnectionState.LISTENING) {
      throw new ConnectionNotReadyException(current);
    }
    String payload = codec.encode(ChangeEvent.test(message));
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      changeChannel.send(conn, channel, payload);
    }
    logger.log(Level.INFO, "Test notification sent on channel {0}", channel);
  }

  /** Returns {@code true} while the listener is able to deliver events. */
  public boolean isListening() {
    return supervisor.state() == ConnectionState.LISTENING;
  }

  public ConnectionState state() {
    return supervisor.state();
  }

  public String channel() {
    return channel;
  }

  public EventBus eventBus() {
    return eventBus;
  }

  /**
   * Registers a handler for every change, on {@link ChangeTopics#MESSAGE_CHANGE}.
   *
   * @param handler the handler
   * @return the subscription handle
   */
  public Subscription subscribe(ChangeHandler handler) {
    return eventBus.subscribe(ChangeTopics.MESSAGE_CHANGE, handler);
  }

  public Subscription subscribe(Topic topic, ChangeHandler handler) {
    return eventBus.subscribe(topic, handler);
  }

  public boolean unsubscribe(Subscription subscription) {
    return eventBus.unsubscribe(subscription);
  }

  /**
   * Disconnects and stops the receive and reconnect threads. The listener cannot be
   * connected again afterwards.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      disconnect();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      supervisor.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    receiver.shutdownNow();
    try {
      if (!receiver.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.log(Level.WARNING, "Change listener receive thread did not stop within 5s");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (first != null) {
      throw first;
    }
  }

  private Connection openConnection() throws SQLException {
    Connection conn = connectionProvider.getConnection();
    try {
      conn.setAutoCommit(true);
      triggerInstaller.install(conn);
      changeChannel.listen(conn, channel);
    } catch (SQLException | RuntimeException e) {
      closeQuietly(conn);
      throw e;
    }
    return conn;
  }

  /**
   * Clears {@code owned} if it is still the live session, then closes it. Never touches
   * another session.
   */
  private void discardSession(ListenerSession owned) {
    session.compareAndSet(owned, null);
    release(owned);
  }

  private static void release(ListenerSession owned) {
    owned.active = false;
    closeQuietly(owned.connection);
  }

  private void startReceiving(ListenerSession target) {
    try {
      receiver.execute(() -> receiveLoop(target));
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Receive thread shut down, not starting loop", e);
    }
  }

  private void receiveLoop(ListenerSession current) {
    while (current.active && !Thread.currentThread().isInterrupted()) {
      List<String> payloads;
      try {
        payloads = changeChannel.receive(current.connection, channel, pollTimeoutMs);
      } catch (SQLException | RuntimeException e) {
        if (current.active && session.compareAndSet(current, null)) {
          release(current);
          supervisor.connectionLost(e);
        }
        return;
      }
      for (String payload : payloads) {
        if (!current.active) {
          return;
        }
        try {
          dispatch(payload);
        } catch (Throwable t) {
          logger.log(Level.SEVERE, "Dispatch failed on channel " + channel + ", continuing", t);
        }
      }
    }
  }

  void dispatch(String payload) {
    metrics.incrementNotificationsReceived();
    ChangeEvent event;
    try {
      event = codec.decode(payload);
    } catch (MalformedPayloadException e) {
      metrics.incrementNotificationsMalformed();
      logger.log(Level.WARNING, "Dropping malformed notification on channel " + channel, e);
      return;
    }
    logger.log(Level.FINE, "Received {0}", event);
    eventBus.publish(ChangeTopics.MESSAGE_CHANGE, event);
    eventBus.publish(ChangeTopics.forOperation(event.operation()), event);
    metrics.incrementEventsPublished();
  }

  private static void closeQuietly(Connection conn) {
    try {
      conn.close();
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to close listener connection", e);
    }
  }

  private static final class ListenerSession {
    private final Connection connection;
    private volatile boolean active = true;

    private ListenerSession(Connection connection) {
      this.connection = connection;
    }
  }

  private final class SessionTarget implements ReconnectTarget<ListenerSession> {
    @Override
    public ListenerSession reopen() throws SQLException {
      ListenerSession opened = new ListenerSession(openConnection());
      if (!session.compareAndSet(null, opened)) {
        release(opened);
        throw new IllegalStateException("Another listener session is already live on channel " + channel);
      }
      return opened;
    }

    @Override
    public void activate(ListenerSession opened) {
      if (opened.active && session.get() == opened) {
        startReceiving(opened);
      }
    }

    @Override
    public void discard(ListenerSession opened) {
      discardSession(opened);
    }
  }

  /**
   * Builder for {@link MessageChangeListener}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ChangeChannel changeChannel;
    private TriggerInstaller triggerInstaller;
    private EventBus eventBus;
    private ChangeEventCodec codec;
    private ReconnectPolicy reconnectPolicy;
    private int pollTimeoutMs = 500;
    private String channel = DEFAULT_CHANNEL;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * Sets the source of the dedicated listener connection and of test-notification connections.
     *
     * <p><b>Required.</b> Connections handed out must not be shared with other callers
     * while the listener holds them.
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the database-specific notification channel.
     *
     * <p><b>Required.</b>
     *
     * @param changeChannel the channel implementation
     * @return this builder
     */
    public Builder changeChannel(ChangeChannel changeChannel) {
      this.changeChannel = changeChannel;
      return this;
    }

    /**
     * Sets the installer run on every connect and reconnect.
     *
     * <p>Optional. Defaults to {@link TriggerInstaller#NONE}.
     *
     * @param triggerInstaller the trigger installer
     * @return this builder
     */
    public Builder triggerInstaller(TriggerInstaller triggerInstaller) {
      this.triggerInstaller = triggerInstaller;
      return this;
    }

    /**
     * Sets the bus events are published on.
     *
     * <p>Optional. Defaults to a new {@link DefaultEventBus} sharing this listener's metrics.
     *
     * @param eventBus the event bus
     * @return this builder
     */
    public Builder eventBus(EventBus eventBus) {
      this.eventBus = eventBus;
      return this;
    }

    /**
     * Optional. Defaults to {@link ChangeEventCodec#getDefault()}.
     *
     * @param codec the payload codec
     * @return this builder
     */
    public Builder codec(ChangeEventCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Optional. Defaults to {@link FixedBackoffReconnectPolicy} with 5s / 10s.
     *
     * @param reconnectPolicy delay strategy between reconnect attempts
     * @return this builder
     */
    public Builder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
      this.reconnectPolicy = reconnectPolicy;
      return this;
    }

    /**
     * Sets how long one receive call blocks waiting for notifications.
     *
     * <p>Optional. Defaults to {@code 500} ms. Must be &gt; 0. Bounds how quickly the
     * receive thread notices {@link #disconnect()}.
     *
     * @param pollTimeoutMs receive timeout in milliseconds
     * @return this builder
     */
    public Builder pollTimeoutMs(int pollTimeoutMs) {
      this.pollTimeoutMs = pollTimeoutMs;
      return this;
    }

    /**
     * Optional. Defaults to {@value MessageChangeListener#DEFAULT_CHANNEL}.
     *
     * @param channel the notification channel name
     * @return this builder
     */
    public Builder channel(String channel) {
      this.channel = channel;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the listener. Call {@link MessageChangeListener#connect()} to start listening.
     *
     * @return a new listener in {@link ConnectionState#DISCONNECTED}
     * @throws NullPointerException     if {@code connectionProvider}, {@code changeChannel}
     *                                  or {@code channel} is null
     * @throws IllegalArgumentException if {@code channel} is empty or {@code pollTimeoutMs <= 0}
     */
    public MessageChangeListener build() {
      return new MessageChangeListener(this);
    }
  }
}
