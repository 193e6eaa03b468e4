/**
 * Real-time change feed for the chatroom {@code messages} table.
 *
 * <p>A database trigger publishes every row change on a notification channel;
 * {@link chatfeed.listener.MessageChangeListener} receives those notifications on a
 * dedicated connection, decodes them into {@link chatfeed.ChangeEvent}s and publishes them
 * on an in-process {@link chatfeed.bus.EventBus}.
 *
 * <h2>Quick start</h2>
 * <pre>{@code
 * MessageChangeListener listener = MessageChangeListener.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .changeChannel(new PostgresChangeChannel())
 *     .triggerInstaller(new PostgresTriggerInstaller())
 *     .build();
 *
 * listener.subscribe(event -> broadcaster.send(event.groupId(), event));
 * listener.connect();
 * }</pre>
 */
package chatfeed;
