package chatfeed;

/**
 * Subscriber callback for {@link ChangeEvent}s.
 *
 * <p>Handlers run <b>synchronously</b> on the listener thread, in registration order.
 * A slow handler delays every handler registered after it for the same publish.
 * A handler that throws is logged and skipped; later handlers still run and the
 * listener connection is unaffected.
 *
 * <pre>{@code
 * listener.subscribe(ChangeTopics.MESSAGE_CHANGE, event -> {
 *   if (event.isSoftDelete()) {
 *     sse.broadcast(event.groupId(), "message_deleted", event.id());
 *   }
 * });
 * }</pre>
 *
 * @see chatfeed.bus.EventBus
 */
@FunctionalInterface
public interface ChangeHandler {

  /**
   * Processes one change event.
   *
   * @param event the decoded event
   * @throws Exception if processing fails; the failure is isolated to this handler
   */
  void onChange(ChangeEvent event) throws Exception;
}
