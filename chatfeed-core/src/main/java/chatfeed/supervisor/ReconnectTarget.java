package chatfeed.supervisor;

/**
 * The component whose connection the {@link ReconnectSupervisor} restores.
 *
 * @param <S> handle of one opened connection
 */
public interface ReconnectTarget<S> {

  /**
   * Runs the full connect sequence on a fresh connection (open, install triggers,
   * subscribe) without starting delivery yet.
   *
   * @return the opened connection; ownership passes to the supervisor, which hands it
   *     back through exactly one of {@link #activate} or {@link #discard}
   * @throws Exception if any step fails; the target releases whatever it opened and the
   *     supervisor schedules another attempt
   */
  S reopen() throws Exception;

  /**
   * Starts delivery on a connection returned by {@link #reopen()}. Called only after the
   * supervisor has moved back to {@link ConnectionState#LISTENING}.
   */
  void activate(S session);

  /**
   * Closes a connection returned by {@link #reopen()} that will not be activated. Must not
   * touch any other connection the target holds.
   */
  void discard(S session);
}
