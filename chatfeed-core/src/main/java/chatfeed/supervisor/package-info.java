/**
 * Connection lifecycle state and automatic reconnection.
 *
 * <p>{@link chatfeed.supervisor.ReconnectSupervisor} restores a lost listener connection
 * on a fixed backoff schedule and never runs two reconnect chains at once.
 */
package chatfeed.supervisor;
