/**
 * Spring Boot auto-configuration for the message change feed.
 *
 * <p>With a {@code DataSource} on the context the starter creates a
 * {@link chatfeed.listener.MessageChangeListener}, subscribes every
 * {@link chatfeed.spring.boot.MessageChangeHandler} bean and connects on startup.
 * Properties live under {@code chatfeed.*}; see {@link chatfeed.spring.boot.ChatfeedProperties}.
 */
package chatfeed.spring.boot;
