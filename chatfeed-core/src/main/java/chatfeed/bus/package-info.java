/**
 * In-process event bus.
 *
 * <p>{@link chatfeed.bus.DefaultEventBus} maps each {@link chatfeed.Topic} to an ordered
 * list of handlers and delivers synchronously, isolating handler failures from each
 * other and from the publisher.
 *
 * @see chatfeed.bus.EventBus
 * @see chatfeed.bus.Subscription
 */
package chatfeed.bus;
