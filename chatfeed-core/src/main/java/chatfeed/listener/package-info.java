/**
 * The change listener engine.
 *
 * @see chatfeed.listener.MessageChangeListener
 */
package chatfeed.listener;
