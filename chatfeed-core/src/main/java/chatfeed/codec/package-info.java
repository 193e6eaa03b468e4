/**
 * Notification payload decoding.
 *
 * @see chatfeed.codec.ChangeEventCodec
 * @see chatfeed.codec.DefaultChangeEventCodec
 */
package chatfeed.codec;
