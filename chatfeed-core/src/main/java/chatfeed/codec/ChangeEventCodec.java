package chatfeed.codec;

import chatfeed.ChangeEvent;

/**
 * Converts between notification payload text and {@link ChangeEvent}.
 *
 * @see DefaultChangeEventCodec
 */
public interface ChangeEventCodec {

  /**
   * Returns the default codec, which reads and writes the snake_case JSON
   * emitted by the database trigger.
   *
   * @return the shared default instance
   */
  static ChangeEventCodec getDefault() {
    return DefaultChangeEventCodec.INSTANCE;
  }

  /**
   * Decodes a payload. A fresh {@link ChangeEvent#eventId()} is assigned on every call.
   *
   * @param payload the notification payload
   * @return the decoded event
   * @throws MalformedPayloadException if the payload is not a valid change event
   */
  ChangeEvent decode(String payload);

  /**
   * Encodes an event into the payload format {@link #decode} accepts. Receiver-side
   * attributes ({@code eventId}, {@code receivedAt}) are not written.
   *
   * @param event the event
   * @return the payload text
   */
  String encode(ChangeEvent event);
}
