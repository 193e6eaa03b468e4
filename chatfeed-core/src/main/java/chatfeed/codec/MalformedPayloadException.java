package chatfeed.codec;

/**
 * Thrown when a notification payload cannot be decoded into a {@link chatfeed.ChangeEvent}.
 *
 * <p>The listener catches this, logs it and drops the notification; the connection is
 * not affected.
 */
public class MalformedPayloadException extends IllegalArgumentException {
  private static final int MAX_PAYLOAD_IN_MESSAGE = 200;

  private final String payload;

  public MalformedPayloadException(String message, String payload) {
    this(message, payload, null);
  }

  public MalformedPayloadException(String message, String payload, Throwable cause) {
    super(message + ": " + abbreviate(payload), cause);
    this.payload = payload;
  }

  /** The raw payload text as received. */
  public String payload() {
    return payload;
  }

  private static String abbreviate(String payload) {
    if (payload == null) {
      return "<null>";
    }
    if (payload.length() <= MAX_PAYLOAD_IN_MESSAGE) {
      return payload;
    }
    return payload.substring(0, MAX_PAYLOAD_IN_MESSAGE) + "...(" + payload.length() + " chars)";
  }
}
