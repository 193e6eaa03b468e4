package chatfeed.util;

import java.util.Map;

/**
 * Codec for flat JSON objects whose values are scalars.
 *
 * <p>Notification payloads built by {@code json_build_object} are flat: strings,
 * numbers, booleans and {@code null}. The default implementation
 * ({@link DefaultJsonCodec}) handles exactly that shape without external
 * dependencies. Applications that already ship Jackson or Gson can implement
 * this interface and pass it to {@link chatfeed.codec.DefaultChangeEventCodec}.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a map as a JSON object. Supported value types are {@link String},
   * {@link Number}, {@link Boolean} and {@code null}; anything else is written
   * via {@link Object#toString()} as a string.
   *
   * @param fields the fields to encode, in iteration order
   * @return the JSON object text
   */
  String toJson(Map<String, ?> fields);

  /**
   * Parses a JSON object. Values are returned as {@link String}, {@link Long}
   * (integral numbers), {@link java.math.BigDecimal} (other numbers),
   * {@link Boolean} or {@code null}.
   *
   * @param json the JSON text
   * @return an ordered map of the parsed fields
   * @throws IllegalArgumentException if the input is not a flat JSON object
   */
  Map<String, Object> parseObject(String json);
}
