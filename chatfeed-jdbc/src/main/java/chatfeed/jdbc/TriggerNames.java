package chatfeed.jdbc;

import java.util.Objects;

/**
 * Default names and identifier validation for the notification trigger objects.
 *
 * <p>Names end up in DDL and in {@code LISTEN}, where they cannot be bound as parameters,
 * so only plain identifiers are accepted.
 */
public final class TriggerNames {
  public static final String DEFAULT_TABLE = "messages";
  public static final String DEFAULT_FUNCTION = "notify_message_change";
  public static final String DEFAULT_TRIGGER = "messages_notify_trigger";
  public static final String DEFAULT_CHANNEL = "message_changes";

  /** PostgreSQL truncates identifiers longer than this (NAMEDATALEN - 1). */
  static final int MAX_IDENTIFIER_LENGTH = 63;
  private static final String IDENTIFIER_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TriggerNames() {}

  /**
   * Validates an identifier.
   *
   * @param identifier the table, function, trigger or channel name
   * @return the identifier unchanged
   * @throws NullPointerException if identifier is null
   * @throws IllegalArgumentException if identifier is not a plain identifier of at most 63 chars
   */
  public static String validate(String identifier) {
    Objects.requireNonNull(identifier, "identifier");
    if (!identifier.matches(IDENTIFIER_PATTERN)) {
      throw new IllegalArgumentException("Invalid identifier: " + identifier);
    }
    if (identifier.length() > MAX_IDENTIFIER_LENGTH) {
      throw new IllegalArgumentException("Identifier longer than " + MAX_IDENTIFIER_LENGTH
          + " characters: " + identifier);
    }
    return identifier;
  }
}
