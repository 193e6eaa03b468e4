package chatfeed;

import java.util.Objects;

/**
 * Row-level operation carried by a {@link ChangeEvent}.
 *
 * <p>The wire literal is the upper-case constant name, exactly as PostgreSQL
 * reports it in {@code TG_OP}. {@link #TEST} never comes from a trigger; it is
 * emitted by test notifications only.
 */
public enum Operation {
  INSERT,
  UPDATE,
  DELETE,
  TEST;

  /**
   * Returns the literal used in notification payloads.
   *
   * @return the wire literal, e.g. {@code "INSERT"}
   */
  public String wireName() {
    return name();
  }

  /**
   * Resolves a wire literal.
   *
   * @param literal the literal from the payload
   * @return the matching operation
   * @throws NullPointerException if literal is null
   * @throws IllegalArgumentException if the literal is not a known operation
   */
  public static Operation fromWire(String literal) {
    Objects.requireNonNull(literal, "literal");
    for (Operation op : values()) {
      if (op.name().equals(literal)) {
        return op;
      }
    }
    throw new IllegalArgumentException("Unknown operation: " + literal);
  }
}
