package dbcleaner;

import java.util.Objects;

/**
 * Shared identifier validation. Table and column names are interpolated into SQL
 * text, so every one of them passes through here first.
 */
public final class Identifiers {
  private static final String IDENTIFIER_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private Identifiers() {}

  public static String validate(String identifier) {
    Objects.requireNonNull(identifier, "identifier");
    if (!identifier.matches(IDENTIFIER_PATTERN)) {
      throw new IllegalArgumentException("Invalid identifier: " + identifier);
    }
    return identifier;
  }
}
