package ca.gc.cra.halo.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through HALO configuration.
 * <p><strong>Why:</strong> Device names and file prefixes end up in file names and log lines, so blank or
 * control-character values are rejected up front.
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent access.
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank and free of control characters.
   *
   * @param name parameter name for diagnostics; {@code "value"} when {@code null}
   * @param value candidate text
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value is safe to use as part of a file name: letters, digits, dot, underscore or hyphen.
   *
   * @param name parameter name for diagnostics
   * @param value candidate text
   * @param maxLength maximum length in characters
   * @return validated value
   * @throws IllegalArgumentException if the value is blank, too long or has other characters
   */
  public static String requireFileNameSafe(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
          || c == '.' || c == '_' || c == '-';
      if (!allowed) {
        throw new IllegalArgumentException(
            message(name, "must only contain letters, digits, dot, underscore, or hyphen"));
      }
    }
    return sanitized;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is no longer than {@code maxLength}.
   *
   * @param name parameter name for diagnostics
   * @param value candidate string
   * @param maxLength maximum length in characters
   * @return validated value
   * @throws IllegalArgumentException if the value is blank, too long or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
