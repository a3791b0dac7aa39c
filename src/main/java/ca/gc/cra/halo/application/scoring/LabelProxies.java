package ca.gc.cra.halo.application.scoring;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Fixed numeric proxies for severity labels so they can be tracked and weighted like scores.
 *
 * <p>Unknown labels have no proxy and are left out of history and aggregation.
 *
 * @since 0.1.0
 */
public final class LabelProxies {
  private static final Map<String, Double> SEVERITY = Map.of(
      "minimal", 0.1d,
      "low", 0.1d,
      "mild", 0.3d,
      "moderate", 0.6d,
      "high", 0.9d,
      "severe", 0.9d);

  private LabelProxies() {}

  /** Returns the proxy in {@code [0, 1]} for a severity label, case-insensitively. */
  public static OptionalDouble severity(String label) {
    if (label == null) {
      return OptionalDouble.empty();
    }
    Double proxy = SEVERITY.get(label.trim().toLowerCase(Locale.ROOT));
    return proxy == null ? OptionalDouble.empty() : OptionalDouble.of(proxy);
  }

  /** Returns whether {@code label} is one of the given levels, ignoring case. */
  static boolean isAnyOf(String label, String... levels) {
    if (label == null) {
      return false;
    }
    String normalized = label.trim();
    for (String level : levels) {
      if (normalized.equalsIgnoreCase(level)) {
        return true;
      }
    }
    return false;
  }
}
