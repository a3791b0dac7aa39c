package ca.gc.cra.halo.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("0", Strings.requireNonBlank("device", "  0 "));
  }

  @Test
  void requireNonBlankRejectsNullBlankAndControlCharacters() {
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("device", null));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("device", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("device", "cam\n0"));
  }

  @Test
  void requireFileNameSafeAllowsPortableCharacters() {
    assertEquals("facial_analysis-v1.2", Strings.requireFileNameSafe("filePrefix", "facial_analysis-v1.2", 64));
  }

  @Test
  void requireFileNameSafeRejectsSeparatorsAndLongValues() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireFileNameSafe("filePrefix", "a/b", 64));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireFileNameSafe("filePrefix", "a b", 64));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireFileNameSafe("filePrefix", "x".repeat(65), 64));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertEquals("env=prod", Strings.requirePrintableAscii("attrs", "env=prod", 32));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "site=café", 32));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "a=b", 2));
  }
}
