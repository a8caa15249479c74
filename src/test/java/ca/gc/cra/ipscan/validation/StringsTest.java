package ca.gc.cra.ipscan.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrimsAndRejectsControlCharacters() {
    assertEquals("value", Strings.requireNonBlank("name", "  value "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\u0007b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void requirePrintableAsciiEnforcesBudget() {
    assertEquals("service.name=ipscan", Strings.requirePrintableAscii("attrs", "service.name=ipscan", 64));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abcdef", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "café", 10));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abc", 0));
  }
}
