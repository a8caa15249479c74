package ca.gc.cra.ipscan.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"workers=4", "databaseName=scans"});
    assertEquals(List.of("workers", "databaseName"), List.copyOf(map.keySet()));
    assertEquals("4", map.get("workers"));
  }

  @Test
  void valueKeepsEverythingAfterFirstEquals() {
    Map<String, String> map =
        CliArgsParser.toMap(new String[] {"storeConnectionURI=mongodb://db:27017/?w=majority&journal=true"});
    assertEquals("mongodb://db:27017/?w=majority&journal=true", map.get("storeConnectionURI"));
  }

  @Test
  void rejectsMalformedAndRepeatedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"workers="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9lives=1"}));
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"workers=1", "workers=2"}));
  }

  @Test
  void nullAndBlankArgumentsAreSkipped() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, " "}).isEmpty());
  }
}
