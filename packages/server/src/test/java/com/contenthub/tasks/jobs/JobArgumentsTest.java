package com.contenthub.tasks.jobs;

import static org.junit.jupiter.api.Assertions.*;

import com.contenthub.tasks.exception.ValidationException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JobArgumentsTest {

  record Drive(String id, String path) {}

  private final JobArguments args =
      new JobArguments(
          Arrays.asList("channel-1", 42, null),
          Map.of(
              "node_ids", List.of("a", "b"),
              "drive", Map.of("id", "d1", "path", "/media/usb"),
              "update", true));

  @Test
  void convertsPositionalArguments() {
    assertEquals(3, args.size());
    assertEquals("channel-1", args.positional(0, String.class));
    assertEquals(42L, args.positional(1, Long.class));
    assertNull(args.positional(2, String.class));
  }

  @Test
  void convertsKeywordArgumentsToTypedValues() {
    assertEquals(List.of("a", "b"), args.keyword("node_ids", List.class));
    assertEquals(new Drive("d1", "/media/usb"), args.keyword("drive", Drive.class));
    assertTrue(args.optionalKeyword("update", Boolean.class).orElseThrow());
    assertTrue(args.optionalKeyword("baseurl", String.class).isEmpty());
  }

  @Test
  void missingArgumentsAreValidationErrors() {
    assertThrows(ValidationException.class, () -> args.positional(3, String.class));
    assertThrows(ValidationException.class, () -> args.positional(-1, String.class));
    assertThrows(ValidationException.class, () -> args.keyword("baseurl", String.class));
  }

  @Test
  void incompatibleTypesAreValidationErrors() {
    assertThrows(ValidationException.class, () -> args.positional(0, Integer.class));
  }
}
