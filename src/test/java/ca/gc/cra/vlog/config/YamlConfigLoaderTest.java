package ca.gc.cra.vlog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vlog.domain.ValidationLevel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndNamedSections() throws IOException {
    Path yaml = tempDir.resolve("validation.yaml");
    Files.writeString(yaml, """
        common:
          enabledLevels: All
          report:
            maxMessageBytes: 2048
        strict:
          enabledLevels: Warning|Error
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "Strict").orElseThrow();

    assertEquals("Warning|Error", map.get("enabledLevels"));
    assertEquals("2048", map.get("report.maxMessageBytes"));
  }

  @Test
  void levelListsJoinIntoMask() throws IOException {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, """
        audit:
          enabledLevels: [Information, Error]
          metrics:
            enabled: true
        """);

    ValidationConfig config = YamlConfigLoader.loadConfig(yaml, "audit");

    assertEquals(ValidationLevel.of(ValidationLevel.INFORMATION, ValidationLevel.ERROR), config.enabledLevels());
    assertTrue(config.metricsEnabled());
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "strict");

    assertFalse(result.isPresent());
    assertEquals(ValidationConfig.defaults(), YamlConfigLoader.loadConfig(tempDir.resolve("missing.yaml"), "strict"));
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - strict:
            enabledLevels: Error
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "strict"));
  }

  @Test
  void malformedYamlThrows() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "strict: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "strict"));
  }
}
