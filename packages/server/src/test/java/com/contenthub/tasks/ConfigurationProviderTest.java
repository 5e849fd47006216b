package com.contenthub.tasks;

import static org.junit.jupiter.api.Assertions.*;

import com.contenthub.tasks.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path tmp;

  @AfterEach
  void clearProperty() {
    System.clearProperty("contenthub.test.workers");
  }

  @Test
  void loadsBundledDefaults() {
    Configuration config = new ConfigurationProvider(null).config();
    assertEquals(8080, config.getInt("http.port"));
    assertEquals(4, config.getInt("jobs.workers"));
    assertEquals("file", config.getString("jobs.storage.type"));
    assertEquals(10, config.getInt("jobs.shutdown.grace-seconds"));
  }

  @Test
  void loadsFileAndInterpolatesSystemProperties() throws Exception {
    System.setProperty("contenthub.test.workers", "7");
    Path file = tmp.resolve("tasks.yaml");
    Files.writeString(
        file,
        String.join(
            "\n",
            "http:",
            "  port: 9090",
            "jobs:",
            "  workers: ${sys:contenthub.test.workers}",
            "  storage:",
            "    type: memory",
            ""));

    Configuration config = new ConfigurationProvider(file.toString()).config();
    assertEquals(9090, config.getInt("http.port"));
    assertEquals(7, config.getInt("jobs.workers"));
    assertEquals("memory", config.getString("jobs.storage.type"));
    assertEquals("0.0.0.0", config.getString("http.hostname", "0.0.0.0"));
  }

  @Test
  void missingFileIsAConfigError() {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(tmp.resolve("missing.yaml").toString()));
  }

  @Test
  void invalidYamlIsAConfigError() throws Exception {
    Path file = tmp.resolve("broken.yaml");
    Files.writeString(file, "http: [unclosed\n");
    assertThrows(ConfigException.class, () -> new ConfigurationProvider(file.toString()));
  }
}
