package com.gentoro.citations;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.citations.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path tempDir;

  @Test
  @DisplayName("Loads YAML from the classpath")
  void classpathLocation() {
    ConfigurationProvider provider = new ConfigurationProvider("classpath:citations-test.yaml");

    assertEquals(2, provider.config().getInt("citations.parser.threads"));
    assertTrue(provider.config().getBoolean("citations.extraction.fullFiles"));
  }

  @Test
  @DisplayName("Default location is application.yaml on the classpath")
  void defaultLocation() {
    ConfigurationProvider provider = new ConfigurationProvider((String) null);

    assertEquals(4, provider.config().getInt("citations.parser.threads"));
    assertFalse(provider.config().getBoolean("citations.extraction.fullFiles"));
  }

  @Test
  @DisplayName("Missing classpath resource yields an empty configuration")
  void missingClasspathResource() {
    ConfigurationProvider provider = new ConfigurationProvider("classpath:does-not-exist.yaml");

    assertTrue(provider.config().isEmpty());
    assertEquals(4, provider.config().getInt("citations.parser.threads", 4));
  }

  @Test
  @DisplayName("Loads YAML from a file path and a file URI")
  void fileLocation() throws Exception {
    Path yaml = tempDir.resolve("custom.yaml");
    Files.writeString(yaml, "citations:\n  parser:\n    threads: 7\n");

    ConfigurationProvider byPath = new ConfigurationProvider(yaml.toString());
    ConfigurationProvider byUri = new ConfigurationProvider(yaml.toUri().toString());

    assertEquals(7, byPath.config().getInt("citations.parser.threads"));
    assertEquals(7, byUri.config().getInt("citations.parser.threads"));
  }

  @Test
  @DisplayName("Missing configuration file is a ConfigException")
  void missingFile() {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(tempDir.resolve("absent.yaml").toString()));
  }
}
