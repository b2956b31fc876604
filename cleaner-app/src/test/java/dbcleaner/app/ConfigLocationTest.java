package dbcleaner.app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLocationTest {

  @TempDir
  Path dir;

  @Test
  void equalsFormPointsSpringAtFile() throws Exception {
    Path file = Files.writeString(dir.resolve("config.yaml"), "cleaner:\n  batch_size: 10\n");

    ConfigLocation location = ConfigLocation.parse("--config=" + file, "--cleaner.dry-run=false");

    assertFalse(location.missing());
    assertEquals(file, location.path().orElseThrow());
    assertArrayEquals(new String[] {
        "--cleaner.dry-run=false",
        "--spring.config.additional-location=file:" + file.toAbsolutePath()
    }, location.springArgs());
  }

  @Test
  void separateValueAndSingleDashAreAccepted() throws Exception {
    Path file = Files.writeString(dir.resolve("c.yml"), "");

    assertEquals(file, ConfigLocation.parse("-config", file.toString()).path().orElseThrow());
    assertEquals(file, ConfigLocation.parse("--config", file.toString()).path().orElseThrow());
    assertEquals(file, ConfigLocation.parse("-config=" + file).path().orElseThrow());
  }

  @Test
  void explicitMissingFileIsReported() {
    ConfigLocation location = ConfigLocation.parse("--config=" + dir.resolve("absent.yaml"));

    assertTrue(location.missing());
    assertTrue(location.path().isEmpty());
    assertEquals(0, location.springArgs().length);
  }

  @Test
  void absentDefaultIsNotAnError() {
    ConfigLocation location = ConfigLocation.parse("--cleaner.verbose=true");

    assertFalse(location.missing());
    assertEquals(Path.of(ConfigLocation.DEFAULT_PATH), location.requestedPath());
    assertArrayEquals(new String[] {"--cleaner.verbose=true"}, location.springArgs());
  }

  @Test
  void optionWithoutValueIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigLocation.parse("--config"));
    assertThrows(IllegalArgumentException.class, () -> ConfigLocation.parse("--config="));
  }
}
