package dbcleaner.app;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the external configuration file named on the command line.
 *
 * <p>Accepts {@code --config=<path>}, {@code --config <path>} and the single-dash forms.
 * Without the option, {@value #DEFAULT_PATH} is used when it exists. The file is handed
 * to Spring Boot as {@code spring.config.additional-location}; every other argument is
 * passed through untouched.
 */
final class ConfigLocation {
  static final String DEFAULT_PATH = "config/config.yaml";

  private final Path path;
  private final boolean explicit;
  private final List<String> passThrough;

  private ConfigLocation(Path path, boolean explicit, List<String> passThrough) {
    this.path = path;
    this.explicit = explicit;
    this.passThrough = passThrough;
  }

  /**
   * @throws IllegalArgumentException if {@code --config} has no value
   */
  static ConfigLocation parse(String... args) {
    Objects.requireNonNull(args, "args");
    Path path = null;
    List<String> rest = new ArrayList<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      String option = optionName(arg);
      if (option == null) {
        rest.add(arg);
        continue;
      }
      String value;
      int eq = arg.indexOf('=');
      if (eq >= 0) {
        value = arg.substring(eq + 1);
      } else if (i + 1 < args.length) {
        value = args[++i];
      } else {
        value = "";
      }
      if (value.isBlank()) {
        throw new IllegalArgumentException(option + " requires a file path");
      }
      path = Path.of(value);
    }
    if (path != null) {
      return new ConfigLocation(path, true, List.copyOf(rest));
    }
    return new ConfigLocation(Path.of(DEFAULT_PATH), false, List.copyOf(rest));
  }

  private static String optionName(String arg) {
    for (String name : new String[] {"--config", "-config"}) {
      if (arg.equals(name) || arg.startsWith(name + "=")) {
        return name;
      }
    }
    return null;
  }

  /** The configuration file in effect, if it exists. */
  Optional<Path> path() {
    return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
  }

  /** True when a file was named explicitly but does not exist. */
  boolean missing() {
    return explicit && !Files.isRegularFile(path);
  }

  Path requestedPath() {
    return path;
  }

  String[] springArgs() {
    List<String> result = new ArrayList<>(passThrough);
    path().ifPresent(p ->
        result.add("--spring.config.additional-location=file:" + p.toAbsolutePath()));
    return result.toArray(new String[0]);
  }
}
