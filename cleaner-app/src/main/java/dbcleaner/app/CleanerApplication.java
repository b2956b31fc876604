package dbcleaner.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Command-line entry point: load configuration, connect, clean every managed table, exit.
 *
 * <p>Run with: {@code java -jar cleaner-app.jar --config=config/config.yaml}
 *
 * <p>Exit codes: 0 success, 1 cleanup or start-up failure, 2 configuration file not found.
 */
@SpringBootApplication
public class CleanerApplication {

  private static final Logger log = LoggerFactory.getLogger(CleanerApplication.class);

  static final int EXIT_FAILURE = 1;
  static final int EXIT_CONFIG_NOT_FOUND = 2;

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String... args) {
    ConfigLocation location;
    try {
      location = ConfigLocation.parse(args);
    } catch (IllegalArgumentException e) {
      log.error(e.getMessage());
      return EXIT_CONFIG_NOT_FOUND;
    }
    if (location.missing()) {
      log.error("Config file not found: {}", location.requestedPath());
      return EXIT_CONFIG_NOT_FOUND;
    }

    ConfigurableApplicationContext ctx;
    try {
      ctx = new SpringApplication(CleanerApplication.class).run(location.springArgs());
    } catch (RuntimeException e) {
      log.error("Cleaner failed to start: {}", e.getMessage());
      return EXIT_FAILURE;
    }
    return SpringApplication.exit(ctx);
  }
}
