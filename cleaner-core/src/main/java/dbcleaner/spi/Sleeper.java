package dbcleaner.spi;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Pause between delete batches.
 */
@FunctionalInterface
public interface Sleeper {

  /**
   * Blocks the calling thread for the given wall-clock duration.
   */
  Sleeper SYSTEM = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

  void sleep(Duration duration) throws InterruptedException;
}
