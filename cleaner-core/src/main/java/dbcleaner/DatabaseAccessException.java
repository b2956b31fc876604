package dbcleaner;

/**
 * Unchecked exception wrapping errors raised by a {@link dbcleaner.spi.MetadataDatabase}.
 */
public final class DatabaseAccessException extends RuntimeException {
  public DatabaseAccessException(String message, Throwable cause) {
    super(message, cause);
  }

  public DatabaseAccessException(String message) {
    super(message);
  }
}
