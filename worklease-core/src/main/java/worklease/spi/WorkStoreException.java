package worklease.spi;

/**
 * Unchecked exception wrapping {@link java.sql.SQLException} and other persistence
 * failures raised by a {@link WorkStore}.
 */
public class WorkStoreException extends RuntimeException {

  public WorkStoreException(String message) {
    super(message);
  }

  public WorkStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
