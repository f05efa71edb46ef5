package io.syncqueue;

/**
 * Unchecked exception wrapping failures of the backing store, typically a
 * {@link java.sql.SQLException}.
 */
public final class QueueStoreException extends RuntimeException {
  public QueueStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
