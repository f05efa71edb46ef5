package io.syncqueue.worker;

/**
 * Thrown by a {@link QueueItemHandler} when retrying cannot help, for example
 * a malformed payload. The item is dead-lettered without spending its
 * remaining retries.
 */
public class NonRetryableException extends RuntimeException {

  public NonRetryableException(String message) {
    super(message);
  }

  public NonRetryableException(String message, Throwable cause) {
    super(message, cause);
  }
}
