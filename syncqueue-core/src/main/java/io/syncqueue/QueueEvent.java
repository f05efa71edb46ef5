package io.syncqueue;

import io.syncqueue.model.Source;

import java.util.Objects;

/**
 * Change event handed to {@link SyncQueue#enqueue(QueueEvent)} by a producer
 * (webhook receiver or backfill scan).
 *
 * <p>The payload is opaque JSON text; the queue stores and returns it unchanged.
 *
 * <pre>{@code
 * QueueEvent event = QueueEvent.builder(Source.TEAMWORK, "task.created", "12345")
 *     .payloadJson("{\"id\":12345}")
 *     .maxRetries(5)
 *     .build();
 * }</pre>
 */
public final class QueueEvent {
  public static final int DEFAULT_MAX_RETRIES = 3;

  static final int MAX_EVENT_TYPE_LENGTH = 100;
  static final int MAX_EXTERNAL_ID_LENGTH = 255;

  private final Source source;
  private final String eventType;
  private final String externalId;
  private final String payloadJson;
  private final int maxRetries;

  private QueueEvent(Builder builder) {
    this.source = Objects.requireNonNull(builder.source, "source");
    this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
    this.externalId = Objects.requireNonNull(builder.externalId, "externalId");
    if (eventType.isEmpty() || eventType.length() > MAX_EVENT_TYPE_LENGTH) {
      throw new IllegalArgumentException(
          "eventType must be 1.." + MAX_EVENT_TYPE_LENGTH + " characters");
    }
    if (externalId.isEmpty() || externalId.length() > MAX_EXTERNAL_ID_LENGTH) {
      throw new IllegalArgumentException(
          "externalId must be 1.." + MAX_EXTERNAL_ID_LENGTH + " characters");
    }
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    this.payloadJson = builder.payloadJson;
    this.maxRetries = builder.maxRetries;
  }

  public static QueueEvent of(Source source, String eventType, String externalId, String payloadJson) {
    return builder(source, eventType, externalId).payloadJson(payloadJson).build();
  }

  public static Builder builder(Source source, String eventType, String externalId) {
    return new Builder(source, eventType, externalId);
  }

  public Source source() {
    return source;
  }

  public String eventType() {
    return eventType;
  }

  public String externalId() {
    return externalId;
  }

  /** Payload JSON, may be {@code null}. */
  public String payloadJson() {
    return payloadJson;
  }

  public int maxRetries() {
    return maxRetries;
  }

  @Override
  public String toString() {
    return "QueueEvent{source=" + source.dbValue() + ", eventType=" + eventType
        + ", externalId=" + externalId + ", maxRetries=" + maxRetries + "}";
  }

  public static final class Builder {
    private final Source source;
    private final String eventType;
    private final String externalId;
    private String payloadJson;
    private int maxRetries = DEFAULT_MAX_RETRIES;

    private Builder(Source source, String eventType, String externalId) {
      this.source = source;
      this.eventType = eventType;
      this.externalId = externalId;
    }

    public Builder payloadJson(String payloadJson) {
      this.payloadJson = payloadJson;
      return this;
    }

    /**
     * Sets how many retries the item gets before a failure dead-letters it.
     *
     * <p>Optional. Defaults to {@value QueueEvent#DEFAULT_MAX_RETRIES}. Must be &ge; 0.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public QueueEvent build() {
      return new QueueEvent(this);
    }
  }
}
