package io.syncqueue.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Time-bounded ownership of a claimed queue item.
 *
 * @param workerId  the worker holding the claim
 * @param token     random token stamped by the claim that produced this lease
 * @param expiresAt instant after which the claim may be reclaimed
 */
public record Lease(String workerId, String token, Instant expiresAt) {

  public Lease {
    Objects.requireNonNull(workerId, "workerId");
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }
}
