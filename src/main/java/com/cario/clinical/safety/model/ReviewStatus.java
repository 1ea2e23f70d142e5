package com.cario.clinical.safety.model;

/**
 * Review life cycle of a validated document. Moves strictly forward, one step at a time.
 *
 * <pre>
 *   PENDING_REVIEW -> REVIEWED -> SIGNED
 * </pre>
 */
public enum ReviewStatus {
  PENDING_REVIEW,
  REVIEWED,
  SIGNED;

  /** The only status reachable from this one, or {@code null} for {@link #SIGNED}. */
  public ReviewStatus next() {
    return switch (this) {
      case PENDING_REVIEW -> REVIEWED;
      case REVIEWED -> SIGNED;
      case SIGNED -> null;
    };
  }

  public boolean isTerminal() {
    return this == SIGNED;
  }
}
