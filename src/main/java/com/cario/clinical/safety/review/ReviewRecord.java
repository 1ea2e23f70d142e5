package com.cario.clinical.safety.review;

import com.cario.clinical.safety.model.ReviewStatus;
import com.cario.clinical.safety.pipeline.ValidatedDocument;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Immutable snapshot of one document's review state.
 *
 * <p>Every transition produces a new instance through {@link #toBuilder()}; {@link ReviewGate}
 * swaps snapshots atomically, so a reader never sees a half-applied transition (for example
 * {@code SIGNED} without a signer).
 */
@Value
@Builder(toBuilder = true)
public class ReviewRecord {

  @NonNull ValidatedDocument document;

  @NonNull ReviewStatus status;

  /** When the document entered the gate. */
  @NonNull Instant submittedAt;

  /** Set on {@code PENDING_REVIEW -> REVIEWED}. */
  String reviewerId;

  Instant reviewedAt;

  /** Set on {@code REVIEWED -> SIGNED}. */
  String signerId;

  Instant signedAt;

  @Singular("addendum")
  List<Addendum> addenda;

  public String getDocumentId() {
    return document.getDocumentId();
  }

  static ReviewRecord pending(ValidatedDocument document, Instant now) {
    return ReviewRecord.builder()
        .document(document)
        .status(document.getReviewStatus())
        .submittedAt(now)
        .build();
  }
}
