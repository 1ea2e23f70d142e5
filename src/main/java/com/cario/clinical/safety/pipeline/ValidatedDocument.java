package com.cario.clinical.safety.pipeline;

import com.cario.clinical.safety.model.DocumentKind;
import com.cario.clinical.safety.model.Language;
import com.cario.clinical.safety.model.ReviewStatus;
import com.cario.clinical.safety.schema.StructuredPayload;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Objects;

/**
 * A document that passed every safety check and now awaits clinician review.
 *
 * <p>The constructor is package-private: {@link ValidationPipeline} is the only producer, so
 * holding an instance proves the content went through schema, disclaimer and phrase checks.
 */
public final class ValidatedDocument {

  private final String documentId;
  private final StructuredPayload payload;
  private final Language language;
  private final Instant validatedAt;

  ValidatedDocument(
      String documentId, StructuredPayload payload, Language language, Instant validatedAt) {
    this.documentId = Objects.requireNonNull(documentId, "documentId");
    this.payload = Objects.requireNonNull(payload, "payload");
    this.language = Objects.requireNonNull(language, "language");
    this.validatedAt = Objects.requireNonNull(validatedAt, "validatedAt");
  }

  public String getDocumentId() {
    return documentId;
  }

  public DocumentKind getKind() {
    return payload.getKind();
  }

  public Language getLanguage() {
    return language;
  }

  public StructuredPayload getPayload() {
    return payload;
  }

  /** Copy of the schema-conformant JSON. */
  public ObjectNode getContent() {
    return payload.toJson();
  }

  public Instant getValidatedAt() {
    return validatedAt;
  }

  /** Status on leaving the pipeline; progress afterwards is tracked by the review gate. */
  public ReviewStatus getReviewStatus() {
    return ReviewStatus.PENDING_REVIEW;
  }

  @Override
  public String toString() {
    return "ValidatedDocument{id="
        + documentId
        + ", kind="
        + getKind().getCode()
        + ", lang="
        + language.getCode()
        + "}";
  }
}
