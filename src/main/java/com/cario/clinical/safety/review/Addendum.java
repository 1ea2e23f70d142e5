package com.cario.clinical.safety.review;

import java.time.Instant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Clinician note attached to a signed document.
 *
 * <p>The signed payload is never edited. A correction is expressed as an addendum whose {@code
 * correctionOf} holds a JSON pointer (e.g. {@code /assessment/clinical_impression}) to the field
 * it amends; general comments leave it null.
 */
@Value
@Builder
public class Addendum {
  @NonNull String addendumId;
  @NonNull String documentId;
  @NonNull String authorId;
  @NonNull String text;
  String correctionOf;
  @NonNull Instant createdAt;

  public boolean isCorrection() {
    return correctionOf != null;
  }
}
