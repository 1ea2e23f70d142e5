package com.cario.clinical.safety.model;

import java.util.Objects;
import lombok.Value;

/**
 * Raw model output awaiting validation, as handed over by the inference collaborator.
 *
 * <p>Never mutated; discarded after validation whatever the outcome.
 */
@Value
public class CandidateDocument {

  /** Raw text, expected to decode to a JSON object. May be null or malformed. */
  String content;

  /** Declared document kind. */
  DocumentKind kind;

  /** Declared language. */
  Language language;

  public CandidateDocument(String content, DocumentKind kind, Language language) {
    this.content = content;
    this.kind = Objects.requireNonNull(kind, "kind");
    this.language = Objects.requireNonNull(language, "language");
  }

  public static CandidateDocument of(String content, DocumentKind kind, Language language) {
    return new CandidateDocument(content, kind, language);
  }
}
