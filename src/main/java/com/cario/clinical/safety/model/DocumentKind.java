package com.cario.clinical.safety.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kinds of AI-generated clinical artifacts the gate understands. */
public enum DocumentKind {
  /** Descriptive summary of a medical image. */
  IMAGING_FINDINGS("imaging_findings"),
  /** Transcription of values from a photographed laboratory report. */
  LAB_RESULTS("lab_results"),
  /** Structured SOAP note. */
  CLINICAL_NOTE("clinical_note");

  private final String code;

  DocumentKind(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }

  /**
   * Resolves a kind from its code (e.g. {@code lab_results}) or constant name.
   *
   * @throws IllegalArgumentException if the value names no known kind
   */
  @JsonCreator
  public static DocumentKind fromCode(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("kind must not be null/blank");
    }
    String v = value.trim();
    for (DocumentKind k : values()) {
      if (k.code.equalsIgnoreCase(v) || k.name().equalsIgnoreCase(v)) {
        return k;
      }
    }
    throw new IllegalArgumentException("Unsupported document kind: " + v);
  }
}
