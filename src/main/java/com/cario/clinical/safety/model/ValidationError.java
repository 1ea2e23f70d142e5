package com.cario.clinical.safety.model;

import java.util.Objects;

/**
 * Reason a candidate document was rejected. Exactly one variant is produced per failed document;
 * validation stops at the first failure.
 *
 * <p>The detailed variants (field names, matched phrases) are meant for audit logs and development
 * builds. Production clients collapse every variant into one generic message so the forbidden
 * vocabulary is never echoed back to end users.
 */
public sealed interface ValidationError
    permits ValidationError.MalformedInput,
        ValidationError.SchemaViolation,
        ValidationError.MissingOrMismatchedDisclaimer,
        ValidationError.ForbiddenPhraseDetected {

  /** Stable discriminator, used for logging and API payloads. */
  enum Type {
    MALFORMED_INPUT,
    SCHEMA_VIOLATION,
    MISSING_OR_MISMATCHED_DISCLAIMER,
    FORBIDDEN_PHRASE_DETECTED
  }

  enum Severity {
    WARNING,
    ERROR,
    CRITICAL
  }

  Type type();

  Severity severity();

  /** Field path the failure refers to, or {@code null} when it concerns the whole document. */
  String field();

  /** Developer-facing description. May contain the matched phrase. */
  String describe();

  static ValidationError malformedInput(String detail) {
    return new MalformedInput(detail);
  }

  static ValidationError schemaViolation(String field, String reason) {
    return new SchemaViolation(field, reason);
  }

  static ValidationError missingOrMismatchedDisclaimer(String field) {
    return new MissingOrMismatchedDisclaimer(field);
  }

  static ValidationError forbiddenPhrase(String field, String matchedPhrase) {
    return new ForbiddenPhraseDetected(field, matchedPhrase);
  }

  /** Raw text could not be decoded into a JSON object. */
  record MalformedInput(String detail) implements ValidationError {
    public MalformedInput {
      detail = detail == null ? "input is not a JSON object" : detail;
    }

    @Override
    public Type type() {
      return Type.MALFORMED_INPUT;
    }

    @Override
    public Severity severity() {
      return Severity.ERROR;
    }

    @Override
    public String field() {
      return null;
    }

    @Override
    public String describe() {
      return "Output does not contain valid JSON: " + detail;
    }
  }

  /** Structure does not conform to the closed schema of the declared kind. */
  record SchemaViolation(String field, String reason) implements ValidationError {
    public SchemaViolation {
      Objects.requireNonNull(field, "field");
      Objects.requireNonNull(reason, "reason");
    }

    @Override
    public Type type() {
      return Type.SCHEMA_VIOLATION;
    }

    @Override
    public Severity severity() {
      return Severity.ERROR;
    }

    @Override
    public String describe() {
      return "Schema violation at '" + field + "': " + reason;
    }
  }

  /** Mandatory disclaimer absent or not an exact match for the declared language. */
  record MissingOrMismatchedDisclaimer(String field) implements ValidationError {
    @Override
    public Type type() {
      return Type.MISSING_OR_MISMATCHED_DISCLAIMER;
    }

    @Override
    public Severity severity() {
      return Severity.ERROR;
    }

    @Override
    public String describe() {
      return "Required limitations statement is missing or incorrect in '" + field + "'";
    }
  }

  /** A free-text field contains a phrase forbidden for the document's kind and language. */
  record ForbiddenPhraseDetected(String field, String matchedPhrase) implements ValidationError {
    public ForbiddenPhraseDetected {
      Objects.requireNonNull(field, "field");
      Objects.requireNonNull(matchedPhrase, "matchedPhrase");
    }

    @Override
    public Type type() {
      return Type.FORBIDDEN_PHRASE_DETECTED;
    }

    @Override
    public Severity severity() {
      return Severity.CRITICAL;
    }

    @Override
    public String describe() {
      return "Forbidden phrase '" + matchedPhrase + "' found in " + field;
    }
  }
}
