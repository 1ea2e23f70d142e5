package com.cario.clinical.safety.pipeline;

import com.cario.clinical.safety.audit.ValidationAuditLogger;
import com.cario.clinical.safety.model.CandidateDocument;
import com.cario.clinical.safety.model.DocumentKind;
import com.cario.clinical.safety.model.Language;
import com.cario.clinical.safety.model.ValidationError;
import com.cario.clinical.safety.model.ValidationOutcome;
import com.cario.clinical.safety.schema.FreeTextFieldExtractor;
import com.cario.clinical.safety.schema.SchemaValidator;
import com.cario.clinical.safety.schema.StructuredPayload;
import com.cario.clinical.safety.schema.TextField;
import com.cario.clinical.safety.text.TextNormalizer;
import com.cario.clinical.safety.vocabulary.DisclaimerRegistry;
import com.cario.clinical.safety.vocabulary.ForbiddenPhraseIndex;
import com.cario.clinical.safety.vocabulary.MatchedPhrase;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.log4j.Log4j2;

/**
 * Single entry point for validating AI-generated clinical documents.
 *
 * <ol>
 *   <li>{@link SchemaValidator}: malformed or non-conforming structure fails first, before any
 *       text work
 *   <li>{@link DisclaimerRegistry}: the limitations statement must match exactly. A missing
 *       statement usually signals truncated output and is reported on its own
 *   <li>{@link TextNormalizer} + {@link ForbiddenPhraseIndex} over every free-text field the schema
 *       declares, first match wins
 *   <li>{@link ValidatedDocument} in {@code PENDING_REVIEW}
 * </ol>
 *
 * <p>Fail-fast: one error per document, no retries, no partial acceptance. Expected failures are
 * returned, never thrown. Instances hold only immutable tables and are safe to share between
 * threads.
 */
@Log4j2
public class ValidationPipeline {

  private final SchemaValidator schemaValidator;
  private final DisclaimerRegistry disclaimers;
  private final ForbiddenPhraseIndex phraseIndex;
  private final TextNormalizer normalizer;
  private final FreeTextFieldExtractor textFields;
  private final ValidationAuditLogger audit;
  private final Clock clock;

  public ValidationPipeline(
      SchemaValidator schemaValidator,
      DisclaimerRegistry disclaimers,
      ForbiddenPhraseIndex phraseIndex,
      TextNormalizer normalizer,
      ValidationAuditLogger audit) {
    this(schemaValidator, disclaimers, phraseIndex, normalizer, audit, Clock.systemUTC());
  }

  public ValidationPipeline(
      SchemaValidator schemaValidator,
      DisclaimerRegistry disclaimers,
      ForbiddenPhraseIndex phraseIndex,
      TextNormalizer normalizer,
      ValidationAuditLogger audit,
      Clock clock) {
    this.schemaValidator = Objects.requireNonNull(schemaValidator, "schemaValidator");
    this.disclaimers = Objects.requireNonNull(disclaimers, "disclaimers");
    this.phraseIndex = Objects.requireNonNull(phraseIndex, "phraseIndex");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.audit = Objects.requireNonNull(audit, "audit");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.textFields = new FreeTextFieldExtractor();
  }

  public ValidationOutcome<ValidatedDocument> validate(CandidateDocument doc) {
    Objects.requireNonNull(doc, "doc");

    String reqId = UUID.randomUUID().toString();
    long t0 = System.nanoTime();
    DocumentKind kind = doc.getKind();
    Language language = doc.getLanguage();

    log.debug("pipeline.start req={} kind={} lang={}", reqId, kind.getCode(), language.getCode());

    ValidationOutcome<ValidatedDocument> outcome;
    try {
      outcome = run(doc);
    } catch (RuntimeException e) {
      // a bug must not let a document through, nor escape to the caller as an exception
      log.error("pipeline.error req={} kind={} msg={}", reqId, kind.getCode(), e.getMessage(), e);
      outcome =
          ValidationOutcome.rejected(
              ValidationError.malformedInput("document could not be processed"));
    }

    long ms = (System.nanoTime() - t0) / 1_000_000;
    if (outcome.isAccepted()) {
      ValidatedDocument validated = outcome.orElseThrow();
      audit.recordAccepted(reqId, validated.getDocumentId(), kind, language, ms);
    } else {
      audit.recordRejected(reqId, kind, language, outcome.getError().orElseThrow(), ms);
    }
    return outcome;
  }

  private ValidationOutcome<ValidatedDocument> run(CandidateDocument doc) {
    DocumentKind kind = doc.getKind();
    Language language = doc.getLanguage();

    // 1) structure
    ValidationOutcome<StructuredPayload> structural =
        schemaValidator.validate(doc.getContent(), kind);
    if (structural.isRejected()) {
      return ValidationOutcome.rejected(structural.getError().orElseThrow());
    }
    StructuredPayload payload = structural.orElseThrow();

    // 2) disclaimer, exact match
    String disclaimerField = disclaimers.disclaimerField(kind);
    Optional<String> disclaimer = payload.text(disclaimerField);
    if (disclaimer.isEmpty() || !disclaimers.matches(disclaimer.get(), language, kind)) {
      return ValidationOutcome.rejected(
          ValidationError.missingOrMismatchedDisclaimer(disclaimerField));
    }

    // 3) forbidden phrases in every declared free-text field
    for (TextField field : textFields.extract(payload)) {
      Optional<MatchedPhrase> hit =
          phraseIndex.find(normalizer.normalize(field.getValue()), language, kind);
      if (hit.isPresent()) {
        return ValidationOutcome.rejected(
            ValidationError.forbiddenPhrase(field.getPath(), hit.get().getPhrase()));
      }
    }

    // 4) ready for review
    return ValidationOutcome.accepted(
        new ValidatedDocument(UUID.randomUUID().toString(), payload, language, clock.instant()));
  }
}
