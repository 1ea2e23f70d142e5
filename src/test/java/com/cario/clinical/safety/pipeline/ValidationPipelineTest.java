package com.cario.clinical.safety.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cario.clinical.safety.SafetyFixtures;
import com.cario.clinical.safety.audit.ValidationAuditLogger;
import com.cario.clinical.safety.model.CandidateDocument;
import com.cario.clinical.safety.model.DocumentKind;
import com.cario.clinical.safety.model.Language;
import com.cario.clinical.safety.model.ReviewStatus;
import com.cario.clinical.safety.model.ValidationError;
import com.cario.clinical.safety.model.ValidationError.ForbiddenPhraseDetected;
import com.cario.clinical.safety.model.ValidationError.MissingOrMismatchedDisclaimer;
import com.cario.clinical.safety.model.ValidationError.SchemaViolation;
import com.cario.clinical.safety.model.ValidationOutcome;
import com.cario.clinical.safety.schema.SchemaValidator;
import com.cario.clinical.safety.vocabulary.ForbiddenPhraseIndex;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

class ValidationPipelineTest {

  private ValidationAuditLogger audit;
  private ValidationPipeline pipeline;

  @BeforeEach
  void setUp() {
    audit = mock(ValidationAuditLogger.class);
    pipeline = SafetyFixtures.pipeline(audit);
  }

  // -------------------- acceptance --------------------

  static Stream<Arguments> everyLanguageAndKind() {
    List<Arguments> args = new ArrayList<>();
    for (Language language : Language.values()) {
      for (DocumentKind kind : DocumentKind.values()) {
        args.add(Arguments.of(language, kind));
      }
    }
    return args.stream();
  }

  @ParameterizedTest(name = "{0} {1}")
  @MethodSource("everyLanguageAndKind")
  void cleanDocumentWithExactDisclaimerIsAccepted(Language language, DocumentKind kind) {
    ValidationOutcome<ValidatedDocument> outcome =
        pipeline.validate(candidate(SafetyFixtures.document(language, kind), kind, language));

    assertThat(outcome.getError()).isEmpty();
    ValidatedDocument doc = outcome.orElseThrow();
    assertThat(doc.getKind()).isEqualTo(kind);
    assertThat(doc.getLanguage()).isEqualTo(language);
    assertThat(doc.getReviewStatus()).isEqualTo(ReviewStatus.PENDING_REVIEW);
    assertThat(doc.getDocumentId()).isNotBlank();
    assertThat(doc.getValidatedAt()).isNotNull();
    assertThat(doc.getContent()).isEqualTo(SafetyFixtures.document(language, kind));

    verify(audit)
        .recordAccepted(anyString(), eq(doc.getDocumentId()), eq(kind), eq(language), anyLong());
  }

  @Test
  void documentIdsAreUnique() {
    CandidateDocument candidate =
        candidate(
            SafetyFixtures.imaging(Language.ENGLISH),
            DocumentKind.IMAGING_FINDINGS,
            Language.ENGLISH);

    String first = pipeline.validate(candidate).orElseThrow().getDocumentId();
    String second = pipeline.validate(candidate).orElseThrow().getDocumentId();

    assertThat(first).isNotEqualTo(second);
  }

  @Test
  void disclaimerIsNotScannedForPhrases() {
    // the English imaging disclaimer itself contains "diagnosis"
    assertThat(SafetyFixtures.disclaimer(Language.ENGLISH, DocumentKind.IMAGING_FINDINGS))
        .contains("diagnosis");

    assertThat(
            pipeline
                .validate(
                    candidate(
                        SafetyFixtures.imaging(Language.ENGLISH),
                        DocumentKind.IMAGING_FINDINGS,
                        Language.ENGLISH))
                .isAccepted())
        .isTrue();
  }

  // -------------------- forbidden phrases --------------------

  static Stream<Arguments> obfuscatedPhrases() {
    ForbiddenPhraseIndex index = SafetyFixtures.phraseIndex();
    List<Arguments> args = new ArrayList<>();
    for (Language language : Language.values()) {
      for (DocumentKind kind : DocumentKind.values()) {
        for (String phrase : index.phrases(language, kind)) {
          for (Obfuscation t : Obfuscation.values()) {
            args.add(Arguments.of(language, kind, phrase, t));
          }
        }
      }
    }
    return args.stream();
  }

  @ParameterizedTest(name = "{0} {1} {3} \"{2}\"")
  @MethodSource("obfuscatedPhrases")
  void obfuscatedPhraseIsRejectedInTheFieldItAppears(
      Language language, DocumentKind kind, String phrase, Obfuscation t) {
    ObjectNode doc = SafetyFixtures.document(language, kind);
    String field = injectionField(kind);
    put(doc, field, t.apply(phrase));

    ValidationError error = rejected(doc, kind, language);

    assertThat(error).isInstanceOf(ForbiddenPhraseDetected.class);
    assertThat(error.field()).isEqualTo(field);
    assertThat(error.severity()).isEqualTo(ValidationError.Severity.CRITICAL);
  }

  @Test
  void imagingObservationWithPunctuatedDiseaseNameIsRejected() {
    ObjectNode doc = SafetyFixtures.imaging(Language.ENGLISH);
    ((ObjectNode) doc.get("anatomical_observations"))
        .putArray("lungs")
        .add("findings consistent with p.neumon.ia");

    ValidationError error = rejected(doc, DocumentKind.IMAGING_FINDINGS, Language.ENGLISH);

    assertThat(error)
        .isEqualTo(
            ValidationError.forbiddenPhrase("anatomical_observations.lungs[0]", "pneumonia"));
  }

  @Test
  void diseaseNameSplitAcrossObservationsIsRejectedUnderTheListPath() {
    ObjectNode doc = SafetyFixtures.imaging(Language.ENGLISH);
    ((ObjectNode) doc.get("anatomical_observations"))
        .putArray("lungs")
        .add("right lower zone pneu")
        .add("monia");

    ValidationError error = rejected(doc, DocumentKind.IMAGING_FINDINGS, Language.ENGLISH);

    assertThat(error)
        .isEqualTo(ValidationError.forbiddenPhrase("anatomical_observations.lungs", "pneumonia"));
  }

  @Test
  void phraseSplitAcrossNoteListElementsIsRejectedUnderTheListPath() {
    ObjectNode doc = SafetyFixtures.note(Language.ENGLISH);
    ((ObjectNode) doc.get("objective")).putArray("diagnostic_results").add("fract").add("ure seen");

    ValidationError error = rejected(doc, DocumentKind.CLINICAL_NOTE, Language.ENGLISH);

    assertThat(error)
        .isEqualTo(ValidationError.forbiddenPhrase("objective.diagnostic_results", "fracture"));
  }

  @Test
  void wholePhraseInOneElementIsReportedAtThatElement() {
    ObjectNode doc = SafetyFixtures.imaging(Language.ENGLISH);
    ((ObjectNode) doc.get("anatomical_observations"))
        .putArray("lungs")
        .add("lung fields are visible")
        .add("appearance of pneumonia");

    ValidationError error = rejected(doc, DocumentKind.IMAGING_FINDINGS, Language.ENGLISH);

    assertThat(error)
        .isEqualTo(
            ValidationError.forbiddenPhrase("anatomical_observations.lungs[1]", "pneumonia"));
  }

  @Test
  void firstOffendingFieldInSchemaOrderIsReported() {
    ObjectNode doc = SafetyFixtures.note(Language.ENGLISH);
    ((ObjectNode) doc.get("plan")).putArray("interventions").add("Treat with antibiotics");
    ((ObjectNode) doc.get("subjective")).put("history_of_present_illness", "Known diabetes");

    ValidationError error = rejected(doc, DocumentKind.CLINICAL_NOTE, Language.ENGLISH);

    assertThat(error)
        .isEqualTo(
            ValidationError.forbiddenPhrase("subjective.history_of_present_illness", "diabetes"));
  }

  @Test
  void textualLabValueIsScanned() {
    ObjectNode doc = SafetyFixtures.lab(Language.ENGLISH);
    ((ObjectNode) doc.at("/test_categories/0/tests/0")).put("value", "13.8 (abnormal)");

    ValidationError error = rejected(doc, DocumentKind.LAB_RESULTS, Language.ENGLISH);

    assertThat(error)
        .isEqualTo(
            ValidationError.forbiddenPhrase("test_categories[0].tests[0].value", "abnormal"));
  }

  @Test
  void identifierFieldsAreScannedToo() {
    ObjectNode doc = SafetyFixtures.note(Language.ENGLISH);
    doc.put("patient_identifier", "sepsis-bed-4");

    ValidationError error = rejected(doc, DocumentKind.CLINICAL_NOTE, Language.ENGLISH);

    assertThat(error).isEqualTo(ValidationError.forbiddenPhrase("patient_identifier", "sepsis"));
  }

  @Test
  void phrasesAreCheckedAgainstTheDocumentLanguage() {
    ObjectNode doc = SafetyFixtures.note(Language.SPANISH);
    ((ObjectNode) doc.get("assessment")).put("clinical_impression", "Neumonía  basal derecha");

    ValidationError error = rejected(doc, DocumentKind.CLINICAL_NOTE, Language.SPANISH);

    assertThat(error)
        .isEqualTo(ValidationError.forbiddenPhrase("assessment.clinical_impression", "neumonía"));
  }

  // -------------------- disclaimer --------------------

  @ParameterizedTest
  @EnumSource(DocumentKind.class)
  void disclaimerWithExtraTrailingPeriodIsRejected(DocumentKind kind) {
    ObjectNode doc = SafetyFixtures.document(Language.ENGLISH, kind);
    doc.put("limitations", SafetyFixtures.disclaimer(Language.ENGLISH, kind) + ".");

    assertThat(rejected(doc, kind, Language.ENGLISH))
        .isEqualTo(ValidationError.missingOrMismatchedDisclaimer("limitations"));
  }

  @ParameterizedTest
  @EnumSource(DocumentKind.class)
  void translatedDisclaimerIsRejected(DocumentKind kind) {
    ObjectNode doc = SafetyFixtures.document(Language.PORTUGUESE, kind);
    doc.put("limitations", SafetyFixtures.disclaimer(Language.SPANISH, kind));

    assertThat(rejected(doc, kind, Language.PORTUGUESE))
        .isInstanceOf(MissingOrMismatchedDisclaimer.class);
  }

  @Test
  void paraphrasedDisclaimerIsRejected() {
    ObjectNode doc = SafetyFixtures.imaging(Language.ENGLISH);
    doc.put(
        "limitations",
        "This summary only describes visible image features and does not provide a diagnosis.");

    assertThat(rejected(doc, DocumentKind.IMAGING_FINDINGS, Language.ENGLISH))
        .isInstanceOf(MissingOrMismatchedDisclaimer.class);
  }

  @Test
  void disclaimerSurroundedByWhitespaceIsAccepted() {
    ObjectNode doc = SafetyFixtures.lab(Language.FRENCH);
    doc.put(
        "limitations",
        "\n  " + SafetyFixtures.disclaimer(Language.FRENCH, DocumentKind.LAB_RESULTS) + "  ");

    ValidationOutcome<ValidatedDocument> outcome =
        pipeline.validate(candidate(doc, DocumentKind.LAB_RESULTS, Language.FRENCH));

    assertThat(outcome.isAccepted()).isTrue();
  }

  @Test
  void nonTextDisclaimerIsRejected() {
    ObjectNode doc = SafetyFixtures.note(Language.ENGLISH);
    doc.put("limitations", 1);

    assertThat(rejected(doc, DocumentKind.CLINICAL_NOTE, Language.ENGLISH))
        .isInstanceOf(MissingOrMismatchedDisclaimer.class);
  }

  // -------------------- ordering --------------------

  @Test
  void missingLabDisclaimerIsReportedBeforeAnyPhraseScan() {
    ObjectNode doc = SafetyFixtures.lab(Language.ENGLISH);
    doc.remove("limitations");
    doc.put("notes", "Clinically significant, abnormal values");

    assertThat(rejected(doc, DocumentKind.LAB_RESULTS, Language.ENGLISH))
        .isEqualTo(ValidationError.missingOrMismatchedDisclaimer("limitations"));
  }

  @Test
  void unknownKeyInOtherwiseValidNoteIsASchemaViolation() {
    ObjectNode doc = SafetyFixtures.note(Language.ENGLISH);
    doc.put("diagnosis_hint", "see notes");

    ValidationError error = rejected(doc, DocumentKind.CLINICAL_NOTE, Language.ENGLISH);

    assertThat(error).isInstanceOf(SchemaViolation.class);
    assertThat(error.field()).isEqualTo("diagnosis_hint");
  }

  @ParameterizedTest
  @EnumSource(DocumentKind.class)
  void anyKeyOutsideTheSchemaIsRejected(DocumentKind kind) {
    ObjectNode doc = SafetyFixtures.document(Language.FRENCH, kind);
    doc.put("confidence", "high");

    ValidationError error = rejected(doc, kind, Language.FRENCH);

    assertThat(error).isInstanceOf(SchemaViolation.class);
    assertThat(error.field()).isEqualTo("confidence");
  }

  @Test
  void schemaViolationWinsOverDisclaimerAndPhrases() {
    ObjectNode doc = SafetyFixtures.imaging(Language.ENGLISH);
    doc.remove("limitations");
    doc.put("areas_highlighted", "pneumonia");
    doc.put("impression", "pneumonia");

    assertThat(rejected(doc, DocumentKind.IMAGING_FINDINGS, Language.ENGLISH))
        .isInstanceOf(SchemaViolation.class);
  }

  @Test
  void malformedJsonIsRejected() {
    CandidateDocument candidate =
        CandidateDocument.of("{\"image_type\": ", DocumentKind.IMAGING_FINDINGS, Language.ENGLISH);

    ValidationOutcome<ValidatedDocument> outcome = pipeline.validate(candidate);

    assertThat(outcome.getError())
        .hasValueSatisfying(
            e -> assertThat(e.type()).isEqualTo(ValidationError.Type.MALFORMED_INPUT));
  }

  // -------------------- faults and audit --------------------

  @Test
  void unexpectedFaultIsReturnedAsMalformedInput() {
    SchemaValidator broken = mock(SchemaValidator.class);
    when(broken.validate(anyString(), any())).thenThrow(new IllegalStateException("boom"));
    ValidationPipeline faulty =
        new ValidationPipeline(
            broken,
            SafetyFixtures.disclaimers(),
            SafetyFixtures.phraseIndex(),
            SafetyFixtures.normalizer(),
            audit);

    ValidationOutcome<ValidatedDocument> outcome =
        faulty.validate(
            CandidateDocument.of("{}", DocumentKind.CLINICAL_NOTE, Language.ENGLISH));

    assertThat(outcome.isRejected()).isTrue();
    assertThat(outcome.getError().orElseThrow().type())
        .isEqualTo(ValidationError.Type.MALFORMED_INPUT);
  }

  @Test
  void rejectionIsAuditedWithTheFullError() {
    ObjectNode doc = SafetyFixtures.imaging(Language.ENGLISH);
    doc.put("areas_highlighted", "Suspicious for a mass");

    ValidationError error = rejected(doc, DocumentKind.IMAGING_FINDINGS, Language.ENGLISH);

    verify(audit)
        .recordRejected(
            anyString(),
            eq(DocumentKind.IMAGING_FINDINGS),
            eq(Language.ENGLISH),
            eq(error),
            anyLong());
    verify(audit, never()).recordAccepted(any(), any(), any(), any(), anyLong());
  }

  @Test
  void concurrentCallersGetIndependentOutcomes() throws Exception {
    ValidationPipeline shared = SafetyFixtures.pipeline();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    Set<String> ids = ConcurrentHashMap.newKeySet();
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        boolean clean = i % 2 == 0;
        results.add(
            pool.submit(
                () -> {
                  ObjectNode doc = SafetyFixtures.imaging(Language.ENGLISH);
                  if (!clean) {
                    doc.put("areas_highlighted", "rule out fracture");
                  }
                  ValidationOutcome<ValidatedDocument> outcome =
                      shared.validate(
                          candidate(doc, DocumentKind.IMAGING_FINDINGS, Language.ENGLISH));
                  outcome.getValue().ifPresent(v -> ids.add(v.getDocumentId()));
                  return outcome.isAccepted() == clean;
                }));
      }
      for (Future<Boolean> r : results) {
        assertThat(r.get()).isTrue();
      }
    } finally {
      pool.shutdownNow();
    }
    assertThat(ids).hasSize(100);
  }

  // -------------------- helpers --------------------

  enum Obfuscation {
    SPACES(p -> interleave(p, " ")),
    PERIODS(p -> interleave(p, ".")),
    UPPERCASE(p -> p.toUpperCase(Locale.ROOT)),
    SYMBOL_MID_PHRASE(p -> p.substring(0, p.length() / 2) + "#" + p.substring(p.length() / 2));

    private final UnaryOperator<String> transform;

    Obfuscation(UnaryOperator<String> transform) {
      this.transform = transform;
    }

    String apply(String phrase) {
      return transform.apply(phrase);
    }

    private static String interleave(String phrase, String separator) {
      StringBuilder sb = new StringBuilder();
      phrase
          .codePoints()
          .forEach(
              cp -> {
                if (sb.length() > 0) {
                  sb.append(separator);
                }
                sb.appendCodePoint(cp);
              });
      return sb.toString();
    }
  }

  private static String injectionField(DocumentKind kind) {
    return switch (kind) {
      case IMAGING_FINDINGS -> "areas_highlighted";
      case LAB_RESULTS -> "notes";
      case CLINICAL_NOTE -> "assessment.clinical_impression";
    };
  }

  private static void put(ObjectNode doc, String dottedPath, String value) {
    String[] parts = dottedPath.split("\\.");
    ObjectNode target = doc;
    for (int i = 0; i < parts.length - 1; i++) {
      target = (ObjectNode) target.get(parts[i]);
    }
    target.put(parts[parts.length - 1], value);
  }

  private static CandidateDocument candidate(
      ObjectNode doc, DocumentKind kind, Language language) {
    return CandidateDocument.of(doc.toString(), kind, language);
  }

  private ValidationError rejected(ObjectNode doc, DocumentKind kind, Language language) {
    ValidationOutcome<ValidatedDocument> outcome =
        pipeline.validate(candidate(doc, kind, language));
    assertThat(outcome.isRejected()).as("expected rejection of %s", doc).isTrue();
    return outcome.getError().orElseThrow();
  }
}
