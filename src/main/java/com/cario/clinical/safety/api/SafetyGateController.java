package com.cario.clinical.safety.api;

import com.cario.clinical.safety.model.CandidateDocument;
import com.cario.clinical.safety.model.DocumentKind;
import com.cario.clinical.safety.model.Language;
import com.cario.clinical.safety.model.ReviewStatus;
import com.cario.clinical.safety.model.ValidationOutcome;
import com.cario.clinical.safety.pipeline.ValidatedDocument;
import com.cario.clinical.safety.pipeline.ValidationPipeline;
import com.cario.clinical.safety.review.Addendum;
import com.cario.clinical.safety.review.ReviewGate;
import com.cario.clinical.safety.review.ReviewRecord;
import com.cario.clinical.safety.vocabulary.DisclaimerRegistry;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Log4j2
@Validated
@RestController
@RequestMapping("/safety")
@RequiredArgsConstructor
public class SafetyGateController {

  private final ValidationPipeline validationPipeline;
  private final ReviewGate reviewGate;
  private final DisclaimerRegistry disclaimerRegistry;
  private final ValidationErrorPresenter presenter;

  // ------------------------------------------------------------
  // /safety/validate
  // ------------------------------------------------------------
  @PostMapping(
      path = "/validate",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<?> validate(@RequestBody @Validated ValidateRequest req) {
    DocumentKind kind = DocumentKind.fromCode(req.getKind());
    Language language = Language.fromCode(req.getLanguage());
    log.info("safety.validate kind={} lang={}", kind.getCode(), language.getCode());

    ValidationOutcome<ValidatedDocument> outcome =
        validationPipeline.validate(CandidateDocument.of(req.getContent(), kind, language));

    if (outcome.isRejected()) {
      ErrorResponse body = presenter.present(outcome.getError().orElseThrow());
      return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    ValidatedDocument doc = outcome.orElseThrow();
    ReviewRecord record = reviewGate.submit(doc);
    return ResponseEntity.ok(
        ValidateResponse.builder()
            .documentId(doc.getDocumentId())
            .kind(doc.getKind())
            .language(doc.getLanguage())
            .reviewStatus(record.getStatus())
            .validatedAt(doc.getValidatedAt())
            .build());
  }

  // ------------------------------------------------------------
  // /safety/documents/{documentId}
  // ------------------------------------------------------------
  @GetMapping(path = "/documents/{documentId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ReviewRecordView> getDocument(
      @PathVariable("documentId") String documentId) {
    return reviewGate
        .find(documentId)
        .map(ReviewRecordView::of)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PostMapping(
      path = "/documents/{documentId}/acknowledge",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ReviewRecordView> acknowledge(
      @PathVariable("documentId") String documentId,
      @RequestBody @Validated AcknowledgeRequest req) {
    log.info("safety.acknowledge docId={} reviewer={}", documentId, req.getReviewerId());
    return ResponseEntity.ok(
        ReviewRecordView.of(reviewGate.acknowledge(documentId, req.getReviewerId())));
  }

  @PostMapping(
      path = "/documents/{documentId}/sign",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ReviewRecordView> sign(
      @PathVariable("documentId") String documentId, @RequestBody @Validated SignRequest req) {
    log.info("safety.sign docId={} signer={}", documentId, req.getSignerId());
    return ResponseEntity.ok(ReviewRecordView.of(reviewGate.sign(documentId, req.getSignerId())));
  }

  @PostMapping(
      path = "/documents/{documentId}/addenda",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Addendum> addAddendum(
      @PathVariable("documentId") String documentId, @RequestBody @Validated AddendumRequest req) {
    log.info("safety.addendum docId={} author={}", documentId, req.getAuthorId());
    Addendum addendum =
        reviewGate.addAddendum(
            documentId, req.getAuthorId(), req.getText(), req.getCorrectionOf());
    return ResponseEntity.status(HttpStatus.CREATED).body(addendum);
  }

  @DeleteMapping(path = "/documents/{documentId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ReviewRecordView> release(@PathVariable("documentId") String documentId) {
    log.info("safety.release docId={}", documentId);
    return ResponseEntity.ok(ReviewRecordView.of(reviewGate.release(documentId)));
  }

  // ------------------------------------------------------------
  // /safety/disclaimers/{language}/{kind}
  // ------------------------------------------------------------
  @GetMapping(path = "/disclaimers/{language}/{kind}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<DisclaimerView> getDisclaimer(
      @PathVariable("language") String language, @PathVariable("kind") String kind) {
    Language lang = Language.fromCode(language);
    DocumentKind docKind = DocumentKind.fromCode(kind);
    return ResponseEntity.ok(
        new DisclaimerView(
            lang,
            docKind,
            disclaimerRegistry.disclaimerField(docKind),
            disclaimerRegistry.requiredDisclaimer(lang, docKind)));
  }

  // ============================================================
  // DTOs
  // ============================================================
  @Data
  public static class ValidateRequest {
    /** Raw model output. May be empty; the pipeline reports it as malformed. */
    @NotNull private String content;

    @NotBlank private String kind;
    @NotBlank private String language;
  }

  @Data
  public static class AcknowledgeRequest {
    @NotBlank private String reviewerId;
  }

  @Data
  public static class SignRequest {
    @NotBlank private String signerId;
  }

  @Data
  public static class AddendumRequest {
    @NotBlank private String authorId;
    @NotBlank private String text;
    private String correctionOf;
  }

  @Value
  @Builder
  public static class ValidateResponse {
    String documentId;
    DocumentKind kind;
    Language language;
    ReviewStatus reviewStatus;
    Instant validatedAt;
  }

  @Value
  public static class DisclaimerView {
    Language language;
    DocumentKind kind;
    String field;
    String text;
  }

  @Value
  @Builder
  public static class ReviewRecordView {
    String documentId;
    DocumentKind kind;
    Language language;
    ReviewStatus status;
    Instant validatedAt;
    Instant submittedAt;
    String reviewerId;
    Instant reviewedAt;
    String signerId;
    Instant signedAt;
    ObjectNode content;
    List<Addendum> addenda;

    static ReviewRecordView of(ReviewRecord record) {
      ValidatedDocument doc = record.getDocument();
      return ReviewRecordView.builder()
          .documentId(doc.getDocumentId())
          .kind(doc.getKind())
          .language(doc.getLanguage())
          .status(record.getStatus())
          .validatedAt(doc.getValidatedAt())
          .submittedAt(record.getSubmittedAt())
          .reviewerId(record.getReviewerId())
          .reviewedAt(record.getReviewedAt())
          .signerId(record.getSignerId())
          .signedAt(record.getSignedAt())
          .content(doc.getContent())
          .addenda(record.getAddenda())
          .build();
    }
  }
}
