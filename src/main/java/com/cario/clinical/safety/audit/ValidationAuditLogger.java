package com.cario.clinical.safety.audit;

import com.cario.clinical.safety.model.DocumentKind;
import com.cario.clinical.safety.model.Language;
import com.cario.clinical.safety.model.ReviewStatus;
import com.cario.clinical.safety.model.ValidationError;
import com.cario.clinical.safety.model.ValidationError.ForbiddenPhraseDetected;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Audit trail of validation outcomes and review transitions.
 *
 * <p>Writes key=value events to the {@code clinical.safety.audit} logger. This is the only place
 * a matched forbidden phrase is recorded; API responses in production never carry it.
 */
@Log4j2(topic = "clinical.safety.audit")
public class ValidationAuditLogger {

  // ---- Event names ----
  public static final String EVENT_ACCEPTED = "validation.accepted";
  public static final String EVENT_REJECTED = "validation.rejected";
  public static final String EVENT_TRANSITION = "review.transition";
  public static final String EVENT_REFUSED = "review.refused";
  public static final String EVENT_ADDENDUM = "review.addendum";
  public static final String EVENT_RELEASED = "review.released";

  // -------------------- VALIDATION --------------------

  public void recordAccepted(
      String requestId, String documentId, DocumentKind kind, Language language, long durationMs) {
    log.info(
        "{} req={} docId={} kind={} lang={} durationMs={}",
        EVENT_ACCEPTED,
        requestId,
        documentId,
        kind.getCode(),
        language.getCode(),
        durationMs);
  }

  public void recordRejected(
      String requestId,
      DocumentKind kind,
      Language language,
      ValidationError error,
      long durationMs) {
    Objects.requireNonNull(error, "error");
    String phrase = error instanceof ForbiddenPhraseDetected f ? f.matchedPhrase() : null;
    log.warn(
        "{} req={} kind={} lang={} type={} severity={} field={} phrase={} durationMs={} detail={}",
        EVENT_REJECTED,
        requestId,
        kind.getCode(),
        language.getCode(),
        error.type(),
        error.severity(),
        error.field(),
        phrase,
        durationMs,
        error.describe());
  }

  // -------------------- REVIEW --------------------

  public void recordTransition(
      String documentId, ReviewStatus from, ReviewStatus to, String actorId) {
    log.info(
        "{} docId={} from={} to={} actor={}", EVENT_TRANSITION, documentId, from, to, actorId);
  }

  public void recordRefused(String documentId, String action, String reason, String actorId) {
    log.warn(
        "{} docId={} action={} reason={} actor={}",
        EVENT_REFUSED,
        documentId,
        action,
        reason,
        actorId);
  }

  public void recordAddendum(
      String documentId, String addendumId, String authorId, String correctionOf) {
    log.info(
        "{} docId={} addendumId={} author={} correctionOf={}",
        EVENT_ADDENDUM,
        documentId,
        addendumId,
        authorId,
        correctionOf);
  }

  public void recordReleased(String documentId, int addenda) {
    log.info("{} docId={} addenda={}", EVENT_RELEASED, documentId, addenda);
  }
}
