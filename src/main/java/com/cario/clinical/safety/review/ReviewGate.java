package com.cario.clinical.safety.review;

import com.cario.clinical.safety.audit.ValidationAuditLogger;
import com.cario.clinical.safety.model.ReviewStatus;
import com.cario.clinical.safety.pipeline.ValidatedDocument;
import com.cario.clinical.safety.review.ReviewTransitionException.Reason;
import com.fasterxml.jackson.core.JsonPointer;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import lombok.extern.log4j.Log4j2;

/**
 * Tracks validated documents from {@code PENDING_REVIEW} through {@code REVIEWED} to {@code
 * SIGNED}.
 *
 * <p>Transitions only move forward and each happens at most once. Every document holds its
 * current {@link ReviewRecord} in its own {@link AtomicReference}; a transition computes the next
 * snapshot and installs it with compare-and-set, retrying on contention. Two clinicians
 * acknowledging the same document concurrently therefore get exactly one success, and
 * operations on different documents never block each other.
 *
 * <p>Storage is in memory and a record stays until {@link #release(String)} hands the signed
 * document off to long-term storage. Callers that never release keep every document for the life
 * of the process. A released slot holds {@code null} until it is removed, so any operation that
 * raced the hand-off sees the document as unknown instead of writing to a detached record.
 */
@Log4j2
public class ReviewGate {

  private final ConcurrentMap<String, AtomicReference<ReviewRecord>> records =
      new ConcurrentHashMap<>();
  private final ValidationAuditLogger audit;
  private final Clock clock;

  public ReviewGate(ValidationAuditLogger audit) {
    this(audit, Clock.systemUTC());
  }

  public ReviewGate(ValidationAuditLogger audit, Clock clock) {
    this.audit = Objects.requireNonNull(audit, "audit");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  // -------------------- REGISTRATION --------------------

  public ReviewRecord submit(ValidatedDocument document) {
    Objects.requireNonNull(document, "document");
    String docId = document.getDocumentId();
    ReviewRecord pending = ReviewRecord.pending(document, clock.instant());

    if (records.putIfAbsent(docId, new AtomicReference<>(pending)) != null) {
      throw refuse(docId, "submit", Reason.DUPLICATE_DOCUMENT, null);
    }
    audit.recordTransition(docId, null, pending.getStatus(), null);
    return pending;
  }

  // -------------------- TRANSITIONS --------------------

  public ReviewRecord acknowledge(String documentId, String reviewerId) {
    validateId(reviewerId, "reviewerId");
    ReviewRecord next =
        update(
            documentId,
            "acknowledge",
            reviewerId,
            current ->
                switch (current.getStatus()) {
                  case PENDING_REVIEW -> current.toBuilder()
                      .status(current.getStatus().next())
                      .reviewerId(reviewerId)
                      .reviewedAt(clock.instant())
                      .build();
                  case REVIEWED -> throw new ReviewTransitionException(
                      documentId, Reason.ALREADY_REVIEWED);
                  case SIGNED -> throw new ReviewTransitionException(
                      documentId, Reason.ALREADY_SIGNED);
                });
    audit.recordTransition(
        documentId, ReviewStatus.PENDING_REVIEW, ReviewStatus.REVIEWED, reviewerId);
    return next;
  }

  public ReviewRecord sign(String documentId, String signerId) {
    validateId(signerId, "signerId");
    ReviewRecord next =
        update(
            documentId,
            "sign",
            signerId,
            current ->
                switch (current.getStatus()) {
                  case PENDING_REVIEW -> throw new ReviewTransitionException(
                      documentId, Reason.NOT_REVIEWED);
                  case REVIEWED -> current.toBuilder()
                      .status(current.getStatus().next())
                      .signerId(signerId)
                      .signedAt(clock.instant())
                      .build();
                  case SIGNED -> throw new ReviewTransitionException(
                      documentId, Reason.ALREADY_SIGNED);
                });
    audit.recordTransition(documentId, ReviewStatus.REVIEWED, ReviewStatus.SIGNED, signerId);
    return next;
  }

  /**
   * Attaches an addendum to a signed document.
   *
   * @param correctionOf JSON pointer to the amended field, or null for a general comment
   * @throws IllegalArgumentException if the pointer is malformed or names no field of the payload
   */
  public Addendum addAddendum(
      String documentId, String authorId, String text, String correctionOf) {
    validateId(authorId, "authorId");
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Addendum text must not be blank");
    }
    String pointer = correctionOf == null || correctionOf.isBlank() ? null : correctionOf.strip();

    Addendum[] added = new Addendum[1];
    update(
        documentId,
        "addendum",
        authorId,
        current -> {
          if (current.getStatus() != ReviewStatus.SIGNED) {
            throw new ReviewTransitionException(documentId, Reason.NOT_SIGNED);
          }
          if (pointer != null) {
            requireField(current, pointer);
          }
          added[0] =
              Addendum.builder()
                  .addendumId(UUID.randomUUID().toString())
                  .documentId(documentId)
                  .authorId(authorId)
                  .text(text.strip())
                  .correctionOf(pointer)
                  .createdAt(clock.instant())
                  .build();
          return current.toBuilder().addendum(added[0]).build();
        });
    audit.recordAddendum(documentId, added[0].getAddendumId(), authorId, pointer);
    return added[0];
  }

  /**
   * Removes a signed document from the gate and returns its final record, addenda included.
   *
   * @throws ReviewTransitionException {@code NOT_SIGNED} before signature, {@code
   *     UNKNOWN_DOCUMENT} if absent or already released
   */
  public ReviewRecord release(String documentId) {
    AtomicReference<ReviewRecord> ref = documentId == null ? null : records.get(documentId);
    if (ref == null) {
      throw refuse(documentId, "release", Reason.UNKNOWN_DOCUMENT, null);
    }
    while (true) {
      ReviewRecord current = ref.get();
      if (current == null) {
        throw refuse(documentId, "release", Reason.UNKNOWN_DOCUMENT, null);
      }
      if (current.getStatus() != ReviewStatus.SIGNED) {
        throw refuse(documentId, "release", Reason.NOT_SIGNED, null);
      }
      if (ref.compareAndSet(current, null)) {
        records.remove(documentId, ref);
        audit.recordReleased(documentId, current.getAddenda().size());
        return current;
      }
      log.debug("review.retry docId={} action=release", documentId);
    }
  }

  // -------------------- QUERIES --------------------

  public Optional<ReviewRecord> find(String documentId) {
    if (documentId == null) {
      return Optional.empty();
    }
    AtomicReference<ReviewRecord> ref = records.get(documentId);
    return ref == null ? Optional.empty() : Optional.ofNullable(ref.get());
  }

  public ReviewStatus status(String documentId) {
    return find(documentId)
        .map(ReviewRecord::getStatus)
        .orElseThrow(() -> new ReviewTransitionException(documentId, Reason.UNKNOWN_DOCUMENT));
  }

  public int size() {
    return records.size();
  }

  // -------------------- INTERNALS --------------------

  private ReviewRecord update(
      String documentId, String action, String actorId, UnaryOperator<ReviewRecord> step) {
    AtomicReference<ReviewRecord> ref = documentId == null ? null : records.get(documentId);
    if (ref == null) {
      throw refuse(documentId, action, Reason.UNKNOWN_DOCUMENT, actorId);
    }
    while (true) {
      ReviewRecord current = ref.get();
      if (current == null) {
        throw refuse(documentId, action, Reason.UNKNOWN_DOCUMENT, actorId);
      }
      ReviewRecord next;
      try {
        next = step.apply(current);
      } catch (ReviewTransitionException e) {
        audit.recordRefused(documentId, action, e.getReason().name(), actorId);
        throw e;
      }
      if (ref.compareAndSet(current, next)) {
        return next;
      }
      log.debug("review.retry docId={} action={}", documentId, action);
    }
  }

  private ReviewTransitionException refuse(
      String documentId, String action, Reason reason, String actorId) {
    audit.recordRefused(documentId, action, reason.name(), actorId);
    return new ReviewTransitionException(documentId, reason);
  }

  private static void requireField(ReviewRecord record, String pointer) {
    JsonPointer ptr;
    try {
      ptr = JsonPointer.compile(pointer);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("correctionOf is not a JSON pointer: " + pointer, e);
    }
    if (ptr.matches() || record.getDocument().getContent().at(ptr).isMissingNode()) {
      throw new IllegalArgumentException("correctionOf names no field of the document: " + pointer);
    }
  }

  private static void validateId(String id, String name) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }
}
