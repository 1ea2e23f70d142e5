package com.cario.clinical.safety.review;

import lombok.Getter;

/** Thrown by {@link ReviewGate} when an operation is not legal for the document's state. */
@Getter
public class ReviewTransitionException extends RuntimeException {

  public enum Reason {
    UNKNOWN_DOCUMENT,
    DUPLICATE_DOCUMENT,
    ALREADY_REVIEWED,
    NOT_REVIEWED,
    ALREADY_SIGNED,
    NOT_SIGNED
  }

  private final String documentId;
  private final Reason reason;

  public ReviewTransitionException(String documentId, Reason reason) {
    super(describe(documentId, reason));
    this.documentId = documentId;
    this.reason = reason;
  }

  private static String describe(String documentId, Reason reason) {
    String detail =
        switch (reason) {
          case UNKNOWN_DOCUMENT -> "is not registered for review";
          case DUPLICATE_DOCUMENT -> "is already registered for review";
          case ALREADY_REVIEWED -> "has already been acknowledged";
          case NOT_REVIEWED -> "must be acknowledged before it can be signed";
          case ALREADY_SIGNED -> "is already signed";
          case NOT_SIGNED -> "must be signed before addenda can be attached";
        };
    return "Document " + documentId + " " + detail;
  }
}
