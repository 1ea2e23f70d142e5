package com.cario.clinical.safety.api;

import com.cario.clinical.safety.model.ValidationError;
import com.cario.clinical.safety.model.ValidationError.ForbiddenPhraseDetected;

/**
 * Renders a {@link ValidationError} for API clients.
 *
 * <p>In production every variant becomes the same generic message, so neither the failing field
 * nor the forbidden vocabulary reaches the clinician; the audit log keeps the detail. Development
 * builds ({@code safety.errors.expose-details=true}) return the full variant.
 */
public class ValidationErrorPresenter {

  public static final String GENERIC_MESSAGE =
      "Could not produce a compliant document. Please document manually.";

  private final boolean exposeDetails;

  public ValidationErrorPresenter(boolean exposeDetails) {
    this.exposeDetails = exposeDetails;
  }

  public boolean isExposeDetails() {
    return exposeDetails;
  }

  public ErrorResponse present(ValidationError error) {
    ErrorResponse.ErrorResponseBuilder body =
        ErrorResponse.builder().message(GENERIC_MESSAGE).manualDocumentationRequired(true);
    if (!exposeDetails) {
      return body.build();
    }
    body.type(error.type())
        .severity(error.severity())
        .field(error.field())
        .reason(error.describe());
    if (error instanceof ForbiddenPhraseDetected hit) {
      body.matchedPhrase(hit.matchedPhrase());
    }
    return body.build();
  }
}
