package com.cario.clinical.safety.api;

import com.cario.clinical.safety.model.ValidationError;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/** Body of every non-2xx response. Detail fields are omitted unless details are exposed. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
  String message;
  boolean manualDocumentationRequired;
  ValidationError.Type type;
  ValidationError.Severity severity;
  String field;
  String reason;
  String matchedPhrase;
}
