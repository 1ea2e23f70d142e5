package com.cario.clinical.safety.schema;

import com.cario.clinical.safety.model.DocumentKind;
import com.cario.clinical.safety.model.ValidationError;
import com.cario.clinical.safety.model.ValidationOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;

/**
 * Structural validation of model output against the closed schema of its {@link DocumentKind}.
 *
 * <p>Checks run cheapest first and stop at the first failure:
 *
 * <ol>
 *   <li>decode: the text must be a single JSON object without duplicate keys, otherwise {@code
 *       MalformedInput}
 *   <li>required fields present (and non-null; required text non-blank)
 *   <li>every key on the allow-list. Unknown keys are rejected rather than dropped: a model could
 *       otherwise park text in a field nobody scans
 *   <li>value types, enumerations and nested structures, recursively
 * </ol>
 */
@Log4j2
public class SchemaValidator {

  private final ObjectMapper mapper =
      JsonMapper.builder()
          .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
          .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
          .build();

  public ValidationOutcome<StructuredPayload> validate(String raw, DocumentKind kind) {
    if (kind == null) {
      throw new IllegalArgumentException("kind must not be null");
    }
    if (raw == null || raw.isBlank()) {
      return ValidationOutcome.rejected(ValidationError.malformedInput("input is empty"));
    }

    JsonNode root;
    try {
      root = mapper.readTree(raw);
    } catch (JsonProcessingException e) {
      log.debug("schema.decode.failed kind={} msg={}", kind.getCode(), e.getOriginalMessage());
      return ValidationOutcome.rejected(ValidationError.malformedInput(e.getOriginalMessage()));
    }
    if (root == null || !root.isObject()) {
      return ValidationOutcome.rejected(
          ValidationError.malformedInput("top-level value is not a JSON object"));
    }

    ObjectNode object = (ObjectNode) root;
    Optional<ValidationError> violation = checkObject(object, DocumentSchemas.forKind(kind), "");
    if (violation.isPresent()) {
      return ValidationOutcome.rejected(violation.get());
    }
    return ValidationOutcome.accepted(new StructuredPayload(kind, object));
  }

  private Optional<ValidationError> checkObject(ObjectNode node, ObjectSpec spec, String path) {
    for (FieldSpec f : spec.requiredFields()) {
      JsonNode child = node.get(f.getName());
      if (child == null) {
        return violation(join(path, f.getName()), "required field is missing");
      }
      if (child.isNull()) {
        return violation(join(path, f.getName()), "required field must not be null");
      }
    }

    Iterator<String> keys = node.fieldNames();
    while (keys.hasNext()) {
      String key = keys.next();
      if (!spec.allows(key)) {
        return violation(join(path, key), "field is not allowed by the schema");
      }
    }

    for (FieldSpec f : spec.fields()) {
      JsonNode child = node.get(f.getName());
      if (child == null || child.isNull()) {
        continue;
      }
      Optional<ValidationError> v = checkValue(f, child, join(path, f.getName()));
      if (v.isPresent()) {
        return v;
      }
    }
    return Optional.empty();
  }

  private Optional<ValidationError> checkValue(FieldSpec f, JsonNode value, String path) {
    switch (f.getType()) {
      case TEXT:
        if (!value.isTextual()) {
          return violation(path, "expected a string");
        }
        if (f.isRequired() && value.asText().isBlank()) {
          return violation(path, "required field must not be blank");
        }
        return Optional.empty();

      case SCALAR:
        if (!value.isTextual() && !value.isNumber()) {
          return violation(path, "expected a string or a number");
        }
        if (f.isRequired() && value.isTextual() && value.asText().isBlank()) {
          return violation(path, "required field must not be blank");
        }
        return Optional.empty();

      case TEXT_LIST:
        return checkTextList(value, path, f.getMinItems());

      case NUMBER:
        return value.isNumber() ? Optional.empty() : violation(path, "expected a number");

      case INTEGER:
        return value.isIntegralNumber() ? Optional.empty() : violation(path, "expected an integer");

      case TIMESTAMP:
        if (!value.isTextual()) {
          return violation(path, "expected an ISO-8601 timestamp string");
        }
        try {
          OffsetDateTime.parse(value.asText());
          return Optional.empty();
        } catch (DateTimeParseException e) {
          return violation(path, "expected an ISO-8601 timestamp with offset");
        }

      case ENUM:
        if (!value.isTextual() || !f.getAllowedValues().contains(value.asText())) {
          return violation(path, "expected one of " + f.getAllowedValues());
        }
        return Optional.empty();

      case OBJECT:
        if (!value.isObject()) {
          return violation(path, "expected an object");
        }
        return checkObject((ObjectNode) value, f.getNested(), path);

      case OBJECT_LIST:
        if (!value.isArray()) {
          return violation(path, "expected an array of objects");
        }
        if (value.size() < f.getMinItems()) {
          return violation(path, "must contain at least " + f.getMinItems() + " item(s)");
        }
        for (int i = 0; i < value.size(); i++) {
          JsonNode element = value.get(i);
          String elementPath = path + "[" + i + "]";
          if (!element.isObject()) {
            return violation(elementPath, "expected an object");
          }
          Optional<ValidationError> v =
              checkObject((ObjectNode) element, f.getNested(), elementPath);
          if (v.isPresent()) {
            return v;
          }
        }
        return Optional.empty();

      case KEYED_TEXT_LISTS:
        if (!value.isObject()) {
          return violation(path, "expected an object");
        }
        Iterator<Map.Entry<String, JsonNode>> entries = value.fields();
        while (entries.hasNext()) {
          Map.Entry<String, JsonNode> e = entries.next();
          String entryPath = join(path, e.getKey());
          if (!f.getAllowedKeys().contains(e.getKey())) {
            return violation(entryPath, "key is not in the allow-list");
          }
          Optional<ValidationError> v = checkTextList(e.getValue(), entryPath, 0);
          if (v.isPresent()) {
            return v;
          }
        }
        return Optional.empty();

      case DISCLAIMER:
        // exact-match check happens in the pipeline
        return Optional.empty();

      default:
        throw new IllegalStateException("Unhandled field type " + f.getType());
    }
  }

  private Optional<ValidationError> checkTextList(JsonNode value, String path, int minItems) {
    if (!value.isArray()) {
      return violation(path, "expected an array of strings");
    }
    if (value.size() < minItems) {
      return violation(path, "must contain at least " + minItems + " item(s)");
    }
    for (int i = 0; i < value.size(); i++) {
      if (!value.get(i).isTextual()) {
        return violation(path + "[" + i + "]", "expected a string");
      }
    }
    return Optional.empty();
  }

  private static Optional<ValidationError> violation(String field, String reason) {
    return Optional.of(ValidationError.schemaViolation(field, reason));
  }

  static String join(String parent, String name) {
    return parent == null || parent.isEmpty() ? name : parent + "." + name;
  }
}
