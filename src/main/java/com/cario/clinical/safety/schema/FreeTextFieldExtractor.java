package com.cario.clinical.safety.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Lists the free-text values of a validated payload by walking its schema, never the payload's own
 * keys. Disclaimers, enumerations, numbers and timestamps are not free text.
 *
 * <p>A list field yields each element under its indexed path, followed by all of its elements
 * joined with a space under the list's own path, so a phrase split across adjacent elements is
 * still seen whole.
 */
public class FreeTextFieldExtractor {

  public List<TextField> extract(StructuredPayload payload) {
    List<TextField> out = new ArrayList<>();
    walk(payload.tree(), DocumentSchemas.forKind(payload.getKind()), "", out);
    return out;
  }

  private void walk(JsonNode node, ObjectSpec spec, String path, List<TextField> out) {
    for (FieldSpec f : spec.fields()) {
      JsonNode value = node.get(f.getName());
      if (value == null || value.isNull()) {
        continue;
      }
      String fieldPath = SchemaValidator.join(path, f.getName());

      switch (f.getType()) {
        case TEXT -> out.add(new TextField(fieldPath, value.asText()));
        case SCALAR -> {
          if (value.isTextual()) {
            out.add(new TextField(fieldPath, value.asText()));
          }
        }
        case TEXT_LIST -> addElements(value, fieldPath, out);
        case KEYED_TEXT_LISTS -> {
          for (String key : f.getAllowedKeys()) {
            JsonNode list = value.get(key);
            if (list != null) {
              addElements(list, SchemaValidator.join(fieldPath, key), out);
            }
          }
        }
        case OBJECT -> walk(value, f.getNested(), fieldPath, out);
        case OBJECT_LIST -> {
          for (int i = 0; i < value.size(); i++) {
            walk(value.get(i), f.getNested(), fieldPath + "[" + i + "]", out);
          }
        }
        case NUMBER, INTEGER, TIMESTAMP, ENUM, DISCLAIMER -> {
          // not free text
        }
      }
    }
  }

  private static void addElements(JsonNode array, String path, List<TextField> out) {
    StringJoiner joined = new StringJoiner(" ");
    for (int i = 0; i < array.size(); i++) {
      String element = array.get(i).asText();
      out.add(new TextField(path + "[" + i + "]", element));
      joined.add(element);
    }
    if (array.size() > 1) {
      out.add(new TextField(path, joined.toString()));
    }
  }
}
