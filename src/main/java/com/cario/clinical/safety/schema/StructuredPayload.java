package com.cario.clinical.safety.schema;

import com.cario.clinical.safety.model.DocumentKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoded JSON object that conforms to the closed schema of its kind. Only {@link SchemaValidator}
 * creates instances; readers get copies, so the tree cannot change after validation.
 */
public final class StructuredPayload {

  private final DocumentKind kind;
  private final ObjectNode root;

  StructuredPayload(DocumentKind kind, ObjectNode root) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.root = Objects.requireNonNull(root, "root").deepCopy();
  }

  public DocumentKind getKind() {
    return kind;
  }

  /** Copy of the whole tree. */
  public ObjectNode toJson() {
    return root.deepCopy();
  }

  /** Top-level text value, empty if the field is absent or not a string. */
  public Optional<String> text(String field) {
    JsonNode node = root.get(field);
    return node != null && node.isTextual() ? Optional.of(node.asText()) : Optional.empty();
  }

  public boolean has(String field) {
    return root.has(field);
  }

  /** Live tree, for schema-driven traversal inside this package only. */
  ObjectNode tree() {
    return root;
  }

  @Override
  public String toString() {
    return "StructuredPayload{kind=" + kind + ", fields=" + root.size() + "}";
  }
}
