package com.cario.clinical.safety.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed schema of a JSON object: the declared fields are the only keys allowed. Field order is
 * the order in which checks run and free text is scanned.
 */
public final class ObjectSpec {

  private final Map<String, FieldSpec> fields;

  private ObjectSpec(Map<String, FieldSpec> fields) {
    this.fields = fields;
  }

  public static ObjectSpec of(FieldSpec... fields) {
    Map<String, FieldSpec> byName = new LinkedHashMap<>();
    for (FieldSpec f : fields) {
      if (byName.put(f.getName(), f) != null) {
        throw new IllegalArgumentException("Duplicate field in schema: " + f.getName());
      }
    }
    return new ObjectSpec(Collections.unmodifiableMap(byName));
  }

  public List<FieldSpec> fields() {
    return List.copyOf(fields.values());
  }

  public Optional<FieldSpec> field(String name) {
    return Optional.ofNullable(fields.get(name));
  }

  public boolean allows(String key) {
    return fields.containsKey(key);
  }

  public List<FieldSpec> requiredFields() {
    return fields.values().stream().filter(FieldSpec::isRequired).toList();
  }
}
