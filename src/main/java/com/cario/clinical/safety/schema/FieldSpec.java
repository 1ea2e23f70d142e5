package com.cario.clinical.safety.schema;

import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Declaration of one field inside an {@link ObjectSpec}. */
@Value
@Builder
public class FieldSpec {

  String name;
  FieldType type;
  boolean required;

  /** Nested schema, for {@link FieldType#OBJECT} and {@link FieldType#OBJECT_LIST}. */
  ObjectSpec nested;

  /** Allowed keys for {@link FieldType#KEYED_TEXT_LISTS}. */
  @Singular Set<String> allowedKeys;

  /** Allowed values for {@link FieldType#ENUM}. */
  @Singular List<String> allowedValues;

  /** Minimum element count for list types. */
  int minItems;

  public static FieldSpec text(String name, boolean required) {
    return FieldSpec.builder().name(name).type(FieldType.TEXT).required(required).build();
  }

  public static FieldSpec textList(String name) {
    return FieldSpec.builder().name(name).type(FieldType.TEXT_LIST).build();
  }

  public static FieldSpec of(String name, FieldType type, boolean required) {
    return FieldSpec.builder().name(name).type(type).required(required).build();
  }

  public static FieldSpec object(String name, boolean required, ObjectSpec nested) {
    return FieldSpec.builder()
        .name(name)
        .type(FieldType.OBJECT)
        .required(required)
        .nested(nested)
        .build();
  }

  public static FieldSpec objectList(String name, int minItems, ObjectSpec nested) {
    return FieldSpec.builder()
        .name(name)
        .type(FieldType.OBJECT_LIST)
        .required(minItems > 0)
        .minItems(minItems)
        .nested(nested)
        .build();
  }

  public static FieldSpec disclaimer(String name) {
    return FieldSpec.builder().name(name).type(FieldType.DISCLAIMER).build();
  }
}
