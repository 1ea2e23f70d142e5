package com.cario.clinical.safety.schema;

/** Value types a schema field may declare. */
public enum FieldType {
  /** JSON string; scanned for forbidden phrases. */
  TEXT,
  /** Array of strings; each element scanned. */
  TEXT_LIST,
  /** String or number; scanned when it is a string. */
  SCALAR,
  NUMBER,
  INTEGER,
  /** ISO-8601 date-time with offset, e.g. {@code 2026-10-19T08:30:00Z}. */
  TIMESTAMP,
  /** String drawn from a fixed set of values. */
  ENUM,
  /** Nested object with its own closed schema. */
  OBJECT,
  /** Array of nested objects sharing one closed schema. */
  OBJECT_LIST,
  /** Object whose keys come from an allow-list and whose values are string arrays. */
  KEYED_TEXT_LISTS,
  /** Allowed key holding the mandatory disclaimer; checked by the disclaimer step only. */
  DISCLAIMER;

  /** Whether values of this type carry free text that must be scanned. */
  public boolean isFreeText() {
    return switch (this) {
      case TEXT, TEXT_LIST, SCALAR, KEYED_TEXT_LISTS -> true;
      case NUMBER, INTEGER, TIMESTAMP, ENUM, OBJECT, OBJECT_LIST, DISCLAIMER -> false;
    };
  }
}
