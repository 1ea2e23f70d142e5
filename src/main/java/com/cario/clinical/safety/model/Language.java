package com.cario.clinical.safety.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Languages in which clinical documents are generated.
 *
 * <p>Three of the four are diacritic-bearing Romance languages, which is why phrase matching folds
 * diacritics before comparing.
 */
public enum Language {
  ENGLISH("en", "English"),
  SPANISH("es", "Español"),
  FRENCH("fr", "Français"),
  PORTUGUESE("pt", "Português");

  private final String code;
  private final String displayName;

  Language(String code, String displayName) {
    this.code = code;
    this.displayName = displayName;
  }

  /** ISO 639-1 code, also the key used in the vocabulary table. */
  @JsonValue
  public String getCode() {
    return code;
  }

  public String getDisplayName() {
    return displayName;
  }

  /**
   * Resolves a language from its code (case-insensitive) or its constant name.
   *
   * @throws IllegalArgumentException if the value names no supported language
   */
  @JsonCreator
  public static Language fromCode(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("language must not be null/blank");
    }
    String v = value.trim();
    for (Language l : values()) {
      if (l.code.equalsIgnoreCase(v) || l.name().equalsIgnoreCase(v)) {
        return l;
      }
    }
    throw new IllegalArgumentException("Unsupported language: " + v.toLowerCase(Locale.ROOT));
  }
}
