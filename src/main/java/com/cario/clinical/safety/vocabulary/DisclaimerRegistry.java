package com.cario.clinical.safety.vocabulary;

import com.cario.clinical.safety.model.DocumentKind;
import com.cario.clinical.safety.model.Language;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Mandatory limitations statement per (language, document kind).
 *
 * <p>Unlike phrase matching this check is deliberately not fuzzy: after trimming surrounding
 * whitespace the candidate must equal the statement character for character. No case folding, no
 * diacritic folding, no substring match.
 */
@Log4j2
public final class DisclaimerRegistry {

  /** Name of the top-level field that carries the statement in every document kind. */
  public static final String DISCLAIMER_FIELD = "limitations";

  private final Map<Language, Map<DocumentKind, String>> table;

  private DisclaimerRegistry(Map<Language, Map<DocumentKind, String>> table) {
    this.table = table;
  }

  /**
   * Builds the registry from a loaded vocabulary.
   *
   * @throws SafetyConfigurationException if any (language, kind) pair lacks a non-blank statement
   */
  public static DisclaimerRegistry fromVocabulary(SafetyVocabulary vocabulary) {
    Objects.requireNonNull(vocabulary, "vocabulary");
    Map<Language, Map<DocumentKind, String>> table = new EnumMap<>(Language.class);

    for (Language language : Language.values()) {
      SafetyVocabulary.LanguageVocabulary lv = vocabulary.getLanguages().get(language.getCode());
      Map<DocumentKind, String> byKind = new EnumMap<>(DocumentKind.class);
      for (DocumentKind kind : DocumentKind.values()) {
        String text =
            lv == null || lv.getDisclaimers() == null
                ? null
                : lv.getDisclaimers().get(kind.getCode());
        if (text == null || text.isBlank()) {
          throw new SafetyConfigurationException(
              "No disclaimer configured for " + language.getCode() + "/" + kind.getCode());
        }
        byKind.put(kind, text.strip());
      }
      table.put(language, Collections.unmodifiableMap(byKind));
    }

    log.info(
        "disclaimers.built version={} entries={}",
        vocabulary.getVersion(),
        table.size() * DocumentKind.values().length);
    return new DisclaimerRegistry(Collections.unmodifiableMap(table));
  }

  public String requiredDisclaimer(Language language, DocumentKind kind) {
    Objects.requireNonNull(language, "language");
    Objects.requireNonNull(kind, "kind");
    return table.get(language).get(kind);
  }

  /** True only for an exact match once leading/trailing whitespace is removed. */
  public boolean matches(String candidate, Language language, DocumentKind kind) {
    if (candidate == null) {
      return false;
    }
    return candidate.strip().equals(requiredDisclaimer(language, kind));
  }

  /** Field of a document of the given kind that must hold the statement. */
  public String disclaimerField(DocumentKind kind) {
    return switch (kind) {
      case IMAGING_FINDINGS, LAB_RESULTS, CLINICAL_NOTE -> DISCLAIMER_FIELD;
    };
  }
}
