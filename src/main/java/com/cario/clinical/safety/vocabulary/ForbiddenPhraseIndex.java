package com.cario.clinical.safety.vocabulary;

import com.cario.clinical.safety.model.DocumentKind;
import com.cario.clinical.safety.model.Language;
import com.cario.clinical.safety.text.NormalizedText;
import com.cario.clinical.safety.text.TextNormalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.log4j.Log4j2;

/**
 * Immutable table of forbidden phrases per (language, document kind), compiled once from the
 * vocabulary.
 *
 * <p>A phrase matches a field when its collapsed form is a substring of the field's collapsed
 * form. A word-bounded hit in the spaced form is always such a substring, so the collapsed view is
 * the only one consulted. Substring matching is intended: "evidence of early pneumonia" must be
 * caught. Lists are never shared across kinds, even within one language.
 */
@Log4j2
public final class ForbiddenPhraseIndex {

  private final String version;
  private final Map<Language, Map<DocumentKind, List<CompiledPhrase>>> table;
  private final TextNormalizer normalizer;

  private ForbiddenPhraseIndex(
      String version,
      Map<Language, Map<DocumentKind, List<CompiledPhrase>>> table,
      TextNormalizer normalizer) {
    this.version = version;
    this.table = table;
    this.normalizer = normalizer;
  }

  /**
   * Compiles the phrase lists of a loaded vocabulary.
   *
   * @throws SafetyConfigurationException if any (language, kind) pair has no phrases, or a phrase
   *     normalizes to nothing
   */
  public static ForbiddenPhraseIndex fromVocabulary(
      SafetyVocabulary vocabulary, TextNormalizer normalizer) {
    Objects.requireNonNull(vocabulary, "vocabulary");
    Objects.requireNonNull(normalizer, "normalizer");

    Map<Language, Map<DocumentKind, List<CompiledPhrase>>> table = new EnumMap<>(Language.class);
    int total = 0;

    for (Language language : Language.values()) {
      SafetyVocabulary.LanguageVocabulary lv = vocabulary.getLanguages().get(language.getCode());
      if (lv == null || lv.getPhrases() == null) {
        throw new SafetyConfigurationException(
            "No forbidden phrases configured for language " + language.getCode());
      }

      Map<DocumentKind, List<CompiledPhrase>> byKind = new EnumMap<>(DocumentKind.class);
      for (DocumentKind kind : DocumentKind.values()) {
        List<String> raw = lv.getPhrases().get(kind.getCode());
        if (raw == null || raw.isEmpty()) {
          throw new SafetyConfigurationException(
              "No forbidden phrases configured for "
                  + language.getCode()
                  + "/"
                  + kind.getCode());
        }
        byKind.put(kind, compile(raw, language, kind, normalizer));
        total += byKind.get(kind).size();
      }
      table.put(language, Collections.unmodifiableMap(byKind));
    }

    log.info("phraseindex.built version={} phrases={}", vocabulary.getVersion(), total);
    return new ForbiddenPhraseIndex(
        vocabulary.getVersion(), Collections.unmodifiableMap(table), normalizer);
  }

  /** Returns the first phrase of the (language, kind) list that occurs in the text. */
  public Optional<MatchedPhrase> find(
      NormalizedText text, Language language, DocumentKind kind) {
    Objects.requireNonNull(text, "text");
    if (text.isEmpty()) {
      return Optional.empty();
    }

    for (CompiledPhrase p : phrasesFor(language, kind)) {
      if (text.getCollapsed().contains(p.collapsed)) {
        return Optional.of(new MatchedPhrase(p.raw));
      }
    }
    return Optional.empty();
  }

  /** Normalizes {@code raw} with the same normalizer the phrases were compiled with, then scans. */
  public Optional<MatchedPhrase> find(String raw, Language language, DocumentKind kind) {
    return find(normalizer.normalize(raw), language, kind);
  }

  /** The phrases of one list, as written in the table and in match order. */
  public List<String> phrases(Language language, DocumentKind kind) {
    List<String> out = new ArrayList<>();
    for (CompiledPhrase p : phrasesFor(language, kind)) {
      out.add(p.raw);
    }
    return Collections.unmodifiableList(out);
  }

  public String getVersion() {
    return version;
  }

  private List<CompiledPhrase> phrasesFor(Language language, DocumentKind kind) {
    Objects.requireNonNull(language, "language");
    Objects.requireNonNull(kind, "kind");
    return table.get(language).get(kind);
  }

  private static List<CompiledPhrase> compile(
      List<String> raw, Language language, DocumentKind kind, TextNormalizer normalizer) {
    Set<String> seen = new LinkedHashSet<>();
    List<CompiledPhrase> out = new ArrayList<>(raw.size());
    for (String phrase : raw) {
      NormalizedText n = normalizer.normalize(phrase);
      if (n.isEmpty()) {
        throw new SafetyConfigurationException(
            "Forbidden phrase '"
                + phrase
                + "' for "
                + language.getCode()
                + "/"
                + kind.getCode()
                + " normalizes to an empty string");
      }
      if (!seen.add(n.getCollapsed())) {
        log.debug(
            "phraseindex.duplicate lang={} kind={} phrase={}",
            language.getCode(),
            kind.getCode(),
            phrase);
        continue;
      }
      out.add(new CompiledPhrase(phrase.strip(), n.getCollapsed()));
    }
    return Collections.unmodifiableList(out);
  }

  private record CompiledPhrase(String raw, String collapsed) {}
}
