package com.cario.clinical.safety.vocabulary;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw shape of the versioned vocabulary table ({@code safety/vocabulary.yaml}).
 *
 * <pre>
 * version: "2026.10"
 * languages:
 *   en:
 *     disclaimers:
 *       imaging_findings: "..."
 *     phrases:
 *       imaging_findings: [pneumonia, ...]
 * </pre>
 *
 * <p>Mutable binding object only; it is compiled into {@link ForbiddenPhraseIndex} and {@link
 * DisclaimerRegistry} and not used afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SafetyVocabulary {

  private String version;

  /** Language code → per-language tables. */
  @Builder.Default private Map<String, LanguageVocabulary> languages = new LinkedHashMap<>();

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class LanguageVocabulary {

    /** Document kind code → mandatory disclaimer. */
    @Builder.Default private Map<String, String> disclaimers = new LinkedHashMap<>();

    /** Document kind code → forbidden phrases, in match priority order. */
    @Builder.Default private Map<String, List<String>> phrases = new LinkedHashMap<>();
  }
}
