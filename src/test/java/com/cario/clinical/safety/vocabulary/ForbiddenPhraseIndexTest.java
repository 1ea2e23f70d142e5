package com.cario.clinical.safety.vocabulary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cario.clinical.safety.SafetyFixtures;
import com.cario.clinical.safety.model.DocumentKind;
import com.cario.clinical.safety.model.Language;
import com.cario.clinical.safety.text.TextNormalizer;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ForbiddenPhraseIndexTest {

  private final ForbiddenPhraseIndex index = SafetyFixtures.phraseIndex();

  @Test
  void findsPhraseEmbeddedInASentence() {
    assertThat(
            index.find(
                "Evidence of early pneumonia", Language.ENGLISH, DocumentKind.IMAGING_FINDINGS))
        .hasValueSatisfying(m -> assertThat(m.getPhrase()).isEqualTo("pneumonia"));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "p n e u m o n i a",
        "p.n.e.u.m.o.n.i.a",
        "PNEUMONIA",
        "pneu#monia",
        "findings consistent with p.neumon.ia",
        "Ｐｎｅｕｍｏｎｉａ"
      })
  void resistsObfuscation(String text) {
    assertThat(index.find(text, Language.ENGLISH, DocumentKind.CLINICAL_NOTE))
        .hasValueSatisfying(m -> assertThat(m.getPhrase()).isEqualTo("pneumonia"));
  }

  @Test
  void reportsFirstPhraseInTableOrder() {
    // "pneumonia" is listed before "consistent with"
    assertThat(
            index.find(
                "consistent with pneumonia", Language.ENGLISH, DocumentKind.IMAGING_FINDINGS))
        .hasValueSatisfying(m -> assertThat(m.getPhrase()).isEqualTo("pneumonia"));
  }

  @Test
  void reportsPhraseAsWrittenInTheTable() {
    assertThat(index.find("NEUMONÍA bilateral", Language.SPANISH, DocumentKind.CLINICAL_NOTE))
        .hasValueSatisfying(m -> assertThat(m.getPhrase()).isEqualTo("neumonía"));
  }

  @Test
  void stripsDiacriticsOnBothSides() {
    assertThat(index.find("diagnostico", Language.SPANISH, DocumentKind.CLINICAL_NOTE))
        .isPresent();
    assertThat(index.find("DIAGNÓSTICO", Language.SPANISH, DocumentKind.CLINICAL_NOTE))
        .isPresent();
  }

  @Test
  void multiWordPhraseMatchesAcrossPunctuation() {
    assertThat(
            index.find("It is likely, has been", Language.ENGLISH, DocumentKind.CLINICAL_NOTE))
        .map(MatchedPhrase::getPhrase)
        .hasValue("likely has");
  }

  @Test
  void listsAreNotMixedBetweenKinds() {
    // interpretive lab vocabulary is not part of the imaging list, and vice versa
    assertThat(index.find("worrisome", Language.ENGLISH, DocumentKind.IMAGING_FINDINGS))
        .isEmpty();
    assertThat(index.find("worrisome", Language.ENGLISH, DocumentKind.LAB_RESULTS)).isPresent();
    assertThat(index.find("pneumothorax", Language.ENGLISH, DocumentKind.LAB_RESULTS)).isEmpty();
  }

  @Test
  void listsAreNotMixedBetweenLanguages() {
    assertThat(index.find("tuberculose", Language.ENGLISH, DocumentKind.CLINICAL_NOTE)).isEmpty();
    assertThat(index.find("tuberculose", Language.FRENCH, DocumentKind.CLINICAL_NOTE))
        .isPresent();
  }

  @Test
  void cleanTextHasNoMatch() {
    assertThat(
            index.find(
                "Bilateral lung fields are visible",
                Language.ENGLISH,
                DocumentKind.IMAGING_FINDINGS))
        .isEmpty();
    assertThat(index.find("", Language.ENGLISH, DocumentKind.IMAGING_FINDINGS)).isEmpty();
  }

  @Test
  void exposesPhrasesInMatchOrder() {
    List<String> phrases = index.phrases(Language.ENGLISH, DocumentKind.IMAGING_FINDINGS);

    assertThat(phrases).first().isEqualTo("pneumonia");
    assertThat(phrases).contains("consistent with", "recommend");
    assertThatThrownBy(() -> phrases.add("x")).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void phraseThatNormalizesToNothingIsRejected() {
    SafetyVocabulary vocabulary = DisclaimerRegistryTest.completeVocabulary();
    vocabulary.getLanguages().get("fr").getPhrases().get("lab_results").add(" -- ");

    assertThatThrownBy(
            () -> ForbiddenPhraseIndex.fromVocabulary(vocabulary, new TextNormalizer()))
        .isInstanceOf(SafetyConfigurationException.class)
        .hasMessageContaining("fr/lab_results");
  }

  @Test
  void emptyListIsRejected() {
    SafetyVocabulary vocabulary = DisclaimerRegistryTest.completeVocabulary();
    vocabulary.getLanguages().get("en").getPhrases().get("clinical_note").clear();

    assertThatThrownBy(
            () -> ForbiddenPhraseIndex.fromVocabulary(vocabulary, new TextNormalizer()))
        .isInstanceOf(SafetyConfigurationException.class)
        .hasMessageContaining("en/clinical_note");
  }
}
