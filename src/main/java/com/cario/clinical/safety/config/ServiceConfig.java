package com.cario.clinical.safety.config;

import com.cario.clinical.safety.api.ValidationErrorPresenter;
import com.cario.clinical.safety.audit.ValidationAuditLogger;
import com.cario.clinical.safety.pipeline.ValidationPipeline;
import com.cario.clinical.safety.review.ReviewGate;
import com.cario.clinical.safety.schema.SchemaValidator;
import com.cario.clinical.safety.text.TextNormalizer;
import com.cario.clinical.safety.vocabulary.DisclaimerRegistry;
import com.cario.clinical.safety.vocabulary.ForbiddenPhraseIndex;
import com.cario.clinical.safety.vocabulary.SafetyVocabulary;
import com.cario.clinical.safety.vocabulary.SafetyVocabularyLoader;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final SafetyProperties safetyProperties;

  // -------------------
  // Vocabulary
  // -------------------

  @Bean
  public TextNormalizer textNormalizer() {
    return new TextNormalizer();
  }

  @Bean
  public SafetyVocabularyLoader safetyVocabularyLoader(ResourceLoader resourceLoader) {
    return new SafetyVocabularyLoader(resourceLoader);
  }

  @Bean
  public SafetyVocabulary safetyVocabulary(SafetyVocabularyLoader loader) {
    return loader.load(safetyProperties.getVocabulary().getLocation());
  }

  @Bean
  public ForbiddenPhraseIndex forbiddenPhraseIndex(
      SafetyVocabulary vocabulary, TextNormalizer textNormalizer) {
    return ForbiddenPhraseIndex.fromVocabulary(vocabulary, textNormalizer);
  }

  @Bean
  public DisclaimerRegistry disclaimerRegistry(SafetyVocabulary vocabulary) {
    return DisclaimerRegistry.fromVocabulary(vocabulary);
  }

  // -------------------
  // Core Services
  // -------------------

  @Bean
  public SchemaValidator schemaValidator() {
    return new SchemaValidator();
  }

  @Bean
  public ValidationAuditLogger validationAuditLogger() {
    return new ValidationAuditLogger();
  }

  @Bean
  public ValidationPipeline validationPipeline(
      SchemaValidator schemaValidator,
      DisclaimerRegistry disclaimerRegistry,
      ForbiddenPhraseIndex forbiddenPhraseIndex,
      TextNormalizer textNormalizer,
      ValidationAuditLogger validationAuditLogger) {
    return new ValidationPipeline(
        schemaValidator,
        disclaimerRegistry,
        forbiddenPhraseIndex,
        textNormalizer,
        validationAuditLogger);
  }

  @Bean
  public ReviewGate reviewGate(ValidationAuditLogger validationAuditLogger) {
    return new ReviewGate(validationAuditLogger);
  }

  @Bean
  public ValidationErrorPresenter validationErrorPresenter() {
    return new ValidationErrorPresenter(safetyProperties.getErrors().isExposeDetails());
  }
}
