package com.cario.clinical.safety.vocabulary;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Reads the vocabulary table once at startup. YAML is the canonical format; a JSON document is
 * accepted too since it is valid YAML.
 */
@Log4j2
@RequiredArgsConstructor
public class SafetyVocabularyLoader {

  private final ResourceLoader resourceLoader;

  private final ObjectMapper yamlMapper =
      new ObjectMapper(new YAMLFactory())
          .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  /**
   * Loads the table at a Spring resource location (e.g. {@code classpath:safety/vocabulary.yaml}).
   *
   * @throws SafetyConfigurationException if the resource is missing or cannot be parsed
   */
  public SafetyVocabulary load(String location) {
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      throw new SafetyConfigurationException("Safety vocabulary not found at " + location);
    }

    try (InputStream in = resource.getInputStream()) {
      SafetyVocabulary vocabulary = yamlMapper.readValue(in, SafetyVocabulary.class);
      if (vocabulary == null || vocabulary.getLanguages() == null) {
        throw new SafetyConfigurationException("Safety vocabulary at " + location + " is empty");
      }
      log.info(
          "vocabulary.loaded location={} version={} languages={}",
          location,
          vocabulary.getVersion(),
          vocabulary.getLanguages().keySet());
      return vocabulary;
    } catch (IOException e) {
      log.error("vocabulary.load.failed location={}", location, e);
      throw new SafetyConfigurationException(
          "Failed to read safety vocabulary from " + location, e);
    }
  }
}
