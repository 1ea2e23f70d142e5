package com.cario.clinical.safety.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Settings under {@code safety.*}. */
@Data
@ConfigurationProperties(prefix = "safety")
public class SafetyProperties {

  private Vocabulary vocabulary = new Vocabulary();
  private Errors errors = new Errors();

  @Data
  public static class Vocabulary {
    /** Spring resource location of the disclaimer and phrase tables. */
    private String location = "classpath:safety/vocabulary.yaml";
  }

  @Data
  public static class Errors {
    /**
     * Development only. When true, rejections carry the error type, field and matched phrase;
     * otherwise clinicians see a single generic message.
     */
    private boolean exposeDetails = false;
  }
}
