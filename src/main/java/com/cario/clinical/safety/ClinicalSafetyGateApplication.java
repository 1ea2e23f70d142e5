package com.cario.clinical.safety;

import com.cario.clinical.safety.config.SafetyProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the Clinical Safety Gate service.
 *
 * <p>Validates AI-generated clinical documents (imaging findings, lab extractions, SOAP notes)
 * before a clinician sees them, and tracks acknowledgement and signature of the documents that
 * pass. Usage:
 *
 * <pre>
 *   mvn spring-boot:run
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableConfigurationProperties(SafetyProperties.class)
public class ClinicalSafetyGateApplication {

  public static void main(String[] args) {
    log.info("Starting Clinical Safety Gate application...");
    SpringApplication.run(ClinicalSafetyGateApplication.class, args);
    log.info("Clinical Safety Gate application started successfully.");
  }
}
