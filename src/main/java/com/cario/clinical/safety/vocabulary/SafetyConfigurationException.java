package com.cario.clinical.safety.vocabulary;

/**
 * Raised while loading the safety vocabulary when the table is unreadable or incomplete. Always
 * surfaces at startup, never during validation.
 */
public class SafetyConfigurationException extends RuntimeException {

  public SafetyConfigurationException(String message) {
    super(message);
  }

  public SafetyConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
