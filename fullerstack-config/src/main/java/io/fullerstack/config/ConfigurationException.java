package io.fullerstack.config;

/**
 * Thrown when a configuration bundle or key is missing, or a value cannot be
 * converted to the requested type.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
