package com.onthegomap.overlapresolver.config;

/**
 * A fatal error in the resolver configuration or the shape of the input layers that is detected before any overlap
 * detection starts.
 */
public class ConfigurationException extends IllegalArgumentException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
