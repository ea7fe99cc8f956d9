package com.ospicorp.energyapi.error;

/**
 * Raised when the consumption data file cannot be read, parsed or generated.
 */
public class DataSourceException extends RuntimeException {

  public DataSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
