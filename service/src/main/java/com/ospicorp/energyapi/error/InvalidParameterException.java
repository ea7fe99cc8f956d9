package com.ospicorp.energyapi.error;

/**
 * A request parameter outside the core's vocabulary, such as an unsupported response format.
 * {@code moreInfo} links to the documentation for the error code.
 */
public class InvalidParameterException extends RuntimeException {
  static final String ERROR_DOCS_BASE = "https://docs.energy-api.dev/errors/";

  private final String parameter;
  private final String value;
  private final int errorCode;

  public InvalidParameterException(String parameter, String value, String message,
      int errorCode) {
    super(message);
    this.parameter = parameter;
    this.value = value;
    this.errorCode = errorCode;
  }

  public String parameter() {
    return parameter;
  }

  public String value() {
    return value;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return ERROR_DOCS_BASE + errorCode;
  }
}
