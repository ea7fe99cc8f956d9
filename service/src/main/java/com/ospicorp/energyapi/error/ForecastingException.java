package com.ospicorp.energyapi.error;

/**
 * Base type for failures raised by the resampling and forecasting core.
 *
 * <p>Every failure names the offending parameter and the value it was given so the
 * boundary layer can build a user-facing message without re-deriving the context.
 */
public abstract class ForecastingException extends RuntimeException {
  private final String parameter;
  private final transient Object value;
  private final int errorCode;
  private final String slug;

  protected ForecastingException(String message, String parameter, Object value, int errorCode,
      String slug) {
    this(message, parameter, value, errorCode, slug, null);
  }

  protected ForecastingException(String message, String parameter, Object value, int errorCode,
      String slug, Throwable cause) {
    super(message, cause);
    this.parameter = parameter;
    this.value = value;
    this.errorCode = errorCode;
    this.slug = slug;
  }

  public String parameter() {
    return parameter;
  }

  public Object value() {
    return value;
  }

  public int errorCode() {
    return errorCode;
  }

  public String slug() {
    return slug;
  }
}
