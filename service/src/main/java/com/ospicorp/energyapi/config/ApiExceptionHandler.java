package com.ospicorp.energyapi.config;

import com.ospicorp.energyapi.error.DataSourceException;
import com.ospicorp.energyapi.error.ForecastingException;
import com.ospicorp.energyapi.error.InsufficientDataException;
import com.ospicorp.energyapi.error.InvalidParameterException;
import com.ospicorp.energyapi.error.ModelFitException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);
  private static final String PROBLEM_BASE = "https://docs.energy-api.dev/problems/";

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.UNPROCESSABLE_ENTITY, "unprocessable",
      HttpStatus.SERVICE_UNAVAILABLE, "data-unavailable",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class,
      MethodArgumentTypeMismatchException.class,
      MissingServletRequestParameterException.class, HttpMessageNotReadableException.class,
      IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ProblemDetail> handleInvalidBody(MethodArgumentNotValidException ex,
      HttpServletRequest request) {
    String detail = ex.getBindingResult().getFieldErrors().stream()
        .map(error -> error.getField() + ": " + error.getDefaultMessage())
        .collect(Collectors.joining("; "));
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request,
        detail.isEmpty() ? ex.getMessage() : detail);
  }

  @ExceptionHandler(ForecastingException.class)
  public ResponseEntity<ProblemDetail> handleForecasting(ForecastingException ex,
      HttpServletRequest request) {
    HttpStatus status = statusFor(ex);
    ResponseEntity<ProblemDetail> response = buildProblem(status, ex, request);
    ProblemDetail detail = response.getBody();
    if (detail != null) {
      detail.setType(URI.create(PROBLEM_BASE + ex.slug()));
      detail.setProperty("errorCode", ex.errorCode());
      detail.setProperty("parameter", ex.parameter());
      detail.setProperty("value", ex.value());
    }
    return response;
  }

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<ProblemDetail> handleInvalidParameter(InvalidParameterException ex,
      HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.BAD_REQUEST, ex, request);
    ProblemDetail detail = response.getBody();
    if (detail != null) {
      detail.setProperty("errorCode", ex.errorCode());
      detail.setProperty("parameter", ex.parameter());
      detail.setProperty("value", ex.value());
      detail.setProperty("moreInfo", ex.moreInfo());
    }
    return response;
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoResourceFoundException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex, request);
  }

  @ExceptionHandler(DataSourceException.class)
  public ResponseEntity<ProblemDetail> handleDataSource(DataSourceException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.SERVICE_UNAVAILABLE, ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  static HttpStatus statusFor(ForecastingException ex) {
    if (ex instanceof ModelFitException || ex instanceof InsufficientDataException) {
      return HttpStatus.UNPROCESSABLE_ENTITY;
    }
    return HttpStatus.BAD_REQUEST;
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    return buildProblem(status, ex, request, ex.getMessage());
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request, String message) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, message);
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create(PROBLEM_BASE + TYPE_SLUGS.getOrDefault(status, "internal-error")));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    RequestDescription description = RequestDescription.of(request);
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }

    if (status.is5xxServerError()) {
      log.error("Request {} failed with status {}: {}", description, status.value(),
          errorMessage, ex);
    } else {
      log.warn("Request {} returned status {}: {}", description, status.value(), errorMessage);
    }
  }
}
