package com.ospicorp.energyapi.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Logs every API call with its status and duration. Health probes and API docs are logged at
 * debug so they do not drown out consumption and forecast traffic.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);
  private static final List<String> QUIET_PREFIXES =
      List.of("/actuator", "/v3/api-docs", "/swagger-ui");

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    RequestDescription description = RequestDescription.of(request);
    long started = System.nanoTime();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} failed: {}", description, ex.getMessage(), ex);
      throw ex;
    } finally {
      long millis = (System.nanoTime() - started) / 1_000_000;
      if (isQuiet(request.getRequestURI())) {
        log.debug("HTTP {} -> {} ({} ms)", description, response.getStatus(), millis);
      } else {
        log.info("HTTP {} -> {} ({} ms)", description, response.getStatus(), millis);
      }
    }
  }

  static boolean isQuiet(String path) {
    return QUIET_PREFIXES.stream().anyMatch(path::startsWith);
  }
}
