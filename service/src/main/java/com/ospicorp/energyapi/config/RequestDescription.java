package com.ospicorp.energyapi.config;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

/**
 * Method, path with query and client address of a request, as they appear in log lines.
 * The client is the first {@code X-Forwarded-For} hop when a proxy set one.
 */
record RequestDescription(String method, String target, String client) {

  static RequestDescription of(HttpServletRequest request) {
    String query = request.getQueryString();
    String target = StringUtils.hasText(query)
        ? request.getRequestURI() + "?" + query
        : request.getRequestURI();
    String forwarded = request.getHeader("X-Forwarded-For");
    String client = StringUtils.hasText(forwarded)
        ? forwarded.split(",")[0].trim()
        : request.getRemoteAddr();
    return new RequestDescription(request.getMethod(), target, client);
  }

  @Override
  public String toString() {
    return method + " " + target + " from " + client;
  }
}
