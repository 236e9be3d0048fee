package com.sessionmemory.ai.config;

import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every request with a request id, and with the session id when the path
 * names one, so log lines of one conversation can be correlated.
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String REQUEST_ID_KEY = "requestId";
  static final String SESSION_ID_KEY = "sessionId";

  private static final Pattern SESSION_PATH = Pattern.compile("^/chat/sessions/([^/]+)(?:/.*)?$");

  private final Tracer tracer;

  public RequestIdFilter(Tracer tracer) {
    this.tracer = tracer;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain) throws ServletException, IOException {
    String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (requestId == null || requestId.isBlank()) {
      requestId = UUID.randomUUID().toString();
    }

    MDC.put(REQUEST_ID_KEY, requestId);
    response.setHeader(REQUEST_ID_HEADER, requestId);

    String sessionId = sessionIdFromPath(request.getRequestURI());
    if (sessionId != null) {
      MDC.put(SESSION_ID_KEY, sessionId);
    }

    Span span = tracer.currentSpan();
    if (span != null) {
      span.tag(REQUEST_ID_KEY, requestId);
      if (sessionId != null) {
        span.tag(SESSION_ID_KEY, sessionId);
      }
    }

    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(REQUEST_ID_KEY);
      MDC.remove(SESSION_ID_KEY);
    }
  }

  static String sessionIdFromPath(String path) {
    if (path == null) {
      return null;
    }
    Matcher matcher = SESSION_PATH.matcher(path);
    return matcher.matches() ? matcher.group(1) : null;
  }
}
