package com.sessionmemory.ai.config;

import static org.junit.jupiter.api.Assertions.*;

import io.micrometer.tracing.Tracer;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

  private final RequestIdFilter filter = new RequestIdFilter(Tracer.NOOP);

  @Test
  void propagatesIncomingRequestIdAndSessionFromPath() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/chat/sessions/abc/memory");
    request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "req-1");
    MockHttpServletResponse response = new MockHttpServletResponse();
    Map<String, String> seen = new HashMap<>();

    filter.doFilter(request, response, (req, res) -> {
      seen.put("requestId", MDC.get(RequestIdFilter.REQUEST_ID_KEY));
      seen.put("sessionId", MDC.get(RequestIdFilter.SESSION_ID_KEY));
    });

    assertEquals("req-1", response.getHeader(RequestIdFilter.REQUEST_ID_HEADER));
    assertEquals("req-1", seen.get("requestId"));
    assertEquals("abc", seen.get("sessionId"));
    assertNull(MDC.get(RequestIdFilter.REQUEST_ID_KEY));
    assertNull(MDC.get(RequestIdFilter.SESSION_ID_KEY));
  }

  @Test
  void generatesRequestIdWhenMissing() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/chat");
    MockHttpServletResponse response = new MockHttpServletResponse();

    filter.doFilter(request, response, (req, res) -> assertNull(MDC.get(RequestIdFilter.SESSION_ID_KEY)));

    assertNotNull(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER));
    assertFalse(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER).isBlank());
  }

  @Test
  void sessionIdOnlyComesFromSessionPaths() {
    assertEquals("abc", RequestIdFilter.sessionIdFromPath("/chat/sessions/abc"));
    assertEquals("abc", RequestIdFilter.sessionIdFromPath("/chat/sessions/abc/memory"));
    assertNull(RequestIdFilter.sessionIdFromPath("/chat"));
    assertNull(RequestIdFilter.sessionIdFromPath("/chat/sessions/"));
    assertNull(RequestIdFilter.sessionIdFromPath(null));
  }
}
