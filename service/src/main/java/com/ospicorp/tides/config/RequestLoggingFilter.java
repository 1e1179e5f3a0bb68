package com.ospicorp.tides.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Access log for the tide endpoints. Each request gets a short id in the MDC ({@code requestId})
 * so fit, prediction and validation log lines can be correlated; documentation traffic is only
 * logged at debug level.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
  static final String REQUEST_ID = "requestId";

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    String requestId = UUID.randomUUID().toString().substring(0, 8);
    MDC.put(REQUEST_ID, requestId);
    long startNanos = System.nanoTime();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("[{}] {} {} from {} failed: {}", requestId, request.getMethod(),
          RequestInfo.uriWithQuery(request), RequestInfo.clientIp(request), ex.getMessage(), ex);
      throw ex;
    } finally {
      long millis = (System.nanoTime() - startNanos) / 1_000_000L;
      if (request.getRequestURI().startsWith("/v1/")) {
        log.info("[{}] {} {} ({} bytes) from {} -> {} in {} ms", requestId, request.getMethod(),
            RequestInfo.uriWithQuery(request), request.getContentLengthLong(),
            RequestInfo.clientIp(request), response.getStatus(), millis);
      } else {
        log.debug("[{}] {} {} -> {} in {} ms", requestId, request.getMethod(),
            RequestInfo.uriWithQuery(request), response.getStatus(), millis);
      }
      MDC.remove(REQUEST_ID);
    }
  }
}
