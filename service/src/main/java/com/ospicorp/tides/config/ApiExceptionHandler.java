package com.ospicorp.tides.config;

import com.ospicorp.tides.tide.controller.InvalidParameterException;
import com.ospicorp.tides.tide.service.TideAnalysisException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);
  private static final String PROBLEM_BASE = "https://docs.tides.ospicorp.dev/problems/";

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.UNPROCESSABLE_ENTITY, "analysis-failed",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler({ConstraintViolationException.class, MethodArgumentNotValidException.class,
      MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class,
      IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<ProblemDetail> handleInvalidParameter(InvalidParameterException ex,
      HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.BAD_REQUEST, ex, request);
    ProblemDetail detail = response.getBody();
    if (detail != null) {
      detail.setProperty("parameter", ex.parameter());
      detail.setProperty("errorCode", ex.errorCode());
      detail.setProperty("moreInfo", ex.moreInfo());
    }
    return response;
  }

  @ExceptionHandler(TideAnalysisException.class)
  public ResponseEntity<ProblemDetail> handleAnalysisFailure(TideAnalysisException ex,
      HttpServletRequest request) {
    ResponseEntity<ProblemDetail> response =
        buildProblem(HttpStatus.UNPROCESSABLE_ENTITY, ex, request);
    ProblemDetail detail = response.getBody();
    if (detail != null) {
      detail.setProperty("error", ex.getClass().getSimpleName());
    }
    return response;
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create(PROBLEM_BASE + TYPE_SLUGS.getOrDefault(status, "internal-error")));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }

    if (status.is5xxServerError()) {
      log.error("Request {} {} from {} failed with status {}: {}",
          request.getMethod(),
          RequestInfo.uriWithQuery(request),
          RequestInfo.clientIp(request),
          status.value(),
          errorMessage,
          ex);
    } else {
      log.warn("Request {} {} from {} returned status {}: {}",
          request.getMethod(),
          RequestInfo.uriWithQuery(request),
          RequestInfo.clientIp(request),
          status.value(),
          errorMessage);
    }
  }
}
