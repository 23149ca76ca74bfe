package com.delta.digest.aggregate.util;

import java.util.Locale;

public final class ReasonCodeClassifier {
  public static final String INVALID_URL = "INVALID_URL";
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String CONNECTION_FAILURE = "CONNECTION_FAILURE";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String HTTP_OTHER = "HTTP_OTHER";
  public static final String NOT_IMAGE = "NOT_IMAGE";
  public static final String TOO_LARGE = "TOO_LARGE";
  public static final String EMPTY_BODY = "EMPTY_BODY";
  public static final String WRITE_FAILED = "WRITE_FAILED";
  public static final String PARSING_FAILED = "PARSING_FAILED";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodeClassifier() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 401 || status == 403) {
      return HTTP_401_403;
    }
    if (status == 404 || status == 410) {
      return HTTP_404;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    return HTTP_OTHER;
  }

  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.equals("invalid_url")) {
      return INVALID_URL;
    }
    if (code.equals("body_too_large")) {
      return TOO_LARGE;
    }
    if (code.contains("io_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return DNS_FAILURE;
      }
      if (lower.contains("ssl") || lower.contains("handshake")) {
        return TLS_FAILURE;
      }
      return CONNECTION_FAILURE;
    }
    return UNKNOWN;
  }

  public static String fromErrorKey(String key) {
    if (key == null || key.isBlank()) {
      return UNKNOWN;
    }
    String lower = key.toLowerCase(Locale.ROOT);
    if (lower.startsWith("http_")) {
      try {
        return fromHttpStatus(Integer.parseInt(lower.substring("http_".length())));
      } catch (NumberFormatException ignored) {
        return UNKNOWN;
      }
    }
    if (lower.contains("timeout")) {
      return TIMEOUT;
    }
    if (lower.contains("not_image")) {
      return NOT_IMAGE;
    }
    if (lower.contains("too_large")) {
      return TOO_LARGE;
    }
    if (lower.contains("empty_body")) {
      return EMPTY_BODY;
    }
    if (lower.contains("write_failed")) {
      return WRITE_FAILED;
    }
    if (lower.contains("invalid_url")) {
      return INVALID_URL;
    }
    if (lower.contains("parse") || lower.contains("payload")) {
      return PARSING_FAILED;
    }
    if (lower.contains("io_error")) {
      return CONNECTION_FAILURE;
    }
    return UNKNOWN;
  }
}
