package com.delta.marketloader.ingest.util;

import com.delta.marketloader.ingest.source.FetchErrorKind;

import java.util.Locale;

public final class FetchErrorClassifier {
  public static final String INVALID_URL = "invalid_url";
  public static final String TIMEOUT = "timeout";
  public static final String IO_ERROR = "io_error";
  public static final String INTERRUPTED = "interrupted";
  public static final String HTTP_ERROR = "http_error";

  private FetchErrorClassifier() {}

  /**
   * Returns the error kind for a non-2xx status, or {@code null} for success codes.
   */
  public static FetchErrorKind fromHttpStatus(int status) {
    if (status >= 200 && status < 300) {
      return null;
    }
    if (status == 429) {
      return FetchErrorKind.RATE_LIMITED;
    }
    if (status == 401 || status == 403) {
      return FetchErrorKind.AUTH_FAILURE;
    }
    if (status == 404 || status == 410) {
      return FetchErrorKind.NOT_FOUND;
    }
    if (status == 408 || (status >= 500 && status < 600)) {
      return FetchErrorKind.NETWORK;
    }
    if (status >= 400 && status < 500) {
      return FetchErrorKind.UNSUPPORTED;
    }
    return FetchErrorKind.NETWORK;
  }

  public static FetchErrorKind fromErrorCode(String errorCode) {
    if (errorCode == null || errorCode.isBlank()) {
      return FetchErrorKind.NETWORK;
    }
    return switch (errorCode.toLowerCase(Locale.ROOT)) {
      case INVALID_URL -> FetchErrorKind.UNSUPPORTED;
      default -> FetchErrorKind.NETWORK;
    };
  }
}
