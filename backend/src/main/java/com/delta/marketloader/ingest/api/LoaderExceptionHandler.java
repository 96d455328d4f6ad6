package com.delta.marketloader.ingest.api;

import com.delta.marketloader.ingest.batch.BatchAbortedException;
import com.delta.marketloader.ingest.service.ActiveLoadRunException;
import com.delta.marketloader.ingest.source.FetchErrorKind;
import com.delta.marketloader.ingest.source.SourceFetchException;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class LoaderExceptionHandler {

  @ExceptionHandler(ActiveLoadRunException.class)
  public ResponseEntity<Map<String, Object>> handleActiveRun(ActiveLoadRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of(
            "error", "active_load_run",
            "message", ex.getMessage(),
            "activeRunId", ex.getActiveRunId()));
  }

  @ExceptionHandler(BatchAbortedException.class)
  public ResponseEntity<Map<String, String>> handleBatchAborted(BatchAbortedException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "batch_aborted", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(SourceFetchException.class)
  public ResponseEntity<Map<String, String>> handleSourceFailure(SourceFetchException ex) {
    HttpStatus status = ex.getKind() == FetchErrorKind.UNSUPPORTED ? HttpStatus.BAD_REQUEST : HttpStatus.BAD_GATEWAY;
    return ResponseEntity.status(status)
        .body(Map.of(
            "error", "source_" + ex.getKind().name().toLowerCase(Locale.ROOT),
            "source", String.valueOf(ex.getSource()),
            "message", String.valueOf(ex.getMessage())));
  }
}
