package com.stockdiscussion.collector.collect.api;

import com.stockdiscussion.collector.collect.export.EmptyInputException;
import com.stockdiscussion.collector.collect.export.ExportCancelledException;
import com.stockdiscussion.collector.collect.export.PartialExportException;
import com.stockdiscussion.collector.collect.export.RecordDataException;
import com.stockdiscussion.collector.collect.model.PartitionDescriptor;
import com.stockdiscussion.collector.collect.scrape.ScrapeException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CollectorExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(CollectorExceptionHandler.class);

  // An empty scrape is a normal outcome; callers read the body code.
  @ExceptionHandler(EmptyInputException.class)
  public ResponseEntity<Map<String, Object>> handleEmpty(EmptyInputException ex) {
    return ResponseEntity.ok(Map.of("code", 204, "message", ex.getMessage()));
  }

  @ExceptionHandler(RecordDataException.class)
  public ResponseEntity<Map<String, Object>> handleRecordData(RecordDataException ex) {
    return error(HttpStatus.UNPROCESSABLE_ENTITY, "invalid_record", ex.getMessage());
  }

  @ExceptionHandler(ExportCancelledException.class)
  public ResponseEntity<Map<String, Object>> handleCancelled(ExportCancelledException ex) {
    return partial(HttpStatus.SERVICE_UNAVAILABLE, "export_cancelled", ex);
  }

  @ExceptionHandler(PartialExportException.class)
  public ResponseEntity<Map<String, Object>> handlePartial(PartialExportException ex) {
    log.warn("Export aborted after {} partition(s): {}", ex.completedPartitions().size(), ex.getMessage());
    return partial(HttpStatus.BAD_GATEWAY, "export_failed", ex);
  }

  @ExceptionHandler(ScrapeException.class)
  public ResponseEntity<Map<String, Object>> handleScrape(ScrapeException ex) {
    return error(HttpStatus.BAD_GATEWAY, ex.getReasonCode(), ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
  }

  private ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("code", status.value());
    body.put("error", error);
    body.put("message", message);
    return ResponseEntity.status(status).body(body);
  }

  private ResponseEntity<Map<String, Object>> partial(HttpStatus status, String error, PartialExportException ex) {
    List<String> completedUrls = ex.completedPartitions().stream().map(PartitionDescriptor::uri).toList();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("code", status.value());
    body.put("error", error);
    body.put("message", ex.getMessage());
    body.put("completed_urls", completedUrls);
    return ResponseEntity.status(status).body(body);
  }
}
