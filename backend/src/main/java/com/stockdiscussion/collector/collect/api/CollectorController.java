package com.stockdiscussion.collector.collect.api;

import com.stockdiscussion.collector.collect.model.BatchExportSummary;
import com.stockdiscussion.collector.collect.model.DateKey;
import com.stockdiscussion.collector.collect.model.DateRange;
import com.stockdiscussion.collector.collect.model.ExportResult;
import com.stockdiscussion.collector.collect.model.RecordSource;
import com.stockdiscussion.collector.collect.service.DiscussionExportService;
import com.stockdiscussion.collector.config.CollectorProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.Map;

@RestController
public class CollectorController {
    private static final String DEFAULT_STOCK_CODE = "005930";
    // Placeholder value the API docs UI pre-fills; treated as absent.
    private static final String PLACEHOLDER = "string";

    private final DiscussionExportService exportService;
    private final CollectorProperties properties;

    public CollectorController(DiscussionExportService exportService, CollectorProperties properties) {
        this.exportService = exportService;
        this.properties = properties;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", "Welcome to Stock Discussion Collector API");
    }

    @PostMapping("/api/naver/discussions/manual")
    public ExportResponse collectNaverDiscussions(@RequestBody(required = false) NaverDiscussionRequest request) {
        String stockCode = request == null ? null : present(request.stockCode());
        String stockName = request == null ? null : present(request.stockName());
        DateRange range = resolveRange(
            request == null ? null : request.startDate(),
            request == null ? null : request.endDate()
        );
        ExportResult result = exportService.exportStock(
            RecordSource.NAVER,
            stockCode == null ? DEFAULT_STOCK_CODE : stockCode,
            stockName,
            range,
            null
        );
        return ExportResponse.of(result, range);
    }

    @PostMapping("/api/naver/discussions/batch")
    public BatchExportSummary collectNaverBatch(@RequestBody(required = false) NaverBatchRequest request) {
        DateRange range = resolveRange(
            request == null ? null : request.startDate(),
            request == null ? null : request.endDate()
        );
        return exportService.exportBatch(RecordSource.NAVER, range);
    }

    @PostMapping("/api/toss/post-comments/manual")
    public ExportResponse collectTossComments(@RequestBody TossCommentRequest request) {
        return exportTossComments(request);
    }

    // Same collection, kept on its own route for daily and weekly schedulers.
    @PostMapping("/api/toss/post-comments/scheduled")
    public ExportResponse collectTossCommentsScheduled(@RequestBody TossCommentRequest request) {
        return exportTossComments(request);
    }

    private ExportResponse exportTossComments(TossCommentRequest request) {
        String stockCode = present(request.stockCode());
        if (stockCode == null) {
            throw new IllegalArgumentException("stock_code is required");
        }
        DateRange range = resolveRange(request.start(), request.end());
        ExportResult result = exportService.exportStock(RecordSource.TOSS, stockCode, null, range, request.maxItems());
        return ExportResponse.of(result, range);
    }

    private DateRange resolveRange(String rawStart, String rawEnd) {
        LocalDate today = LocalDate.now(properties.zoneId());
        String start = present(rawStart);
        String end = present(rawEnd);
        LocalDate endDate = end == null ? today : DateKey.parse(end).date();
        if (start == null) {
            return DateRange.lastDays(properties.getExport().getDefaultLookbackDays(), endDate);
        }
        return new DateRange(DateKey.parse(start).date(), endDate);
    }

    private static String present(String value) {
        if (value == null || value.isBlank() || PLACEHOLDER.equals(value.trim())) {
            return null;
        }
        return value.trim();
    }
}
