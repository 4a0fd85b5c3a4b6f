package com.stockdiscussion.collector.collect.scrape;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockdiscussion.collector.collect.http.PoliteHttpClient;
import com.stockdiscussion.collector.collect.model.DiscussionRecord;
import com.stockdiscussion.collector.collect.model.HttpFetchResult;
import com.stockdiscussion.collector.collect.model.RecordSource;
import com.stockdiscussion.collector.collect.model.StockInfo;
import com.stockdiscussion.collector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pages through the tossinvest community comment API for one stock, newest first.
 */
@Service
public class TossCommentScraper implements DiscussionScraper {
    private static final Logger log = LoggerFactory.getLogger(TossCommentScraper.class);
    private static final String COMMENTS_PATH = "/api/v3/comments";
    private static final String ORIGIN = "https://www.tossinvest.com";

    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CollectorProperties properties;

    public TossCommentScraper(PoliteHttpClient httpClient, ObjectMapper objectMapper, CollectorProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public RecordSource source() {
        return RecordSource.TOSS;
    }

    @Override
    public List<DiscussionRecord> fetch(ScrapeRequest request) {
        StockInfo stock = request.stock();
        if (!stock.hasIsinCode()) {
            throw new ScrapeException("missing_isin", "no ISIN code known for " + stock.stockCode());
        }
        CollectorProperties.Toss toss = properties.getToss();
        ZoneId zone = properties.zoneId();
        int maxItems = request.maxItems() == null ? toss.getDefaultMaxItems() : request.maxItems();
        log.info("[{}] Toss crawl started (isin {}, range {} ~ {}, max {})",
            stock.stockCode(), stock.isinCode(), request.range().start(), request.range().end(), maxItems);

        List<DiscussionRecord> records = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        String cursor = null;
        for (int page = 1; page <= toss.getMaxPages(); page++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ScrapeException("interrupted", "comment paging interrupted for " + stock.stockCode());
            }
            JsonNode comments = fetchPage(stock, cursor, page);
            if (comments == null || comments.isEmpty()) {
                break;
            }

            boolean passedRangeStart = false;
            int added = 0;
            String lastId = null;
            for (JsonNode comment : comments) {
                long commentId = comment.path("id").asLong(comment.path("commentId").asLong(0));
                if (commentId <= 0) {
                    continue;
                }
                lastId = Long.toString(commentId);
                if (!seen.add(commentId)) {
                    continue;
                }
                Instant writtenAt = TimestampParser.parse(textOf(comment, "createdAt", "updatedAt"), zone);
                if (writtenAt != null) {
                    LocalDate day = writtenAt.atZone(zone).toLocalDate();
                    if (request.range().isAfterEnd(day)) {
                        continue;
                    }
                    if (request.range().isBeforeStart(day)) {
                        passedRangeStart = true;
                        break;
                    }
                }
                records.add(toRecord(stock, commentId, writtenAt, comment));
                added++;
                if (records.size() >= maxItems) {
                    break;
                }
            }
            log.debug("[{}] Toss page {}: {} comments kept, {} total", stock.stockCode(), page, added, records.size());

            if (passedRangeStart || records.size() >= maxItems || lastId == null || lastId.equals(cursor)) {
                break;
            }
            cursor = lastId;
        }
        log.info("[{}] Toss crawl finished: {} comments collected", stock.stockCode(), records.size());
        return records;
    }

    private JsonNode fetchPage(StockInfo stock, String cursor, int page) {
        CollectorProperties.Toss toss = properties.getToss();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("subjectId", stock.isinCode());
        payload.put("subjectType", "STOCK");
        payload.put("commentSortType", "RECENT");
        if (cursor != null) {
            payload.put("commentId", cursor);
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Referer", refererFor(stock, toss.getReferer()));
        headers.put("Origin", ORIGIN);
        headers.put("X-XSRF-TOKEN", toss.getXsrfToken());
        headers.put("Cookie", toss.getCookie());

        HttpFetchResult result;
        try {
            result = httpClient.postJson(
                toss.getApiBaseUrl() + COMMENTS_PATH,
                objectMapper.writeValueAsString(payload),
                "application/json",
                headers
            );
        } catch (JsonProcessingException e) {
            throw new ScrapeException("request_encoding", "could not encode comment request: " + e.getOriginalMessage());
        }
        if (!result.isSuccessful()) {
            if (page == 1) {
                throw new ScrapeException("comments_unavailable",
                    "comment API unavailable for " + stock.stockCode() + ": " + result.describeFailure());
            }
            log.warn("[{}] Toss page {} failed ({}); stopping", stock.stockCode(), page, result.describeFailure());
            return null;
        }
        try {
            return objectMapper.readTree(result.body()).path("result").path("comments").path("body");
        } catch (JsonProcessingException e) {
            throw new ScrapeException("invalid_payload",
                "comment API returned unreadable JSON for " + stock.stockCode() + ": " + e.getOriginalMessage());
        }
    }

    private DiscussionRecord toRecord(StockInfo stock, long commentId, Instant writtenAt, JsonNode comment) {
        JsonNode author = comment.path("author");
        String authorName = author.isObject() ? textOf(author, "nickname", "name") : textOf(comment, "nickname", "authorName");
        return new DiscussionRecord(
            stock.stockCode(),
            stock.isinCode(),
            stock.stockName(),
            commentId,
            authorName,
            writtenAt,
            textOf(comment, "message", "content"),
            comment.path("likeCount").asLong(0),
            comment.path("dislikeCount").asLong(0),
            extraOf(comment),
            RecordSource.TOSS
        );
    }

    private String extraOf(JsonNode comment) {
        JsonNode replies = comment.path("replies");
        if (replies.isMissingNode() || replies.isNull()) {
            return DiscussionRecord.EMPTY_EXTRA;
        }
        if (replies.isObject() && replies.has("body")) {
            replies = replies.get("body");
        }
        try {
            return objectMapper.writeValueAsString(replies);
        } catch (JsonProcessingException e) {
            log.debug("Could not re-encode replies: {}", e.getOriginalMessage());
            return DiscussionRecord.EMPTY_EXTRA;
        }
    }

    private static String refererFor(StockInfo stock, String configured) {
        if (configured != null && configured.contains("{code}")) {
            return configured.replace("{code}", "A" + stock.stockCode());
        }
        return configured;
    }

    private static String textOf(JsonNode node, String field, String fallbackField) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            value = node.get(fallbackField);
        }
        return value == null || value.isNull() ? null : value.asText();
    }
}
