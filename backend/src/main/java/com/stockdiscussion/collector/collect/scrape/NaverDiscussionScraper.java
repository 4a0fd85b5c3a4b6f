package com.stockdiscussion.collector.collect.scrape;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.stockdiscussion.collector.collect.http.PoliteHttpClient;
import com.stockdiscussion.collector.collect.model.DiscussionRecord;
import com.stockdiscussion.collector.collect.model.HttpFetchResult;
import com.stockdiscussion.collector.collect.model.RecordSource;
import com.stockdiscussion.collector.collect.model.StockInfo;
import com.stockdiscussion.collector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Collects finance.naver.com discussion posts: walks the board list until the range start, then
 * fetches each post's detail page and comment feed on the scrape executor.
 */
@Service
public class NaverDiscussionScraper implements DiscussionScraper {
    private static final Logger log = LoggerFactory.getLogger(NaverDiscussionScraper.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";
    private static final String MOBILE_USER_AGENT =
        "Mozilla/5.0 (iPhone; CPU iPhone OS 13_3 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/13.0.4 Mobile/15E148 Safari/604.1";

    private final PoliteHttpClient httpClient;
    private final NaverDetailParser detailParser;
    private final CollectorProperties properties;
    private final ExecutorService scrapeExecutor;

    public NaverDiscussionScraper(
        PoliteHttpClient httpClient,
        NaverDetailParser detailParser,
        CollectorProperties properties,
        @Qualifier("scrapeExecutor") ExecutorService scrapeExecutor
    ) {
        this.httpClient = httpClient;
        this.detailParser = detailParser;
        this.properties = properties;
        this.scrapeExecutor = scrapeExecutor;
    }

    @Override
    public RecordSource source() {
        return RecordSource.NAVER;
    }

    @Override
    public List<DiscussionRecord> fetch(ScrapeRequest request) {
        StockInfo stock = request.stock();
        ZoneId zone = properties.zoneId();
        log.info("[{}] Naver crawl started (range {} ~ {})", stock.stockCode(), request.range().start(), request.range().end());

        BoardScan scan = scanBoard(request, LocalDate.now(zone));
        if (scan.postIds().isEmpty()) {
            log.info("[{}] no posts in range", stock.stockCode());
            return List.of();
        }
        String stockName = stock.stockName() != null ? stock.stockName() : scan.stockName();
        StockInfo resolved = new StockInfo(stock.stockCode(), stockName, stock.isinCode());

        log.info("[{}] fetching {} post details", stock.stockCode(), scan.postIds().size());
        List<CompletableFuture<Optional<DiscussionRecord>>> futures = new ArrayList<>();
        for (Long postId : scan.postIds()) {
            futures.add(CompletableFuture
                .supplyAsync(() -> fetchPost(resolved, postId, zone), scrapeExecutor)
                .exceptionally(e -> {
                    log.warn("[{}] nid={} failed: {}", stock.stockCode(), postId, rootMessage(e));
                    return Optional.empty();
                }));
        }

        List<DiscussionRecord> records = new ArrayList<>();
        try {
            for (CompletableFuture<Optional<DiscussionRecord>> future : futures) {
                future.join().ifPresent(records::add);
            }
        } catch (CompletionException e) {
            futures.forEach(future -> future.cancel(true));
            throw new ScrapeException("detail_failed", "detail fetch aborted for " + stock.stockCode() + ": " + rootMessage(e));
        }
        log.info("[{}] Naver crawl finished: {} of {} posts collected", stock.stockCode(), records.size(), scan.postIds().size());
        return records;
    }

    private record BoardScan(List<Long> postIds, String stockName) {
    }

    private BoardScan scanBoard(ScrapeRequest request, LocalDate today) {
        StockInfo stock = request.stock();
        CollectorProperties.Naver naver = properties.getNaver();
        Set<Long> seen = new LinkedHashSet<>();
        String stockName = null;
        int emptyPages = 0;

        for (int page = 1; page <= naver.getMaxPages(); page++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ScrapeException("interrupted", "board scan interrupted for " + stock.stockCode());
            }
            String url = naver.getFinanceBaseUrl() + "/item/board.naver?code=" + encode(stock.stockCode()) + "&page=" + page;
            HttpFetchResult result = httpClient.get(url, HTML_ACCEPT, Map.of("Cookie", "hide_cleanbot_contents=off"));
            if (!result.isSuccessful()) {
                if (page == 1) {
                    throw new ScrapeException("board_unavailable",
                        "discussion board unavailable for " + stock.stockCode() + ": " + result.describeFailure());
                }
                log.warn("[{}] board page {} failed ({}); stopping scan", stock.stockCode(), page, result.describeFailure());
                break;
            }

            NaverBoardPageParser.BoardPage boardPage = NaverBoardPageParser.parse(result.body(), request.range(), today, seen);
            if (stockName == null) {
                stockName = boardPage.stockName();
            }
            for (Long postId : boardPage.postIds()) {
                if (request.reachedLimit(seen.size())) {
                    break;
                }
                seen.add(postId);
            }
            log.debug("[{}] board page {}: {} new posts, {} total", stock.stockCode(), page, boardPage.postIds().size(), seen.size());

            if (request.reachedLimit(seen.size()) || boardPage.reachedRangeStart()) {
                break;
            }
            if (!boardPage.hasValidRows() || boardPage.postIds().isEmpty()) {
                emptyPages++;
                if (emptyPages >= naver.getMaxEmptyPages()) {
                    log.info("[{}] {} consecutive pages without new posts; stopping at page {}", stock.stockCode(), emptyPages, page);
                    break;
                }
            } else {
                emptyPages = 0;
            }
        }
        return new BoardScan(new ArrayList<>(seen), stockName);
    }

    private Optional<DiscussionRecord> fetchPost(StockInfo stock, long postId, ZoneId zone) {
        CollectorProperties.Naver naver = properties.getNaver();
        String detailUrl = naver.getMobileBaseUrl() + "/pc/domestic/stock/" + encode(stock.stockCode()) + "/discussion/" + postId;
        HttpFetchResult detail = httpClient.get(detailUrl, HTML_ACCEPT);
        if (!detail.isSuccessful()) {
            log.warn("[{}] nid={}: detail fetch failed ({})", stock.stockCode(), postId, detail.describeFailure());
            return Optional.empty();
        }

        Optional<NaverDetailParser.NaverPost> parsed;
        try {
            parsed = detailParser.parseDetail(detail.body());
        } catch (JsonProcessingException e) {
            log.warn("[{}] nid={}: detail payload unreadable: {}", stock.stockCode(), postId, e.getOriginalMessage());
            return Optional.empty();
        }
        if (parsed.isEmpty()) {
            log.warn("[{}] nid={}: no discussion payload", stock.stockCode(), postId);
            return Optional.empty();
        }
        NaverDetailParser.NaverPost post = parsed.get();
        Instant writtenAt = TimestampParser.parse(post.writtenAt(), zone);
        String comments = fetchComments(stock, postId, zone);

        return Optional.of(new DiscussionRecord(
            stock.stockCode(),
            stock.isinCode(),
            stock.stockName(),
            postId,
            post.authorName(),
            writtenAt,
            post.fullContent(),
            post.likes(),
            post.dislikes(),
            comments,
            RecordSource.NAVER
        ));
    }

    private String fetchComments(StockInfo stock, long postId, ZoneId zone) {
        CollectorProperties.Naver naver = properties.getNaver();
        String url = naver.getCommentApiUrl()
            + "?ticket=finance&templateId=community&pool=cbox12&lang=ko&country=KR"
            + "&objectId=" + postId
            + "&pageSize=" + naver.getCommentPageSize()
            + "&indexSize=10&listType=OBJECT&pageType=more&page=1&initialize=true"
            + "&useAltSort=true&replyPageSize=5&_callback=jQuery";
        Map<String, String> headers = Map.of(
            "User-Agent", MOBILE_USER_AGENT,
            "Referer", naver.getMobileBaseUrl() + "/domestic/stock/" + encode(stock.stockCode()) + "/discussion/" + postId
        );
        HttpFetchResult result = httpClient.get(url, "*/*", headers);
        if (!result.isSuccessful()) {
            log.warn("[{}] nid={}: comment fetch failed ({})", stock.stockCode(), postId, result.describeFailure());
            return DiscussionRecord.EMPTY_EXTRA;
        }
        try {
            return detailParser.parseCommentsJsonp(result.body(), zone);
        } catch (JsonProcessingException e) {
            log.warn("[{}] nid={}: comment feed unreadable: {}", stock.stockCode(), postId, e.getOriginalMessage());
            return DiscussionRecord.EMPTY_EXTRA;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.getClass().getSimpleName() : current.getMessage();
    }
}
