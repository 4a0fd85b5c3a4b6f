package com.stockdiscussion.collector.collect.service;

import com.stockdiscussion.collector.collect.export.EmptyInputException;
import com.stockdiscussion.collector.collect.export.ExportPipeline;
import com.stockdiscussion.collector.collect.export.PartitionUploader;
import com.stockdiscussion.collector.collect.export.RecordSerializer;
import com.stockdiscussion.collector.collect.model.BatchExportSummary;
import com.stockdiscussion.collector.collect.model.DateRange;
import com.stockdiscussion.collector.collect.model.DiscussionRecord;
import com.stockdiscussion.collector.collect.model.ExportMeta;
import com.stockdiscussion.collector.collect.model.ExportResult;
import com.stockdiscussion.collector.collect.model.RecordSource;
import com.stockdiscussion.collector.collect.model.StockExportOutcome;
import com.stockdiscussion.collector.collect.model.StockInfo;
import com.stockdiscussion.collector.collect.scrape.DiscussionScraper;
import com.stockdiscussion.collector.collect.scrape.ScrapeRequest;
import com.stockdiscussion.collector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Scrape-then-export for one stock, and the catalog-wide batch built on it.
 */
@Service
public class DiscussionExportService {
    private static final Logger log = LoggerFactory.getLogger(DiscussionExportService.class);

    private final Map<RecordSource, DiscussionScraper> scrapers = new EnumMap<>(RecordSource.class);
    private final StockCatalogService catalogService;
    private final ExportPipeline exportPipeline;
    private final RecordSerializer serializer;
    private final PartitionUploader uploader;
    private final CollectorProperties properties;
    private final ExecutorService exportExecutor;

    public DiscussionExportService(
        List<DiscussionScraper> scrapers,
        StockCatalogService catalogService,
        ExportPipeline exportPipeline,
        RecordSerializer serializer,
        PartitionUploader uploader,
        CollectorProperties properties,
        @Qualifier("exportExecutor") ExecutorService exportExecutor
    ) {
        for (DiscussionScraper scraper : scrapers) {
            this.scrapers.put(scraper.source(), scraper);
        }
        this.catalogService = catalogService;
        this.exportPipeline = exportPipeline;
        this.serializer = serializer;
        this.uploader = uploader;
        this.properties = properties;
        this.exportExecutor = exportExecutor;
    }

    public ExportResult exportStock(RecordSource source, String stockCode, String stockName, DateRange range, Integer maxItems) {
        StockInfo stock = catalogService.resolve(stockCode, stockName);
        if (stockName != null && !stockName.isBlank() && stock.stockName() == null) {
            stock = new StockInfo(stock.stockCode(), stockName.trim(), stock.isinCode());
        }
        return exportStock(source, stock, range, maxItems);
    }

    public BatchExportSummary exportBatch(RecordSource source, DateRange range) {
        List<StockInfo> targets = catalogService.listTargets();
        log.info("Batch export started. source={}, stocks={}, range={} ~ {}", source.code(), targets.size(), range.start(), range.end());

        List<CompletableFuture<ExportResult>> futures = new ArrayList<>();
        for (StockInfo stock : targets) {
            futures.add(CompletableFuture.supplyAsync(() -> exportStock(source, stock, range, null), exportExecutor));
        }

        List<StockExportOutcome> outcomes = new ArrayList<>();
        int succeeded = 0;
        int noData = 0;
        int failed = 0;
        for (int i = 0; i < futures.size(); i++) {
            StockInfo stock = targets.get(i);
            try {
                outcomes.add(StockExportOutcome.success(stock.stockCode(), futures.get(i).join()));
                succeeded++;
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (cause instanceof EmptyInputException) {
                    outcomes.add(StockExportOutcome.noData(stock.stockCode()));
                    noData++;
                } else {
                    log.warn("Export failed for {}", stock.stockCode(), cause);
                    outcomes.add(StockExportOutcome.failed(stock.stockCode(), describe(cause)));
                    failed++;
                }
            }
        }

        log.info(
            "Batch export finished. source={}, stocks={}, success={}, noData={}, failed={}",
            source.code(),
            targets.size(),
            succeeded,
            noData,
            failed
        );
        return new BatchExportSummary(source, range, targets.size(), succeeded, noData, failed, outcomes);
    }

    private ExportResult exportStock(RecordSource source, StockInfo stock, DateRange range, Integer maxItems) {
        DiscussionScraper scraper = scrapers.get(source);
        if (scraper == null) {
            throw new IllegalArgumentException("no scraper registered for source " + source.code());
        }
        List<DiscussionRecord> records = scraper.fetch(new ScrapeRequest(stock, range, maxItems));
        String stockName = stock.stockName();
        if (stockName == null && !records.isEmpty()) {
            stockName = records.get(0).stockName();
        }
        ExportMeta meta = new ExportMeta(
            stock.stockCode(),
            stockName,
            source,
            properties.zoneId(),
            stock.fileIdentifierFor(source)
        );
        return exportPipeline.export(records, meta, serializer, uploader);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
