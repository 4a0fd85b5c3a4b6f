package com.stockdiscussion.collector.collect.service;

import com.stockdiscussion.collector.collect.model.StockInfo;
import com.stockdiscussion.collector.config.CollectorProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The stock universe, read once from the catalog CSV ({@code stock_code, stock_name, isin_code,
 * target}). Only rows flagged as targets are kept.
 */
@Service
public class StockCatalogService {
    private static final Logger log = LoggerFactory.getLogger(StockCatalogService.class);

    private final CollectorProperties properties;
    private volatile Map<String, StockInfo> stocks;

    public StockCatalogService(CollectorProperties properties) {
        this.properties = properties;
    }

    public List<StockInfo> listTargets() {
        return List.copyOf(loaded().values());
    }

    public Optional<StockInfo> find(String stockCode) {
        String code = normalizeCode(stockCode);
        return code == null ? Optional.empty() : Optional.ofNullable(loaded().get(code));
    }

    /**
     * Catalog entry for the code, or a bare entry carrying the caller's name when the code is not
     * in the catalog.
     */
    public StockInfo resolve(String stockCode, String fallbackName) {
        String code = normalizeCode(stockCode);
        if (code == null) {
            throw new IllegalArgumentException("stock_code must not be blank");
        }
        return find(code).orElseGet(() -> new StockInfo(code, blankToNull(fallbackName), null));
    }

    private Map<String, StockInfo> loaded() {
        Map<String, StockInfo> current = stocks;
        if (current == null) {
            synchronized (this) {
                current = stocks;
                if (current == null) {
                    current = load(resolvePath(properties.getCatalog().getCsvPath()));
                    stocks = current;
                }
            }
        }
        return current;
    }

    private Map<String, StockInfo> load(Path csvPath) {
        if (!Files.exists(csvPath)) {
            log.warn("Stock catalog not found at {}; catalog is empty", csvPath);
            return Map.of();
        }
        int limit = properties.getCatalog().getLimit();
        Map<String, StockInfo> result = new LinkedHashMap<>();
        List<String> rejected = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String code = normalizeCode(getColumn(record, "stock_code", "code"));
                if (code == null) {
                    rejected.add("row " + record.getRecordNumber());
                    continue;
                }
                if (!isTarget(getColumn(record, "target", "target_stock"))) {
                    continue;
                }
                result.putIfAbsent(code, new StockInfo(
                    code,
                    getColumn(record, "stock_name", "name"),
                    getColumn(record, "isin_code", "isin")
                ));
                if (limit > 0 && result.size() >= limit) {
                    break;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read stock catalog at " + csvPath, e);
        }
        if (!rejected.isEmpty()) {
            log.warn("Stock catalog rows without a stock code were ignored: {}", rejected);
        }
        log.info("Loaded {} target stocks from {}", result.size(), csvPath);
        return result;
    }

    /**
     * Codes are six digits; spreadsheets tend to drop the leading zeros.
     */
    static String normalizeCode(String raw) {
        String value = blankToNull(raw);
        if (value == null) {
            return null;
        }
        if (value.chars().allMatch(Character::isDigit) && value.length() < 6) {
            return "0".repeat(6 - value.length()) + value;
        }
        return value;
    }

    private static boolean isTarget(String raw) {
        if (raw == null) {
            return true;
        }
        return raw.equals("1") || raw.equalsIgnoreCase("true") || raw.equalsIgnoreCase("y");
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header != null && header.trim().equalsIgnoreCase(name)) {
                    return blankToNull(record.get(header));
                }
            }
        }
        return null;
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
