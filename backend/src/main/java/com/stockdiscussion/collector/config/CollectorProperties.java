package com.stockdiscussion.collector.config;

import com.stockdiscussion.collector.collect.export.InvalidRecordPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

@ConfigurationProperties(prefix = "collector")
public class CollectorProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";
    private static final String DEFAULT_TIMEZONE = "Asia/Seoul";

    private String timezone = DEFAULT_TIMEZONE;
    private String userAgent;
    private int perHostDelayMs = 1000;
    private int globalConcurrency = 5;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 3;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 8000;
    private int rateLimitBackoffSeconds = 30;
    private Export export = new Export();
    private Storage storage = new Storage();
    private Naver naver = new Naver();
    private Toss toss = new Toss();
    private Catalog catalog = new Catalog();

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone == null || timezone.isBlank() ? DEFAULT_TIMEZONE : timezone.trim();
    }

    public ZoneId zoneId() {
        return ZoneId.of(getTimezone());
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public int getRateLimitBackoffSeconds() {
        return Math.max(0, rateLimitBackoffSeconds);
    }

    public void setRateLimitBackoffSeconds(int rateLimitBackoffSeconds) {
        this.rateLimitBackoffSeconds = Math.max(0, rateLimitBackoffSeconds);
    }

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Naver getNaver() {
        return naver;
    }

    public void setNaver(Naver naver) {
        this.naver = naver;
    }

    public Toss getToss() {
        return toss;
    }

    public void setToss(Toss toss) {
        this.toss = toss;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Export {
        private String basePath = "marketing/stock_discussion";
        private InvalidRecordPolicy invalidRecordPolicy = InvalidRecordPolicy.SKIP;
        private int defaultLookbackDays = 7;
        private int batchConcurrency = 2;

        public String getBasePath() {
            return basePath;
        }

        public void setBasePath(String basePath) {
            this.basePath = basePath;
        }

        public InvalidRecordPolicy getInvalidRecordPolicy() {
            return invalidRecordPolicy == null ? InvalidRecordPolicy.SKIP : invalidRecordPolicy;
        }

        public void setInvalidRecordPolicy(InvalidRecordPolicy invalidRecordPolicy) {
            this.invalidRecordPolicy = invalidRecordPolicy;
        }

        public int getDefaultLookbackDays() {
            return Math.max(0, defaultLookbackDays);
        }

        public void setDefaultLookbackDays(int defaultLookbackDays) {
            this.defaultLookbackDays = Math.max(0, defaultLookbackDays);
        }

        public int getBatchConcurrency() {
            return Math.max(1, batchConcurrency);
        }

        public void setBatchConcurrency(int batchConcurrency) {
            this.batchConcurrency = Math.max(1, batchConcurrency);
        }
    }

    public static class Storage {
        private String bucket = "";
        private String prefix = "";
        private String projectId = "";
        private String compression = "SNAPPY";

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public String getProjectId() {
            return projectId;
        }

        public void setProjectId(String projectId) {
            this.projectId = projectId;
        }

        public String getCompression() {
            return compression;
        }

        public void setCompression(String compression) {
            this.compression = compression;
        }
    }

    public static class Naver {
        private String financeBaseUrl = "https://finance.naver.com";
        private String mobileBaseUrl = "https://m.stock.naver.com";
        private String commentApiUrl = "https://apis.naver.com/commentBox/cbox/web_naver_list_jsonp.json";
        private int maxPages = 100;
        private int maxEmptyPages = 3;
        private int detailWorkers = 4;
        private int commentPageSize = 100;

        public String getFinanceBaseUrl() {
            return financeBaseUrl;
        }

        public void setFinanceBaseUrl(String financeBaseUrl) {
            this.financeBaseUrl = financeBaseUrl;
        }

        public String getMobileBaseUrl() {
            return mobileBaseUrl;
        }

        public void setMobileBaseUrl(String mobileBaseUrl) {
            this.mobileBaseUrl = mobileBaseUrl;
        }

        public String getCommentApiUrl() {
            return commentApiUrl;
        }

        public void setCommentApiUrl(String commentApiUrl) {
            this.commentApiUrl = commentApiUrl;
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public int getMaxEmptyPages() {
            return Math.max(1, maxEmptyPages);
        }

        public void setMaxEmptyPages(int maxEmptyPages) {
            this.maxEmptyPages = Math.max(1, maxEmptyPages);
        }

        public int getDetailWorkers() {
            return Math.max(1, detailWorkers);
        }

        public void setDetailWorkers(int detailWorkers) {
            this.detailWorkers = Math.max(1, detailWorkers);
        }

        public int getCommentPageSize() {
            return Math.max(1, commentPageSize);
        }

        public void setCommentPageSize(int commentPageSize) {
            this.commentPageSize = Math.max(1, commentPageSize);
        }
    }

    public static class Toss {
        private String apiBaseUrl = "https://wts-cert-api.tossinvest.com";
        private String referer = "https://www.tossinvest.com/";
        private String xsrfToken = "";
        private String cookie = "";
        private int defaultMaxItems = 500;
        private int maxPages = 50;

        public String getApiBaseUrl() {
            return apiBaseUrl;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }

        public String getReferer() {
            return referer;
        }

        public void setReferer(String referer) {
            this.referer = referer;
        }

        public String getXsrfToken() {
            return xsrfToken;
        }

        public void setXsrfToken(String xsrfToken) {
            this.xsrfToken = xsrfToken;
        }

        public String getCookie() {
            return cookie;
        }

        public void setCookie(String cookie) {
            this.cookie = cookie;
        }

        public int getDefaultMaxItems() {
            return Math.max(1, defaultMaxItems);
        }

        public void setDefaultMaxItems(int defaultMaxItems) {
            this.defaultMaxItems = Math.max(1, defaultMaxItems);
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }
    }

    public static class Catalog {
        private String csvPath = "../data/stocks.csv";
        private int limit = 0;

        public String getCsvPath() {
            return csvPath;
        }

        public void setCsvPath(String csvPath) {
            this.csvPath = csvPath;
        }

        public int getLimit() {
            return Math.max(0, limit);
        }

        public void setLimit(int limit) {
            this.limit = Math.max(0, limit);
        }
    }
}
