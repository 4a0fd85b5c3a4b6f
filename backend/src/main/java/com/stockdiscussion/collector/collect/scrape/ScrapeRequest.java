package com.stockdiscussion.collector.collect.scrape;

import com.stockdiscussion.collector.collect.model.DateRange;
import com.stockdiscussion.collector.collect.model.StockInfo;
import java.util.Objects;

/**
 * @param maxItems cap on collected posts, or null for no cap beyond the date range
 */
public record ScrapeRequest(StockInfo stock, DateRange range, Integer maxItems) {
  public ScrapeRequest {
    Objects.requireNonNull(stock, "stock");
    Objects.requireNonNull(range, "range");
    if (maxItems != null && maxItems < 1) {
      maxItems = 1;
    }
  }

  public boolean reachedLimit(int collected) {
    return maxItems != null && collected >= maxItems;
  }
}
