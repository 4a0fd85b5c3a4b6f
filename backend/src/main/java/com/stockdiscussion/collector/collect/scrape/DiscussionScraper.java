package com.stockdiscussion.collector.collect.scrape;

import com.stockdiscussion.collector.collect.model.DiscussionRecord;
import com.stockdiscussion.collector.collect.model.RecordSource;
import java.util.List;

public interface DiscussionScraper {
  RecordSource source();

  /**
   * Collects the posts of one stock. Records come back in site order; no deduplication across
   * calls.
   *
   * @throws ScrapeException when the site cannot be read at all
   */
  List<DiscussionRecord> fetch(ScrapeRequest request);
}
