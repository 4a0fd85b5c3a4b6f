package com.stockdiscussion.collector.collect.export;

import com.stockdiscussion.collector.collect.model.Partition;
import java.io.IOException;

/**
 * Encodes one day's records into a file payload.
 */
public interface RecordSerializer {

  byte[] serialize(Partition partition) throws IOException;

  /** File extension without the leading dot, fixed per implementation. */
  String fileExtension();
}
