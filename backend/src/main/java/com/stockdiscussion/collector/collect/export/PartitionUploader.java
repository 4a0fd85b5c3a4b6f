package com.stockdiscussion.collector.collect.export;

/**
 * Writes a serialized partition to object storage.
 *
 * <p>Uploading to the same logical path twice overwrites the first object. Implementations own
 * any retrying and throw {@link ObjectStoreException} once they give up.
 */
public interface PartitionUploader {

  /**
   * @param logicalPath path below the storage root, e.g. {@code
   *     marketing/stock_discussion/dt=2025-11-15/005930_2025-11-15.parquet}
   * @return URI of the stored object
   */
  String upload(byte[] payload, String logicalPath);
}
