package com.stockdiscussion.collector.collect.storage;

import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.stockdiscussion.collector.collect.export.ObjectStoreException;
import com.stockdiscussion.collector.collect.export.PartitionUploader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores partitions in a GCS bucket under an optional prefix and returns {@code gs://} URIs.
 */
public class GcsPartitionUploader implements PartitionUploader {
    private static final Logger log = LoggerFactory.getLogger(GcsPartitionUploader.class);
    private static final String CONTENT_TYPE = "application/octet-stream";

    private final Storage storage;
    private final String bucket;
    private final String prefix;

    public GcsPartitionUploader(Storage storage, String bucket, String prefix) {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("storage bucket must be configured");
        }
        this.storage = storage;
        this.bucket = bucket.trim();
        this.prefix = normalizePrefix(prefix);
    }

    @Override
    public String upload(byte[] payload, String logicalPath) {
        String objectName = (prefix + "/" + logicalPath).replaceAll("/{2,}", "/").replaceFirst("^/", "");
        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucket, objectName))
            .setContentType(CONTENT_TYPE)
            .build();
        try {
            storage.create(blobInfo, payload);
        } catch (StorageException e) {
            throw new ObjectStoreException("GCS write failed for gs://" + bucket + "/" + objectName, e);
        }
        String uri = "gs://" + bucket + "/" + objectName;
        log.debug("Stored {} bytes at {}", payload.length, uri);
        return uri;
    }

    private static String normalizePrefix(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
