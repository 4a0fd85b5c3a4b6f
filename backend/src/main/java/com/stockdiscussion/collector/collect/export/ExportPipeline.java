package com.stockdiscussion.collector.collect.export;

import com.stockdiscussion.collector.collect.model.DateKey;
import com.stockdiscussion.collector.collect.model.DiscussionRecord;
import com.stockdiscussion.collector.collect.model.ExportMeta;
import com.stockdiscussion.collector.collect.model.ExportResult;
import com.stockdiscussion.collector.collect.model.Partition;
import com.stockdiscussion.collector.collect.model.PartitionDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns a batch of scraped records into one uploaded file per day.
 *
 * <p>Partitions are written newest day first, one at a time. The first failure stops the run and
 * reports the partitions already uploaded. Cancellation (thread interrupt) is honoured only
 * between partitions, so a partition is never reported half written. Nothing here retries.
 */
public class ExportPipeline {
    private static final Logger log = LoggerFactory.getLogger(ExportPipeline.class);

    private final String basePath;
    private final InvalidRecordPolicy invalidRecordPolicy;

    public ExportPipeline(String basePath, InvalidRecordPolicy invalidRecordPolicy) {
        this.basePath = trimSlashes(basePath);
        this.invalidRecordPolicy = invalidRecordPolicy == null ? InvalidRecordPolicy.FAIL : invalidRecordPolicy;
    }

    public ExportResult export(
        List<DiscussionRecord> records,
        ExportMeta meta,
        RecordSerializer serializer,
        PartitionUploader uploader
    ) {
        if (records == null || records.isEmpty()) {
            throw new EmptyInputException("no records to export for " + meta.stockCode());
        }
        List<DiscussionRecord> accepted = screen(records, meta);
        int skipped = records.size() - accepted.size();
        if (accepted.isEmpty()) {
            throw new EmptyInputException(
                "all " + records.size() + " record(s) for " + meta.stockCode() + " lacked a timestamp"
            );
        }

        Map<DateKey, List<DiscussionRecord>> groups = Partitioner.partition(accepted, meta.zone());
        List<DateKey> keys = new ArrayList<>(groups.keySet());
        keys.sort(Comparator.reverseOrder());

        List<PartitionDescriptor> completed = new ArrayList<>();
        int totalRecords = 0;
        for (DateKey key : keys) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Export cancelled. stockCode={}, completedPartitions={}", meta.stockCode(), completed.size());
                throw new ExportCancelledException(meta.stockCode(), completed);
            }
            Partition partition = new Partition(key, meta.zone(), groups.get(key));
            String logicalPath = logicalPath(key, BatchNamer.name(meta.fileIdentifier(), key), serializer.fileExtension());

            byte[] payload;
            try {
                payload = serializer.serialize(partition);
            } catch (IOException | RuntimeException e) {
                log.error("Serialization failed. path={}, completedPartitions={}", logicalPath, completed.size(), e);
                throw new PartitionSerializationException(logicalPath, completed, e);
            }

            String uri;
            try {
                uri = uploader.upload(payload, logicalPath);
            } catch (RuntimeException e) {
                log.error("Upload failed. path={}, completedPartitions={}", logicalPath, completed.size(), e);
                throw new UploadException(logicalPath, completed, e);
            }
            completed.add(new PartitionDescriptor(key, uri, partition.size()));
            totalRecords += partition.size();
            log.info("[{}] {} uploaded -> {} ({} records)", meta.fileIdentifier(), key, uri, partition.size());
        }

        log.info(
            "Export complete. stockCode={}, source={}, totalRecords={}, skippedRecords={}, partitions={}",
            meta.stockCode(),
            meta.source().code(),
            totalRecords,
            skipped,
            completed.size()
        );
        return new ExportResult(meta.stockCode(), meta.stockName(), meta.source(), totalRecords, skipped, completed);
    }

    String logicalPath(DateKey key, String name, String extension) {
        String fileName = extension == null || extension.isBlank() ? name : name + "." + extension;
        String partitionDir = "dt=" + key + "/" + fileName;
        return basePath.isEmpty() ? partitionDir : basePath + "/" + partitionDir;
    }

    private List<DiscussionRecord> screen(List<DiscussionRecord> records, ExportMeta meta) {
        if (invalidRecordPolicy == InvalidRecordPolicy.FAIL) {
            return records;
        }
        List<DiscussionRecord> accepted = new ArrayList<>(records.size());
        for (DiscussionRecord record : records) {
            if (record.hasTimestamp()) {
                accepted.add(record);
            } else {
                log.warn("Skipping record without timestamp. stockCode={}, recordId={}", meta.stockCode(), record.recordId());
            }
        }
        return accepted;
    }

    private static String trimSlashes(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
