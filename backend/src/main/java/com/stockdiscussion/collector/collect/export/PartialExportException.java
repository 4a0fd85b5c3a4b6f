package com.stockdiscussion.collector.collect.export;

import com.stockdiscussion.collector.collect.model.PartitionDescriptor;
import java.util.List;

/**
 * An export that stopped after some partitions were already uploaded. Only fully uploaded
 * partitions are listed, so a caller can retry just the remainder.
 */
public abstract class PartialExportException extends RuntimeException {
    private final List<PartitionDescriptor> completedPartitions;

    protected PartialExportException(String message, List<PartitionDescriptor> completedPartitions, Throwable cause) {
        super(message, cause);
        this.completedPartitions = List.copyOf(completedPartitions);
    }

    public List<PartitionDescriptor> completedPartitions() {
        return completedPartitions;
    }
}
