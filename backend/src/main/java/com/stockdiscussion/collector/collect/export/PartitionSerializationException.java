package com.stockdiscussion.collector.collect.export;

import com.stockdiscussion.collector.collect.model.PartitionDescriptor;
import java.util.List;

public class PartitionSerializationException extends PartialExportException {
    public PartitionSerializationException(String logicalPath, List<PartitionDescriptor> completedPartitions, Throwable cause) {
        super("serialization failed for " + logicalPath + ": " + cause.getMessage(), completedPartitions, cause);
    }
}
