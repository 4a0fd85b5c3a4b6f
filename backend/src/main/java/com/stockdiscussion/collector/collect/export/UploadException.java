package com.stockdiscussion.collector.collect.export;

import com.stockdiscussion.collector.collect.model.PartitionDescriptor;
import java.util.List;

public class UploadException extends PartialExportException {
    private final String logicalPath;

    public UploadException(String logicalPath, List<PartitionDescriptor> completedPartitions, Throwable cause) {
        super("upload failed for " + logicalPath + ": " + cause.getMessage(), completedPartitions, cause);
        this.logicalPath = logicalPath;
    }

    public String getLogicalPath() {
        return logicalPath;
    }
}
