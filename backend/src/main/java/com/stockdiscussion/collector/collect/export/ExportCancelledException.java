package com.stockdiscussion.collector.collect.export;

import com.stockdiscussion.collector.collect.model.PartitionDescriptor;
import java.util.List;

public class ExportCancelledException extends PartialExportException {
    public ExportCancelledException(String stockCode, List<PartitionDescriptor> completedPartitions) {
        super("export cancelled for " + stockCode + " after " + completedPartitions.size() + " partition(s)",
            completedPartitions, null);
    }
}
