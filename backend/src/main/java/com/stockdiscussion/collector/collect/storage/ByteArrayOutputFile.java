package com.stockdiscussion.collector.collect.storage;

import org.apache.parquet.io.DelegatingPositionOutputStream;
import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;

import java.io.ByteArrayOutputStream;

/**
 * Parquet output target backed by a heap buffer, so partitions never touch local disk.
 */
class ByteArrayOutputFile implements OutputFile {
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    @Override
    public PositionOutputStream create(long blockSizeHint) {
        return newStream();
    }

    @Override
    public PositionOutputStream createOrOverwrite(long blockSizeHint) {
        buffer.reset();
        return newStream();
    }

    @Override
    public boolean supportsBlockSize() {
        return false;
    }

    @Override
    public long defaultBlockSize() {
        return 0;
    }

    byte[] toByteArray() {
        return buffer.toByteArray();
    }

    private PositionOutputStream newStream() {
        return new DelegatingPositionOutputStream(buffer) {
            @Override
            public long getPos() {
                return buffer.size();
            }
        };
    }
}
