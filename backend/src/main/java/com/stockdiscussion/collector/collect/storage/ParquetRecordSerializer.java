package com.stockdiscussion.collector.collect.storage;

import com.stockdiscussion.collector.collect.export.RecordSerializer;
import com.stockdiscussion.collector.collect.model.DiscussionRecord;
import com.stockdiscussion.collector.collect.model.Partition;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Types;

import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Writes one Parquet file per partition with the stock discussion table layout.
 */
public class ParquetRecordSerializer implements RecordSerializer {
    static final MessageType SCHEMA = Types.buildMessage()
        .required(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named("stock_code")
        .optional(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named("isin_code")
        .optional(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named("stock_name")
        .required(PrimitiveTypeName.INT64).named("comment_id")
        .required(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named("author_name")
        .required(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named("date")
        .required(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named("content")
        .required(PrimitiveTypeName.INT64).named("likes_count")
        .required(PrimitiveTypeName.INT64).named("dislikes_count")
        .required(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named("comment_data")
        .required(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named("dt")
        .required(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named("source")
        .named("stock_discussion");

    private static final DateTimeFormatter DATE_COLUMN = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final CompressionCodecName codec;

    public ParquetRecordSerializer(CompressionCodecName codec) {
        this.codec = codec == null ? CompressionCodecName.SNAPPY : codec;
    }

    public static ParquetRecordSerializer forCodec(String codecName) {
        if (codecName == null || codecName.isBlank()) {
            return new ParquetRecordSerializer(CompressionCodecName.SNAPPY);
        }
        return new ParquetRecordSerializer(CompressionCodecName.valueOf(codecName.trim().toUpperCase(Locale.ROOT)));
    }

    @Override
    public byte[] serialize(Partition partition) throws IOException {
        ByteArrayOutputFile outputFile = new ByteArrayOutputFile();
        SimpleGroupFactory groups = new SimpleGroupFactory(SCHEMA);
        String dt = partition.dateKey().toString();
        DateTimeFormatter dateColumn = DATE_COLUMN.withZone(partition.zone());

        try (ParquetWriter<Group> writer = ExampleParquetWriter.builder(outputFile)
            .withType(SCHEMA)
            .withCompressionCodec(codec)
            .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
            .build()) {
            for (DiscussionRecord record : partition.records()) {
                Group row = groups.newGroup()
                    .append("stock_code", record.stockCode());
                if (record.isinCode() != null) {
                    row.append("isin_code", record.isinCode());
                }
                if (record.stockName() != null) {
                    row.append("stock_name", record.stockName());
                }
                row.append("comment_id", record.recordId())
                    .append("author_name", record.authorName())
                    .append("date", dateColumn.format(record.writtenAt()))
                    .append("content", record.content())
                    .append("likes_count", record.likes())
                    .append("dislikes_count", record.dislikes())
                    .append("comment_data", record.extra())
                    .append("dt", dt)
                    .append("source", record.source().code());
                writer.write(row);
            }
        }
        return outputFile.toByteArray();
    }

    @Override
    public String fileExtension() {
        return "parquet";
    }
}
