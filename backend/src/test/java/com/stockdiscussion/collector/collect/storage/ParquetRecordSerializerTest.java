package com.stockdiscussion.collector.collect.storage;

import com.stockdiscussion.collector.collect.model.DateKey;
import com.stockdiscussion.collector.collect.model.DiscussionRecord;
import com.stockdiscussion.collector.collect.model.Partition;
import com.stockdiscussion.collector.collect.model.RecordSource;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.example.GroupReadSupport;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.schema.Type;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ParquetRecordSerializerTest {
    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");

    @TempDir
    Path tempDir;

    private final ParquetRecordSerializer serializer = new ParquetRecordSerializer(CompressionCodecName.UNCOMPRESSED);

    @Test
    void producesAParquetFile() throws Exception {
        byte[] bytes = serializer.serialize(partition());

        byte[] magic = "PAR1".getBytes(StandardCharsets.US_ASCII);
        assertThat(Arrays.copyOfRange(bytes, 0, 4)).isEqualTo(magic);
        assertThat(Arrays.copyOfRange(bytes, bytes.length - 4, bytes.length)).isEqualTo(magic);
        assertThat(serializer.fileExtension()).isEqualTo("parquet");
    }

    @Test
    void writesTheDiscussionColumns() throws Exception {
        Path file = tempDir.resolve("005930_2025-11-15.parquet");
        Files.write(file, serializer.serialize(partition()));
        org.apache.hadoop.fs.Path hadoopPath = new org.apache.hadoop.fs.Path(file.toUri());

        try (ParquetFileReader reader = ParquetFileReader.open(HadoopInputFile.fromPath(hadoopPath, new Configuration()))) {
            assertThat(reader.getRecordCount()).isEqualTo(2);
            assertThat(reader.getFooter().getFileMetaData().getSchema().getFields())
                .extracting(Type::getName)
                .containsExactly(
                    "stock_code", "isin_code", "stock_name", "comment_id", "author_name", "date",
                    "content", "likes_count", "dislikes_count", "comment_data", "dt", "source"
                );
        }

        try (ParquetReader<Group> reader = ParquetReader.builder(new GroupReadSupport(), hadoopPath).build()) {
            Group first = reader.read();
            assertThat(first.getString("stock_code", 0)).isEqualTo("005930");
            assertThat(first.getString("isin_code", 0)).isEqualTo("KR7005930003");
            assertThat(first.getLong("comment_id", 0)).isEqualTo(300000015L);
            assertThat(first.getString("date", 0)).isEqualTo("2025-11-15 23:59:10");
            assertThat(first.getLong("likes_count", 0)).isEqualTo(3L);
            assertThat(first.getString("comment_data", 0)).isEqualTo("[{\"index\":1}]");
            assertThat(first.getString("dt", 0)).isEqualTo("2025-11-15");
            assertThat(first.getString("source", 0)).isEqualTo("naver");

            Group second = reader.read();
            assertThat(second.getFieldRepetitionCount("isin_code")).isZero();
            assertThat(second.getString("comment_data", 0)).isEqualTo("[]");
            assertThat(reader.read()).isNull();
        }
    }

    @Test
    void codecNameIsCaseInsensitive() {
        assertThat(ParquetRecordSerializer.forCodec("uncompressed")).isNotNull();
        assertThat(ParquetRecordSerializer.forCodec(null)).isNotNull();
    }

    private static Partition partition() {
        DiscussionRecord withIsin = new DiscussionRecord(
            "005930", "KR7005930003", "삼성전자", 300000015L, "주주****",
            Instant.parse("2025-11-15T14:59:10Z"), "막판 매수", 3, 1, "[{\"index\":1}]", RecordSource.NAVER
        );
        DiscussionRecord withoutIsin = new DiscussionRecord(
            "005930", null, null, 300000016L, null,
            Instant.parse("2025-11-15T01:00:00Z"), "장 시작", 0, 0, null, RecordSource.NAVER
        );
        return new Partition(DateKey.parse("2025-11-15"), SEOUL, List.of(withIsin, withoutIsin));
    }
}
