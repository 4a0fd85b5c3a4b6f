package com.stockdiscussion.collector.collect.export;

import com.stockdiscussion.collector.collect.model.DateKey;
import com.stockdiscussion.collector.collect.model.DiscussionRecord;
import com.stockdiscussion.collector.collect.model.ExportMeta;
import com.stockdiscussion.collector.collect.model.ExportResult;
import com.stockdiscussion.collector.collect.model.Partition;
import com.stockdiscussion.collector.collect.model.PartitionDescriptor;
import com.stockdiscussion.collector.collect.model.RecordSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class ExportPipelineTest {
    private static final ZoneId SEOUL = ZoneId.of("Asia/Seoul");
    private static final ExportMeta META = ExportMeta.of("005930", "삼성전자", RecordSource.NAVER, SEOUL);

    private final RecordingSerializer serializer = new RecordingSerializer();
    private final InMemoryUploader uploader = new InMemoryUploader();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void writesOneFilePerDayMostRecentFirst() {
        ExportPipeline pipeline = new ExportPipeline("marketing/stock_discussion", InvalidRecordPolicy.FAIL);
        List<DiscussionRecord> records = List.of(
            TestRecords.naver(1, "2025-11-13T01:00:00Z"),
            TestRecords.naver(2, "2025-11-15T01:00:00Z"),
            TestRecords.naver(3, "2025-11-14T01:00:00Z"),
            TestRecords.naver(4, "2025-11-15T02:00:00Z")
        );

        ExportResult result = pipeline.export(records, META, serializer, uploader);

        assertThat(result.partitions())
            .extracting(descriptor -> descriptor.dateKey().toString())
            .containsExactly("2025-11-15", "2025-11-14", "2025-11-13");
        assertThat(result.urls()).containsExactly(
            "mem://marketing/stock_discussion/dt=2025-11-15/005930_2025-11-15.txt",
            "mem://marketing/stock_discussion/dt=2025-11-14/005930_2025-11-14.txt",
            "mem://marketing/stock_discussion/dt=2025-11-13/005930_2025-11-13.txt"
        );
        assertThat(result.partitions()).extracting(PartitionDescriptor::recordCount).containsExactly(2, 1, 1);
        assertThat(result.totalRecords()).isEqualTo(4);
        assertThat(result.skippedRecords()).isZero();
        assertThat(result.stockCode()).isEqualTo("005930");
        assertThat(result.stockName()).isEqualTo("삼성전자");
        assertThat(result.source()).isEqualTo(RecordSource.NAVER);
        assertThat(serializer.partitions).extracting(Partition::zone).containsOnly(SEOUL);
    }

    @Test
    void fiftyRecordsOverThreeDaysAreAllAccountedFor() {
        ExportPipeline pipeline = new ExportPipeline("marketing/stock_discussion", InvalidRecordPolicy.FAIL);
        Instant base = Instant.parse("2025-11-13T00:00:00Z");
        List<DiscussionRecord> records = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            records.add(TestRecords.naver(i + 1, base.plusSeconds((i % 3) * 86_400L + i * 60L)));
        }

        ExportResult result = pipeline.export(records, META, serializer, uploader);

        assertThat(result.totalRecords()).isEqualTo(50);
        assertThat(result.partitions()).hasSize(3);
        assertThat(result.urls()).doesNotHaveDuplicates();
        assertThat(serializer.partitions.stream().mapToInt(Partition::size).sum()).isEqualTo(50);
    }

    @Test
    void emptyInputTouchesNoCollaborator() {
        ExportPipeline pipeline = new ExportPipeline("marketing/stock_discussion", InvalidRecordPolicy.FAIL);
        RecordSerializer mockSerializer = mock(RecordSerializer.class);
        PartitionUploader mockUploader = mock(PartitionUploader.class);

        assertThatThrownBy(() -> pipeline.export(List.of(), META, mockSerializer, mockUploader))
            .isInstanceOf(EmptyInputException.class);

        verifyNoInteractions(mockSerializer, mockUploader);
    }

    @Test
    void uploadFailureReportsCompletedPartitionsAndStops() {
        ExportPipeline pipeline = new ExportPipeline("marketing/stock_discussion", InvalidRecordPolicy.FAIL);
        uploader.failOnCall = 2;
        List<DiscussionRecord> records = List.of(
            TestRecords.naver(1, "2025-11-15T01:00:00Z"),
            TestRecords.naver(2, "2025-11-14T01:00:00Z"),
            TestRecords.naver(3, "2025-11-13T01:00:00Z")
        );

        UploadException error = catchThrowableOfType(
            () -> pipeline.export(records, META, serializer, uploader),
            UploadException.class
        );

        assertThat(error).isNotNull();
        assertThat(error.completedPartitions()).hasSize(1);
        assertThat(error.completedPartitions().get(0).dateKey()).isEqualTo(DateKey.parse("2025-11-15"));
        assertThat(error.getLogicalPath()).isEqualTo("marketing/stock_discussion/dt=2025-11-14/005930_2025-11-14.txt");
        assertThat(error.getCause()).isInstanceOf(ObjectStoreException.class);
        assertThat(uploader.calls).isEqualTo(2);
        assertThat(uploader.objects).containsOnlyKeys("marketing/stock_discussion/dt=2025-11-15/005930_2025-11-15.txt");
    }

    @Test
    void serializerFailureStopsBeforeUpload() {
        ExportPipeline pipeline = new ExportPipeline("marketing/stock_discussion", InvalidRecordPolicy.FAIL);
        serializer.failOn = DateKey.parse("2025-11-14");
        List<DiscussionRecord> records = List.of(
            TestRecords.naver(1, "2025-11-15T01:00:00Z"),
            TestRecords.naver(2, "2025-11-14T01:00:00Z"),
            TestRecords.naver(3, "2025-11-13T01:00:00Z")
        );

        PartitionSerializationException error = catchThrowableOfType(
            () -> pipeline.export(records, META, serializer, uploader),
            PartitionSerializationException.class
        );

        assertThat(error).isNotNull();
        assertThat(error.completedPartitions()).extracting(PartitionDescriptor::uri)
            .containsExactly("mem://marketing/stock_discussion/dt=2025-11-15/005930_2025-11-15.txt");
        assertThat(uploader.calls).isEqualTo(1);
    }

    @Test
    void rerunOverwritesTheSameObjects() {
        ExportPipeline pipeline = new ExportPipeline("marketing/stock_discussion", InvalidRecordPolicy.FAIL);
        List<DiscussionRecord> records = List.of(
            TestRecords.naver(1, "2025-11-15T01:00:00Z"),
            TestRecords.naver(2, "2025-11-14T01:00:00Z")
        );

        ExportResult first = pipeline.export(records, META, serializer, uploader);
        ExportResult second = pipeline.export(records, META, serializer, uploader);

        assertThat(second.urls()).isEqualTo(first.urls());
        assertThat(uploader.objects).hasSize(2);
    }

    @Test
    void fileIdentifierNamesTheObjects() {
        ExportPipeline pipeline = new ExportPipeline("/marketing/stock_discussion/", InvalidRecordPolicy.FAIL);
        ExportMeta tossMeta = new ExportMeta("005930", "삼성전자", RecordSource.TOSS, SEOUL, "KR7005930003");

        ExportResult result = pipeline.export(
            List.of(TestRecords.naver(1, "2025-11-15T01:00:00Z")),
            tossMeta,
            serializer,
            uploader
        );

        assertThat(result.urls())
            .containsExactly("mem://marketing/stock_discussion/dt=2025-11-15/KR7005930003_2025-11-15.txt");
    }

    @Test
    void failPolicyRejectsUndatedRecordBeforeAnyWrite() {
        ExportPipeline pipeline = new ExportPipeline("marketing/stock_discussion", InvalidRecordPolicy.FAIL);
        List<DiscussionRecord> records = List.of(
            TestRecords.naver(1, "2025-11-15T01:00:00Z"),
            TestRecords.naver(2, (String) null)
        );

        assertThatThrownBy(() -> pipeline.export(records, META, serializer, uploader))
            .isInstanceOf(RecordDataException.class);
        assertThat(serializer.partitions).isEmpty();
        assertThat(uploader.calls).isZero();
    }

    @Test
    void skipPolicyDropsUndatedRecordsAndCountsThem() {
        ExportPipeline pipeline = new ExportPipeline("marketing/stock_discussion", InvalidRecordPolicy.SKIP);
        List<DiscussionRecord> records = List.of(
            TestRecords.naver(1, "2025-11-15T01:00:00Z"),
            TestRecords.naver(2, (String) null),
            TestRecords.naver(3, "2025-11-15T02:00:00Z")
        );

        ExportResult result = pipeline.export(records, META, serializer, uploader);

        assertThat(result.totalRecords()).isEqualTo(2);
        assertThat(result.skippedRecords()).isEqualTo(1);
    }

    @Test
    void skipPolicyWithNothingLeftIsEmptyInput() {
        ExportPipeline pipeline = new ExportPipeline("marketing/stock_discussion", InvalidRecordPolicy.SKIP);

        assertThatThrownBy(() -> pipeline.export(
            List.of(TestRecords.naver(1, (String) null)), META, serializer, uploader))
            .isInstanceOf(EmptyInputException.class);
        assertThat(uploader.calls).isZero();
    }

    @Test
    void interruptBetweenPartitionsCancelsWithPartialReport() {
        ExportPipeline pipeline = new ExportPipeline("marketing/stock_discussion", InvalidRecordPolicy.FAIL);
        uploader.interruptAfterCall = 1;
        List<DiscussionRecord> records = List.of(
            TestRecords.naver(1, "2025-11-15T01:00:00Z"),
            TestRecords.naver(2, "2025-11-14T01:00:00Z"),
            TestRecords.naver(3, "2025-11-13T01:00:00Z")
        );

        ExportCancelledException error = catchThrowableOfType(
            () -> pipeline.export(records, META, serializer, uploader),
            ExportCancelledException.class
        );

        assertThat(error).isNotNull();
        assertThat(error.completedPartitions()).hasSize(1);
        assertThat(uploader.calls).isEqualTo(1);
    }

    private static final class RecordingSerializer implements RecordSerializer {
        private final List<Partition> partitions = new ArrayList<>();
        private DateKey failOn;

        @Override
        public byte[] serialize(Partition partition) throws IOException {
            if (partition.dateKey().equals(failOn)) {
                throw new IOException("disk full");
            }
            partitions.add(partition);
            return (partition.dateKey() + ":" + partition.size()).getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public String fileExtension() {
            return "txt";
        }
    }

    private static final class InMemoryUploader implements PartitionUploader {
        private final Map<String, byte[]> objects = new LinkedHashMap<>();
        private int calls;
        private int failOnCall;
        private int interruptAfterCall;

        @Override
        public String upload(byte[] payload, String logicalPath) {
            calls++;
            if (calls == failOnCall) {
                throw new ObjectStoreException("bucket unavailable", null);
            }
            objects.put(logicalPath, payload);
            if (calls == interruptAfterCall) {
                Thread.currentThread().interrupt();
            }
            return "mem://" + logicalPath;
        }
    }
}
