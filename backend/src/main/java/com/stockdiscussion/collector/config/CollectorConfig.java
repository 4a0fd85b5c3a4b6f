package com.stockdiscussion.collector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import com.stockdiscussion.collector.collect.export.ExportPipeline;
import com.stockdiscussion.collector.collect.export.PartitionUploader;
import com.stockdiscussion.collector.collect.export.RecordSerializer;
import com.stockdiscussion.collector.collect.storage.GcsPartitionUploader;
import com.stockdiscussion.collector.collect.storage.ParquetRecordSerializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CollectorConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(CollectorProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "scrapeExecutor", destroyMethod = "shutdown")
    public ExecutorService scrapeExecutor(CollectorProperties properties) {
        return Executors.newFixedThreadPool(properties.getNaver().getDetailWorkers());
    }

    @Bean(name = "exportExecutor", destroyMethod = "shutdown")
    public ExecutorService exportExecutor(CollectorProperties properties) {
        return Executors.newFixedThreadPool(properties.getExport().getBatchConcurrency());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return mapper;
    }

    // Application-default credentials; the project id falls back to the environment's.
    @Bean
    public Storage storage(CollectorProperties properties) {
        StorageOptions.Builder builder = StorageOptions.newBuilder();
        String projectId = properties.getStorage().getProjectId();
        if (projectId != null && !projectId.isBlank()) {
            builder.setProjectId(projectId.trim());
        }
        return builder.build().getService();
    }

    @Bean
    public RecordSerializer recordSerializer(CollectorProperties properties) {
        return ParquetRecordSerializer.forCodec(properties.getStorage().getCompression());
    }

    @Bean
    public PartitionUploader partitionUploader(Storage storage, CollectorProperties properties) {
        CollectorProperties.Storage settings = properties.getStorage();
        return new GcsPartitionUploader(storage, settings.getBucket(), settings.getPrefix());
    }

    @Bean
    public ExportPipeline exportPipeline(CollectorProperties properties) {
        CollectorProperties.Export export = properties.getExport();
        return new ExportPipeline(export.getBasePath(), export.getInvalidRecordPolicy());
    }
}
