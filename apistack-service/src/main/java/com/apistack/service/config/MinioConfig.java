package com.apistack.service.config;

import com.apistack.service.storage.MinioObjectStorage;
import com.apistack.service.storage.ObjectStorage;
import io.minio.MinioClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * MinIO client and storage adapter. The region is fixed so URL signing never calls the service.
 */
@Slf4j
@Configuration
public class MinioConfig {

    @Bean
    public MinioClient minioClient(ApiStackProperties properties) {
        ApiStackProperties.ObjectStorageConfig config = properties.getStorage();
        log.info("Object storage endpoint {} (region {})", config.getEndpoint(), config.getRegion());
        return MinioClient.builder()
                .endpoint(config.getEndpoint())
                .credentials(config.getAccessKey(), config.getSecretKey())
                .region(config.getRegion())
                .build();
    }

    @Bean
    public ObjectStorage objectStorage(MinioClient minioClient, Clock clock, ApiStackProperties properties) {
        ApiStackProperties.ObjectStorageConfig config = properties.getStorage();
        MinioObjectStorage storage = new MinioObjectStorage(minioClient, clock,
                Boolean.TRUE.equals(config.getVerifyBeforeSigning()));
        if (Boolean.TRUE.equals(config.getEnsureBucketOnStartup())) {
            storage.ensureBucket(config.getBucket());
        }
        return storage;
    }
}
