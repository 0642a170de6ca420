package com.williamcallahan.baptismdesk.config;

import com.williamcallahan.baptismdesk.storage.InMemoryObjectStorage;
import com.williamcallahan.baptismdesk.storage.ObjectStorage;
import com.williamcallahan.baptismdesk.storage.S3ObjectStorage;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * Object storage wiring. S3 (or an S3-compatible endpoint such as MinIO) by default;
 * {@code app.storage.type=memory} selects a process-local store for development and tests.
 */
@Configuration
public class StorageConfig {

    private static final Logger logger = LoggerFactory.getLogger(StorageConfig.class);

    @Configuration
    @ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "s3", matchIfMissing = true)
    static class S3StorageConfig {

        @Bean(destroyMethod = "close")
        public S3Client s3Client(AppProperties appProperties) {
            AppProperties.Storage storage = appProperties.getStorage();
            S3ClientBuilder builder = S3Client.builder()
                    .region(Region.of(storage.getRegion()))
                    .credentialsProvider(credentialsProvider(storage))
                    .serviceConfiguration(S3Configuration.builder()
                            .pathStyleAccessEnabled(storage.isPathStyleAccess())
                            .build());
            if (hasText(storage.getEndpoint())) {
                builder.endpointOverride(URI.create(storage.getEndpoint()));
            }
            return builder.build();
        }

        @Bean(destroyMethod = "close")
        public S3Presigner s3Presigner(AppProperties appProperties) {
            AppProperties.Storage storage = appProperties.getStorage();
            S3Presigner.Builder builder = S3Presigner.builder()
                    .region(Region.of(storage.getRegion()))
                    .credentialsProvider(credentialsProvider(storage))
                    .serviceConfiguration(S3Configuration.builder()
                            .pathStyleAccessEnabled(storage.isPathStyleAccess())
                            .build());
            if (hasText(storage.getEndpoint())) {
                builder.endpointOverride(URI.create(storage.getEndpoint()));
            }
            return builder.build();
        }

        @Bean
        public ObjectStorage objectStorage(S3Client s3Client, S3Presigner s3Presigner, AppProperties appProperties) {
            String bucket = appProperties.getStorage().getBucket();
            logger.info("Using S3 object storage (bucket={}, endpoint={})", bucket,
                    hasText(appProperties.getStorage().getEndpoint()) ? appProperties.getStorage().getEndpoint() : "aws");
            return new S3ObjectStorage(s3Client, s3Presigner, bucket);
        }

        private static AwsCredentialsProvider credentialsProvider(AppProperties.Storage storage) {
            if (hasText(storage.getAccessKeyId()) && hasText(storage.getSecretAccessKey())) {
                return StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(storage.getAccessKeyId(), storage.getSecretAccessKey()));
            }
            return DefaultCredentialsProvider.create();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "memory")
    static class InMemoryStorageConfig {

        @Bean
        public ObjectStorage objectStorage() {
            return new InMemoryObjectStorage();
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
