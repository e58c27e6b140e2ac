package com.example.embeddingindex;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;
import java.nio.file.Paths;

@Configuration
public class ObjectStorageConfig {

    @Bean
    @ConditionalOnProperty(prefix = "embeddingindex.storage", name = "type", havingValue = "local", matchIfMissing = true)
    public ObjectStorage localObjectStorage(EmbeddingIndexProperties props) {
        return new LocalObjectStorage(Paths.get(props.getStorage().getLocalRoot()));
    }

    @Configuration
    @ConditionalOnProperty(prefix = "embeddingindex.storage", name = "type", havingValue = "s3")
    static class S3StorageConfig {

        @Bean(destroyMethod = "close")
        public S3Client s3Client(EmbeddingIndexProperties props) {
            EmbeddingIndexProperties.S3 s3 = props.getStorage().getS3();
            var builder = S3Client.builder()
                    .region(Region.of(s3.getRegion()))
                    .credentialsProvider(credentials(s3))
                    .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(s3.isPathStyle()).build());
            if (s3.getEndpoint() != null && !s3.getEndpoint().isBlank()) {
                builder.endpointOverride(URI.create(s3.getEndpoint()));
            }
            return builder.build();
        }

        @Bean(destroyMethod = "close")
        public S3Presigner s3Presigner(EmbeddingIndexProperties props) {
            EmbeddingIndexProperties.S3 s3 = props.getStorage().getS3();
            var builder = S3Presigner.builder()
                    .region(Region.of(s3.getRegion()))
                    .credentialsProvider(credentials(s3))
                    .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(s3.isPathStyle()).build());
            if (s3.getEndpoint() != null && !s3.getEndpoint().isBlank()) {
                builder.endpointOverride(URI.create(s3.getEndpoint()));
            }
            return builder.build();
        }

        @Bean
        public ObjectStorage s3ObjectStorage(S3Client client, S3Presigner presigner, EmbeddingIndexProperties props) {
            return new S3ObjectStorage(client, presigner, props.getStorage().getS3().getBucket());
        }

        private static AwsCredentialsProvider credentials(EmbeddingIndexProperties.S3 s3) {
            if (s3.getAccessKeyId() != null && !s3.getAccessKeyId().isBlank()) {
                return StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(s3.getAccessKeyId(), s3.getSecretAccessKey()));
            }
            return DefaultCredentialsProvider.create();
        }
    }
}
