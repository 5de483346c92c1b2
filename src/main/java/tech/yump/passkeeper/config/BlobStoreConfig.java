package tech.yump.passkeeper.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import tech.yump.passkeeper.storage.BlobStore;
import tech.yump.passkeeper.storage.FileSystemBlobStore;
import tech.yump.passkeeper.storage.S3BlobStore;

import java.net.URI;

/**
 * Selects the blob store implementation from {@code passkeeper.blob-store.type}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class BlobStoreConfig {

    private static final String TYPE_PROPERTY = "passkeeper.blob-store.type";

    private final PassKeeperProperties properties;

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = TYPE_PROPERTY, havingValue = "s3")
    public S3Client s3Client() {
        PassKeeperProperties.BlobStoreProperties.S3Properties s3 = properties.blobStore().s3();

        AwsCredentialsProvider credentialsProvider;
        if (StringUtils.hasText(s3.accessKey())) {
            credentialsProvider = StaticCredentialsProvider.create(AwsBasicCredentials.create(s3.accessKey(), s3.secretKey()));
        } else {
            log.debug("No static S3 credentials configured, using the default AWS credentials chain.");
            credentialsProvider = DefaultCredentialsProvider.create();
        }

        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(s3.region()))
                .credentialsProvider(credentialsProvider)
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(s3.apiCallTimeout())
                        .build())
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(s3.pathStyleAccess())
                        .build());
        if (StringUtils.hasText(s3.endpoint())) {
            builder.endpointOverride(URI.create(s3.endpoint()));
        }
        log.info("Creating S3 client for region {} (endpoint: {}, path-style: {})",
                s3.region(), StringUtils.hasText(s3.endpoint()) ? s3.endpoint() : "default", s3.pathStyleAccess());
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = TYPE_PROPERTY, havingValue = "s3")
    public BlobStore s3BlobStore(S3Client s3Client) {
        return new S3BlobStore(s3Client, properties.blobStore().s3().bucket());
    }

    @Bean
    @ConditionalOnProperty(name = TYPE_PROPERTY, havingValue = "filesystem")
    public BlobStore fileSystemBlobStore() {
        return new FileSystemBlobStore(properties.blobStore().filesystem().path());
    }
}
