package tech.yump.passkeeper.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import tech.yump.passkeeper.auth.policy.OperationRule;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Configuration properties for the PassKeeper application under the 'passkeeper' prefix.
 */
@ConfigurationProperties(prefix = "passkeeper")
@Validated
public record PassKeeperProperties(

        @Valid
        @NotNull(message = "Security configuration (passkeeper.security) is required.")
        SecurityProperties security,

        @Valid
        @NotNull(message = "Access configuration (passkeeper.access) is required.")
        AccessProperties access,

        @Valid
        @NotNull(message = "Datasource configuration (passkeeper.datasource) is required.")
        DataSourceProperties datasource,

        @Valid
        @NotNull(message = "Blob store configuration (passkeeper.blob-store) is required.")
        BlobStoreProperties blobStore
) {

    // --- SecurityProperties ---
    @Validated
    public record SecurityProperties(
            @NotBlank(message = "Token signing key (passkeeper.security.sign-key) must be provided.")
            String signKey,

            @NotNull(message = "Token TTL (passkeeper.security.token-ttl) must be provided.")
            Duration tokenTtl,

            @NotBlank(message = "Field cipher key (passkeeper.security.fernet-key) must be provided.")
            String fernetKey,

            @NotBlank(message = "Blob cipher key (passkeeper.security.aes-key) must be provided.")
            String aesKey,

            @NotNull(message = "Field token cut-off (passkeeper.security.fields-issued-after) must be provided.")
            Instant fieldsIssuedAfter
    ) {
        // HS256 needs at least 256 bits of key material
        private static final int MIN_SIGN_KEY_BYTES = 32;

        @AssertTrue(message = "Token signing key (passkeeper.security.sign-key) must be at least 32 bytes long.")
        public boolean isSignKeyLongEnough() {
            return signKey == null || signKey.getBytes(StandardCharsets.UTF_8).length >= MIN_SIGN_KEY_BYTES;
        }

        @AssertTrue(message = "Token TTL (passkeeper.security.token-ttl) must be positive.")
        public boolean isTokenTtlPositive() {
            return tokenTtl == null || (!tokenTtl.isNegative() && !tokenTtl.isZero());
        }

        @Override
        public String toString() {
            return "SecurityProperties[signKey=******, tokenTtl=" + tokenTtl
                    + ", fernetKey=******, aesKey=******, fieldsIssuedAfter=" + fieldsIssuedAfter + ']';
        }
    }

    // --- AccessProperties ---
    @Validated
    public record AccessProperties(
            @NotEmpty(message = "At least one access rule (passkeeper.access.rules) must be provided.")
            @Valid
            List<OperationRule> rules
    ) {}

    // --- DataSourceProperties ---
    @Validated
    public record DataSourceProperties(
            @NotBlank(message = "Database URL (passkeeper.datasource.url) must be provided.")
            String url,

            @NotBlank(message = "Database username (passkeeper.datasource.username) must be provided.")
            String username,

            @NotNull(message = "Database password (passkeeper.datasource.password) must be provided.")
            char[] password,

            @Min(value = 1, message = "Pool size (passkeeper.datasource.maximum-pool-size) must be at least 1.")
            int maximumPoolSize,

            Duration connectionTimeout
    ) {
        public DataSourceProperties {
            if (maximumPoolSize == 0) {
                maximumPoolSize = 10;
            }
            if (connectionTimeout == null) {
                connectionTimeout = Duration.ofSeconds(30);
            }
        }

        @AssertTrue(message = "Database password (passkeeper.datasource.password) must not be empty.")
        public boolean isPasswordNotEmpty() {
            return password != null && password.length > 0;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            DataSourceProperties that = (DataSourceProperties) o;
            return maximumPoolSize == that.maximumPoolSize &&
                    Objects.equals(url, that.url) &&
                    Objects.equals(username, that.username) &&
                    Arrays.equals(password, that.password) &&
                    Objects.equals(connectionTimeout, that.connectionTimeout);
        }

        @Override
        public int hashCode() {
            int result = Objects.hash(url, username, maximumPoolSize, connectionTimeout);
            result = 31 * result + Arrays.hashCode(password);
            return result;
        }

        @Override
        public String toString() {
            // Avoid logging the password in toString()
            return "DataSourceProperties[" +
                    "url='" + url + '\'' +
                    ", username='" + username + '\'' +
                    ", password=******" +
                    ", maximumPoolSize=" + maximumPoolSize +
                    ", connectionTimeout=" + connectionTimeout +
                    ']';
        }
    }

    /**
     * Which blob store implementation holds encrypted file content.
     */
    public enum BlobStoreType {
        S3, FILESYSTEM
    }

    // --- BlobStoreProperties ---
    @Validated
    public record BlobStoreProperties(
            @NotNull(message = "Blob store type (passkeeper.blob-store.type: S3 or FILESYSTEM) must be specified.")
            BlobStoreType type,

            @Valid
            FileSystemProperties filesystem,

            @Valid
            S3Properties s3
    ) {
        @AssertTrue(message = "Filesystem blob store requires 'passkeeper.blob-store.filesystem.path'.")
        public boolean isFileSystemConfigValid() {
            return type != BlobStoreType.FILESYSTEM || filesystem != null;
        }

        @AssertTrue(message = "S3 blob store requires the 'passkeeper.blob-store.s3' section.")
        public boolean isS3ConfigValid() {
            return type != BlobStoreType.S3 || s3 != null;
        }

        @Validated
        public record FileSystemProperties(
                @NotBlank(message = "Blob store path (passkeeper.blob-store.filesystem.path) must be provided.")
                String path
        ) {}

        @Validated
        public record S3Properties(
                String endpoint,

                @NotBlank(message = "S3 region (passkeeper.blob-store.s3.region) must be provided.")
                String region,

                @NotBlank(message = "S3 bucket (passkeeper.blob-store.s3.bucket) must be provided.")
                String bucket,

                String accessKey,

                String secretKey,

                boolean pathStyleAccess,

                Duration apiCallTimeout
        ) {
            public S3Properties {
                if (apiCallTimeout == null) {
                    apiCallTimeout = Duration.ofSeconds(30);
                }
            }

            @AssertTrue(message = "S3 access key and secret key must be provided together.")
            public boolean isCredentialsPairValid() {
                return StringUtils.hasText(accessKey) == StringUtils.hasText(secretKey);
            }

            @Override
            public String toString() {
                return "S3Properties[endpoint=" + endpoint + ", region=" + region + ", bucket=" + bucket
                        + ", accessKey=" + accessKey + ", secretKey=******, pathStyleAccess=" + pathStyleAccess
                        + ", apiCallTimeout=" + apiCallTimeout + ']';
            }
        }
    }
}
