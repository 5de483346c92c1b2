package tech.yump.passkeeper.storage;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Blob store backed by an S3-compatible bucket (AWS S3 or MinIO).
 */
@Slf4j
public class S3BlobStore implements BlobStore {

    // If-None-Match lost to an existing object, or to a concurrent conditional write
    private static final int PRECONDITION_FAILED = 412;
    private static final int CONFLICT = 409;

    private final S3Client s3Client;
    private final String bucket;

    public S3BlobStore(S3Client s3Client, String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        log.info("S3BlobStore initialized for bucket: {}", bucket);
    }

    @Override
    public void putObject(String key, byte[] content) throws BlobStoreException {
        if (content == null) {
            throw new IllegalArgumentException("Content cannot be null for put operation.");
        }
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentLength((long) content.length)
                .contentType("application/octet-stream")
                .ifNoneMatch("*")
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
            log.info("Successfully uploaded blob to s3://{}/{} ({} bytes)", bucket, key, content.length);
        } catch (S3Exception e) {
            if (e.statusCode() == PRECONDITION_FAILED || e.statusCode() == CONFLICT) {
                log.warn("Refusing to overwrite existing blob s3://{}/{}", bucket, key);
                throw new BlobAlreadyExistsException("Blob already exists for key: " + key, e);
            }
            log.error("Failed to upload blob to s3://{}/{}: {}", bucket, key, e.getMessage(), e);
            throw new BlobStoreException("Failed to write blob for key: " + key, e);
        } catch (SdkException e) {
            log.error("Failed to upload blob to s3://{}/{}: {}", bucket, key, e.getMessage(), e);
            throw new BlobStoreException("Failed to write blob for key: " + key, e);
        }
    }

    @Override
    public byte[] getObject(String key) throws BlobStoreException {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(request);
            byte[] content = response.asByteArray();
            log.debug("Downloaded blob s3://{}/{} ({} bytes)", bucket, key, content.length);
            return content;
        } catch (NoSuchKeyException e) {
            log.error("Blob not found at s3://{}/{}", bucket, key);
            throw new BlobStoreException("Blob not found for key: " + key, e);
        } catch (SdkException e) {
            log.error("Failed to download blob from s3://{}/{}: {}", bucket, key, e.getMessage(), e);
            throw new BlobStoreException("Failed to read blob for key: " + key, e);
        }
    }

    @Override
    public void removeObject(String key) throws BlobStoreException {
        DeleteObjectRequest request = DeleteObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            s3Client.deleteObject(request);
            log.info("Successfully deleted blob s3://{}/{}", bucket, key);
        } catch (SdkException e) {
            log.error("Failed to delete blob s3://{}/{}: {}", bucket, key, e.getMessage(), e);
            throw new BlobStoreException("Failed to delete blob for key: " + key, e);
        }
    }
}
