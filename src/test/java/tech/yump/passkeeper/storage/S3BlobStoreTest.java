package tech.yump.passkeeper.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class S3BlobStoreTest {

    private static final String BUCKET = "storage-dev";
    private static final String KEY = "3f2a9c1e-8d4b-4e21-9a57-1c0d2e3f4a5b/report.pdf";

    @Mock
    private S3Client mockS3Client;

    private S3BlobStore blobStore;

    @BeforeEach
    void setUp() {
        blobStore = new S3BlobStore(mockS3Client, BUCKET);
    }

    @Test
    @DisplayName("PutObject should upload to the configured bucket under the given key")
    void putObject_UploadsToBucket() {
        blobStore.putObject(KEY, new byte[]{1, 2, 3, 4});

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(mockS3Client).putObject(captor.capture(), any(RequestBody.class));
        assertThat(captor.getValue().bucket()).isEqualTo(BUCKET);
        assertThat(captor.getValue().key()).isEqualTo(KEY);
        assertThat(captor.getValue().contentLength()).isEqualTo(4L);
        assertThat(captor.getValue().ifNoneMatch()).isEqualTo("*");
    }

    @Test
    @DisplayName("PutObject should refuse to replace an existing object")
    void putObject_WhenKeyTaken_ThrowsBlobAlreadyExistsException() {
        when(mockS3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(S3Exception.builder()
                        .statusCode(412)
                        .message("At least one of the pre-conditions you specified did not hold")
                        .build());

        assertThatThrownBy(() -> blobStore.putObject(KEY, new byte[]{1}))
                .isInstanceOf(BlobAlreadyExistsException.class)
                .hasMessage("Blob already exists for key: " + KEY);
    }

    @Test
    @DisplayName("PutObject should wrap other S3 errors as plain blob store failures")
    void putObject_WhenS3Denies_ThrowsBlobStoreException() {
        when(mockS3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(S3Exception.builder().statusCode(403).message("Access Denied").build());

        assertThatThrownBy(() -> blobStore.putObject(KEY, new byte[]{1}))
                .isInstanceOf(BlobStoreException.class)
                .isNotInstanceOf(BlobAlreadyExistsException.class)
                .hasMessage("Failed to write blob for key: " + KEY);
    }

    @Test
    @DisplayName("PutObject should wrap SDK failures")
    void putObject_WhenSdkFails_ThrowsBlobStoreException() {
        when(mockS3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("connection refused"));

        assertThatThrownBy(() -> blobStore.putObject(KEY, new byte[]{1}))
                .isInstanceOf(BlobStoreException.class)
                .hasCauseInstanceOf(SdkClientException.class);
    }

    @Test
    @DisplayName("GetObject should return the downloaded bytes")
    void getObject_ReturnsBytes() {
        byte[] content = {9, 8, 7};
        when(mockS3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), content));

        assertThat(blobStore.getObject(KEY)).isEqualTo(content);
    }

    @Test
    @DisplayName("GetObject should report a missing key as a blob store failure")
    void getObject_WhenMissing_ThrowsBlobStoreException() {
        when(mockS3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("The specified key does not exist.").build());

        assertThatThrownBy(() -> blobStore.getObject(KEY))
                .isInstanceOf(BlobStoreException.class)
                .hasMessage("Blob not found for key: " + KEY);
    }

    @Test
    @DisplayName("RemoveObject should delete the key from the bucket")
    void removeObject_DeletesKey() {
        blobStore.removeObject(KEY);

        ArgumentCaptor<DeleteObjectRequest> captor = ArgumentCaptor.forClass(DeleteObjectRequest.class);
        verify(mockS3Client).deleteObject(captor.capture());
        assertThat(captor.getValue().bucket()).isEqualTo(BUCKET);
        assertThat(captor.getValue().key()).isEqualTo(KEY);
    }
}
