package com.pgstash.orchestration.adapter.impl;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.AbortMultipartUploadRequest;
import com.amazonaws.services.s3.model.CompleteMultipartUploadRequest;
import com.amazonaws.services.s3.model.HeadBucketRequest;
import com.amazonaws.services.s3.model.InitiateMultipartUploadRequest;
import com.amazonaws.services.s3.model.InitiateMultipartUploadResult;
import com.amazonaws.services.s3.model.ListPartsRequest;
import com.amazonaws.services.s3.model.PartListing;
import com.amazonaws.services.s3.model.PutObjectRequest;
import com.amazonaws.services.s3.model.UploadPartRequest;
import com.amazonaws.services.s3.model.UploadPartResult;
import com.pgstash.orchestration.exception.UploadException;
import com.pgstash.orchestration.model.CloudDestinationUrl;
import com.pgstash.orchestration.model.EncryptionType;
import com.pgstash.orchestration.model.UploadedPart;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("S3CloudStorageAdapter")
@ExtendWith(MockitoExtension.class)
class S3CloudStorageAdapterTest {

    @Mock
    private AmazonS3 s3Client;

    private S3CloudStorageAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new S3CloudStorageAdapter(s3Client, CloudDestinationUrl.parse("s3://bucket/path"), EncryptionType.AES256);
    }

    @Nested
    @DisplayName("connectivity")
    class Connectivity {

        @Test
        @DisplayName("should report reachable when the bucket check answers")
        void shouldBeReachable() {
            when(s3Client.doesBucketExistV2("bucket")).thenReturn(false);

            assertThat(adapter.testConnectivity()).isTrue();
        }

        @Test
        @DisplayName("should report reachable when the service answers with an error")
        void shouldBeReachableOnServiceError() {
            when(s3Client.doesBucketExistV2("bucket")).thenThrow(serviceException(403));

            assertThat(adapter.testConnectivity()).isTrue();
        }

        @Test
        @DisplayName("should report unreachable on client errors")
        void shouldBeUnreachable() {
            when(s3Client.doesBucketExistV2("bucket")).thenThrow(new SdkClientException("Unable to execute HTTP request"));

            assertThat(adapter.testConnectivity()).isFalse();
        }
    }

    @Nested
    @DisplayName("bucket setup")
    class BucketSetup {

        @Test
        @DisplayName("should create a missing bucket")
        void shouldCreateMissingBucket() {
            when(s3Client.headBucket(any(HeadBucketRequest.class))).thenThrow(serviceException(404));

            adapter.setupBucket();

            verify(s3Client).createBucket("bucket");
        }

        @Test
        @DisplayName("should leave an existing bucket alone")
        void shouldKeepExistingBucket() {
            adapter.setupBucket();

            verify(s3Client, never()).createBucket(any(String.class));
        }

        @Test
        @DisplayName("should propagate other errors")
        void shouldPropagateErrors() {
            when(s3Client.headBucket(any(HeadBucketRequest.class))).thenThrow(serviceException(403));

            assertThatThrownBy(() -> adapter.setupBucket()).isInstanceOf(AmazonServiceException.class);
        }
    }

    @Nested
    @DisplayName("multipart upload")
    class Multipart {

        @Test
        @DisplayName("should request server side encryption")
        void shouldEncrypt() {
            InitiateMultipartUploadResult result = new InitiateMultipartUploadResult();
            result.setUploadId("upload-1");
            when(s3Client.initiateMultipartUpload(any())).thenReturn(result);

            assertThat(adapter.createMultipartUpload("path/main/data.tar")).isEqualTo("upload-1");

            ArgumentCaptor<InitiateMultipartUploadRequest> request = ArgumentCaptor.forClass(InitiateMultipartUploadRequest.class);
            verify(s3Client).initiateMultipartUpload(request.capture());
            assertThat(request.getValue().getBucketName()).isEqualTo("bucket");
            assertThat(request.getValue().getKey()).isEqualTo("path/main/data.tar");
            assertThat(request.getValue().getObjectMetadata().getSSEAlgorithm()).isEqualTo("AES256");
        }

        @Test
        @DisplayName("should return the part etag")
        void shouldUploadPart() {
            UploadPartResult result = new UploadPartResult();
            result.setPartNumber(3);
            result.setETag("abc");
            when(s3Client.uploadPart(any())).thenReturn(result);

            UploadedPart part = adapter.uploadPart("key", "upload-1", 3, new byte[]{1, 2, 3, 4}, 2);

            assertThat(part.getPartNumber()).isEqualTo(3);
            assertThat(part.getETag()).isEqualTo("abc");
            ArgumentCaptor<UploadPartRequest> request = ArgumentCaptor.forClass(UploadPartRequest.class);
            verify(s3Client).uploadPart(request.capture());
            assertThat(request.getValue().getPartSize()).isEqualTo(2);
            assertThat(request.getValue().getUploadId()).isEqualTo("upload-1");
        }

        @Test
        @DisplayName("should complete with every part in order")
        void shouldComplete() {
            adapter.completeMultipartUpload("key", "upload-1", List.of(new UploadedPart(1, "a"), new UploadedPart(2, "b")));

            ArgumentCaptor<CompleteMultipartUploadRequest> request = ArgumentCaptor.forClass(CompleteMultipartUploadRequest.class);
            verify(s3Client).completeMultipartUpload(request.capture());
            assertThat(request.getValue().getPartETags()).extracting("partNumber").containsExactly(1, 2);
        }

        @Test
        @DisplayName("should wrap failures in UploadException")
        void shouldWrapFailures() {
            when(s3Client.uploadPart(any())).thenThrow(new SdkClientException("connection reset"));

            assertThatThrownBy(() -> adapter.uploadPart("key", "upload-1", 1, new byte[1], 1))
                    .isInstanceOf(UploadException.class)
                    .hasMessageContaining("part 1");
        }

        @Test
        @DisplayName("should stop aborting once no part is left")
        void shouldAbort() {
            when(s3Client.listParts(any(ListPartsRequest.class))).thenReturn(new PartListing());

            adapter.abortMultipartUpload("key", "upload-1");

            verify(s3Client, times(1)).abortMultipartUpload(any(AbortMultipartUploadRequest.class));
        }

        @Test
        @DisplayName("should treat a vanished upload as aborted")
        void shouldAcceptVanishedUpload() {
            when(s3Client.listParts(any(ListPartsRequest.class))).thenThrow(serviceException(404));

            adapter.abortMultipartUpload("key", "upload-1");

            verify(s3Client, times(1)).abortMultipartUpload(any(AbortMultipartUploadRequest.class));
        }
    }

    @Test
    @DisplayName("should upload standalone objects with their length")
    void shouldUploadObject() {
        adapter.uploadObject("path/main/base/1/backup.info", new byte[]{1, 2, 3});

        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(request.capture());
        assertThat(request.getValue().getKey()).isEqualTo("path/main/base/1/backup.info");
        assertThat(request.getValue().getMetadata().getContentLength()).isEqualTo(3);
        assertThat(request.getValue().getMetadata().getSSEAlgorithm()).isEqualTo("AES256");
    }

    private static AmazonServiceException serviceException(int statusCode) {
        AmazonServiceException exception = new AmazonServiceException("status " + statusCode);
        exception.setStatusCode(statusCode);
        return exception;
    }
}
