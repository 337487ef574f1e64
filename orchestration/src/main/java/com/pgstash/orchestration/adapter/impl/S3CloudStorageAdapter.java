package com.pgstash.orchestration.adapter.impl;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkClientException;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.auth.profile.ProfileCredentialsProvider;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.AbortMultipartUploadRequest;
import com.amazonaws.services.s3.model.CompleteMultipartUploadRequest;
import com.amazonaws.services.s3.model.HeadBucketRequest;
import com.amazonaws.services.s3.model.InitiateMultipartUploadRequest;
import com.amazonaws.services.s3.model.InitiateMultipartUploadResult;
import com.amazonaws.services.s3.model.ListPartsRequest;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PartETag;
import com.amazonaws.services.s3.model.PartListing;
import com.amazonaws.services.s3.model.PutObjectRequest;
import com.amazonaws.services.s3.model.UploadPartRequest;
import com.amazonaws.services.s3.model.UploadPartResult;
import com.pgstash.orchestration.adapter.api.CloudStorageAdapter;
import com.pgstash.orchestration.exception.UploadException;
import com.pgstash.orchestration.model.CloudDestinationUrl;
import com.pgstash.orchestration.model.EncryptionType;
import com.pgstash.orchestration.model.UploadedPart;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.ByteArrayInputStream;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
public class S3CloudStorageAdapter implements CloudStorageAdapter {
    private static final int HTTP_NOT_FOUND = 404;
    private static final int ABORT_ATTEMPTS = 5;
    private static final long ABORT_RETRY_INTERVAL_MS = 1000;

    private final AmazonS3 s3Client;
    private final CloudDestinationUrl destinationUrl;
    private final EncryptionType encryption;

    public S3CloudStorageAdapter(AmazonS3 s3Client, CloudDestinationUrl destinationUrl, EncryptionType encryption) {
        this.s3Client = s3Client;
        this.destinationUrl = destinationUrl;
        this.encryption = encryption;
    }

    /**
     * Builds a client with credentials from the named profile, or from the default provider chain when
     * {@code profile} is blank.
     */
    public static S3CloudStorageAdapter create(CloudDestinationUrl destinationUrl, EncryptionType encryption, String profile) {
        AWSCredentialsProvider credentialsProvider = StringUtils.isBlank(profile)
                ? DefaultAWSCredentialsProviderChain.getInstance()
                : new ProfileCredentialsProvider(profile);

        AmazonS3 s3Client = AmazonS3ClientBuilder
                .standard()
                .withCredentials(credentialsProvider)
                .build();

        return new S3CloudStorageAdapter(s3Client, destinationUrl, encryption);
    }

    public CloudDestinationUrl getDestinationUrl() {
        return destinationUrl;
    }

    @Override
    public boolean testConnectivity() {
        try {
            // only reachability matters, not whether the bucket exists
            s3Client.doesBucketExistV2(destinationUrl.getBucketName());
            return true;
        } catch (AmazonServiceException e) {
            return true;
        } catch (SdkClientException e) {
            log.error("Can't connect to S3: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void setupBucket() {
        String bucketName = destinationUrl.getBucketName();
        try {
            s3Client.headBucket(new HeadBucketRequest(bucketName));
        } catch (AmazonServiceException e) {
            if (e.getStatusCode() != HTTP_NOT_FOUND) {
                throw e;
            }
            log.debug("Bucket {} does not exist, creating it", bucketName);
            s3Client.createBucket(bucketName);
        }
    }

    @Override
    public String createMultipartUpload(String key) throws UploadException {
        InitiateMultipartUploadRequest initRequest = new InitiateMultipartUploadRequest(destinationUrl.getBucketName(), key);
        initRequest.setObjectMetadata(createMetadata());
        try {
            InitiateMultipartUploadResult initResponse = s3Client.initiateMultipartUpload(initRequest);
            return initResponse.getUploadId();
        } catch (Exception e) {
            throw new UploadException("Failed to start upload of " + key, e);
        }
    }

    @Override
    public UploadedPart uploadPart(String key, String uploadId, int partNumber, byte[] data, int length) throws UploadException {
        UploadPartRequest uploadRequest = new UploadPartRequest()
                .withBucketName(destinationUrl.getBucketName())
                .withKey(key)
                .withUploadId(uploadId)
                .withPartSize(length)
                .withPartNumber(partNumber)
                .withInputStream(new ByteArrayInputStream(data, 0, length));
        try {
            UploadPartResult uploadResult = s3Client.uploadPart(uploadRequest);
            return new UploadedPart(partNumber, uploadResult.getPartETag().getETag());
        } catch (Exception e) {
            throw new UploadException("Failed to upload part " + partNumber + " of " + key, e);
        }
    }

    @Override
    public void completeMultipartUpload(String key, String uploadId, List<UploadedPart> parts) throws UploadException {
        List<PartETag> eTags = parts.stream()
                .map(part -> new PartETag(part.getPartNumber(), part.getETag()))
                .collect(Collectors.toList());
        try {
            s3Client.completeMultipartUpload(
                    new CompleteMultipartUploadRequest(destinationUrl.getBucketName(), key, uploadId, eTags)
            );
        } catch (Exception e) {
            throw new UploadException("Failed to complete upload of " + key, e);
        }
    }

    @Override
    public void abortMultipartUpload(String key, String uploadId) {
        String bucketName = destinationUrl.getBucketName();

        // parts being uploaded while aborting can survive the first abort
        for (int attempt = 1; attempt <= ABORT_ATTEMPTS; attempt++) {
            try {
                s3Client.abortMultipartUpload(new AbortMultipartUploadRequest(bucketName, key, uploadId));
                PartListing partListing = s3Client.listParts(new ListPartsRequest(bucketName, key, uploadId));
                if (CollectionUtils.isEmpty(partListing.getParts())) {
                    return;
                }
                Thread.sleep(ABORT_RETRY_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Interrupted while aborting upload of {}", key);
                return;
            } catch (AmazonServiceException e) {
                if (e.getStatusCode() == HTTP_NOT_FOUND) {
                    return;
                }
                log.error("Failed to abort upload of {}", key, e);
                return;
            } catch (Exception e) {
                log.error("Failed to abort upload of {}", key, e);
                return;
            }
        }
        log.error("Upload {} of {} still has parts after {} abort attempts. Consider removing them manually.", uploadId, key, ABORT_ATTEMPTS);
    }

    @Override
    public void uploadObject(String key, byte[] data) throws UploadException {
        ObjectMetadata metadata = createMetadata();
        metadata.setContentLength(data.length);
        try {
            s3Client.putObject(new PutObjectRequest(destinationUrl.getBucketName(), key, new ByteArrayInputStream(data), metadata));
        } catch (Exception e) {
            throw new UploadException("Failed to upload " + key, e);
        }
    }

    private ObjectMetadata createMetadata() {
        ObjectMetadata metadata = new ObjectMetadata();
        if (encryption != null) {
            metadata.setSSEAlgorithm(encryption.getValue());
        }
        return metadata;
    }
}
