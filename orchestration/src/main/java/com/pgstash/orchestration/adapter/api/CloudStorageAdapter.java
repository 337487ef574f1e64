package com.pgstash.orchestration.adapter.api;

import com.pgstash.orchestration.exception.UploadException;
import com.pgstash.orchestration.model.UploadedPart;

import java.util.List;

/**
 * Object store operations needed to stream backups.
 */
public interface CloudStorageAdapter {

    /**
     * @return false when the object store can not be reached
     */
    boolean testConnectivity();

    /**
     * Creates the destination bucket if it does not exist.
     */
    void setupBucket();

    /**
     * @return upload id
     */
    String createMultipartUpload(String key) throws UploadException;

    UploadedPart uploadPart(String key, String uploadId, int partNumber, byte[] data, int length) throws UploadException;

    void completeMultipartUpload(String key, String uploadId, List<UploadedPart> parts) throws UploadException;

    /**
     * Aborts the upload and frees the space taken by its parts. Failures are logged, not thrown.
     */
    void abortMultipartUpload(String key, String uploadId);

    void uploadObject(String key, byte[] data) throws UploadException;
}
