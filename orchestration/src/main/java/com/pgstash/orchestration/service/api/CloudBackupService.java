package com.pgstash.orchestration.service.api;

import com.pgstash.catalog.model.BackupInfo;
import com.pgstash.orchestration.model.CloudBackupRequest;

public interface CloudBackupService {

    /**
     * @return false when the object store can not be reached
     */
    boolean testConnectivity(CloudBackupRequest request);

    /**
     * Streams a base backup of a local PostgreSQL server into the object store.
     */
    BackupInfo backup(CloudBackupRequest request);
}
