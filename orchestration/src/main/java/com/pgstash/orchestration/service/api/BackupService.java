package com.pgstash.orchestration.service.api;

import com.pgstash.catalog.model.BackupInfo;

public interface BackupService {

    /**
     * Takes a base backup of the server into its backup directory.
     *
     * @return metadata of the completed backup
     */
    BackupInfo backup(String serverName);
}
