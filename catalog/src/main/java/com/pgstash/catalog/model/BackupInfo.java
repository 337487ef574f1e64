package com.pgstash.catalog.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Metadata of one base backup. Persisted as {@code backup.info} by
 * {@link com.pgstash.catalog.store.BackupInfoFile}.
 */
@Data
@NoArgsConstructor
public class BackupInfo {
    private String backupId;
    private String serverName;
    private BackupStatus status = BackupStatus.EMPTY;
    private String mode;

    private String pgdata;
    private List<Tablespace> tablespaces;
    private Integer version;
    private Integer timeline;
    private String systemId;
    private Long xlogSegmentSize;

    private String beginWal;
    private String endWal;
    private String beginXlog;
    private String endXlog;
    private Long beginOffset;
    private Long endOffset;
    private OffsetDateTime beginTime;
    private OffsetDateTime endTime;

    private String configFile;
    private String hbaFile;
    private String identFile;
    private List<String> includedFiles;

    private String backupLabel;
    private CopyStats copyStats;
    private String compression;
    private String error;
    private Long size;

    public BackupInfo(String serverName, String backupId) {
        this.serverName = serverName;
        this.backupId = backupId;
    }

    /**
     * @throws IllegalStateException if the backup already reached DONE or FAILED
     */
    public void setStatus(BackupStatus status) {
        if (this.status != null && this.status.isTerminal() && this.status != status) {
            throw new IllegalStateException("Backup " + backupId + " is " + this.status + ", cannot change status to " + status);
        }
        this.status = status;
    }

    /**
     * @throws IllegalArgumentException on duplicate tablespace oids
     */
    public void setTablespaces(List<Tablespace> tablespaces) {
        if (tablespaces == null) {
            this.tablespaces = null;
            return;
        }
        Set<Long> oids = new HashSet<>();
        for (Tablespace tablespace : tablespaces) {
            if (!oids.add(tablespace.getOid())) {
                throw new IllegalArgumentException("Duplicate tablespace oid " + tablespace.getOid());
            }
        }
        this.tablespaces = new ArrayList<>(tablespaces);
    }

    public List<Tablespace> getTablespaces() {
        return tablespaces == null ? null : Collections.unmodifiableList(tablespaces);
    }

    public Set<Long> getTablespaceOids() {
        Set<Long> oids = new HashSet<>();
        if (tablespaces != null) {
            tablespaces.forEach(tablespace -> oids.add(tablespace.getOid()));
        }
        return oids;
    }

    /**
     * Major version part of {@code server_version_num}: 90603 gives 90600, 150002 gives 150000.
     */
    public Integer getMajorVersion() {
        if (version == null) {
            return null;
        }
        return version >= 100000 ? version / 10000 * 10000 : version / 100 * 100;
    }
}
