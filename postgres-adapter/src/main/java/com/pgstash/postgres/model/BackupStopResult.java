package com.pgstash.postgres.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupStopResult {
    private String location;
    private String backupLabel;
    private String tablespaceMap;
    private OffsetDateTime timestamp;
}
