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
public class BackupStartResult {
    private String location;
    private Integer timeline;
    private OffsetDateTime timestamp;
}
