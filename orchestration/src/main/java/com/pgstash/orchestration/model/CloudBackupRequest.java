package com.pgstash.orchestration.model;

import com.pgstash.configuration.properties.predefined.PgStashProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CloudBackupRequest {
    private String destinationUrl;
    private String serverName;
    private PgStashProperties.CompressionType compression;
    private EncryptionType encryption;
    private String profile;
    private String host;
    private String port;
    private String user;
    private boolean immediateCheckpoint;
}
