package com.pgstash.configuration.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class ServerPaths {
    String serverName;
    Path backupDirectory;
    Path baseBackupsDirectory;
    Path walsDirectory;
    Path incomingWalsDirectory;
    Path streamingWalsDirectory;
    Path errorsDirectory;
    Path xlogDbFile;
    Path xlogDbLockFile;
    Path receiveWalLockFile;
    Path archiveWalLockFile;
    Path backupLockFile;
}
