package com.pgstash.quarkusroot.command;

import com.pgstash.catalog.model.BackupInfo;
import com.pgstash.configuration.properties.predefined.PgStashProperties;
import com.pgstash.orchestration.model.CloudBackupRequest;
import com.pgstash.orchestration.model.EncryptionType;
import com.pgstash.orchestration.service.api.CloudBackupService;
import com.pgstash.quarkusroot.PgStashCommand;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

import java.util.logging.Level;

/**
 * Backs up a PostgreSQL server running on this host straight into S3, without a local copy.
 */
@Slf4j
@CommandLine.Command(
        name = "cloud-backup",
        description = "This script can be used to perform a backup of a local PostgreSQL instance "
                + "and ship the resulting tarball(s) to the Cloud.",
        versionProvider = PgStashCommand.VersionProvider.class
)
public class CloudBackupCommand extends AbstractPgStashCommand {

    @CommandLine.Parameters(index = "0", paramLabel = "DESTINATION_URL", description = "URL of the cloud destination, such as a bucket in AWS S3. For example: `s3://bucket/path/to/folder`.")
    String destinationUrl;

    @CommandLine.Parameters(index = "1", paramLabel = "SERVER_NAME", description = "The name of the server as configured in PgStash.")
    String serverName;

    @CommandLine.ArgGroup(exclusive = true)
    CompressionOptions compressionOptions;

    @CommandLine.Option(names = {"-e", "--encrypt"}, paramLabel = "{AES256,aws:kms}", converter = EncryptionConverter.class,
            description = "Enable server-side encryption for the transfer. Allowed values: 'AES256', 'aws:kms'.")
    EncryptionType encryption;

    @CommandLine.Option(names = {"-t", "--test"}, description = "Test cloud connectivity and exit.")
    boolean test;

    @CommandLine.Option(names = {"-P", "--profile"}, description = "Profile name (e.g. INI section in AWS credentials file).")
    String profile;

    @CommandLine.Option(names = {"-h", "--host"}, description = "Host or Unix socket for PostgreSQL connection (default: libpq settings).")
    String host;

    @CommandLine.Option(names = {"-p", "--port"}, description = "Port for PostgreSQL connection (default: libpq settings).")
    String port;

    @CommandLine.Option(names = {"-U", "--user"}, description = "User name for PostgreSQL connection (default: libpq settings).")
    String user;

    @CommandLine.Option(names = "--immediate-checkpoint", description = "Forces the initial checkpoint to be done as quickly as possible.")
    boolean immediateCheckpoint;

    @CommandLine.Option(names = {"-V", "--version"}, versionHelp = true, description = "Show program's version number and exit.")
    boolean versionRequested;

    @Inject
    CloudBackupService cloudBackupService;

    static class CompressionOptions {
        @CommandLine.Option(names = {"-z", "--gzip"}, description = "Gzip-compress the tar files when uploading to the cloud.")
        boolean gzip;

        @CommandLine.Option(names = {"-j", "--bzip2"}, description = "Bzip2-compress the tar files when uploading to the cloud.")
        boolean bzip2;
    }

    static class EncryptionConverter implements CommandLine.ITypeConverter<EncryptionType> {
        @Override
        public EncryptionType convert(String value) {
            try {
                return EncryptionType.fromValue(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    @Override
    protected Level getDefaultLogLevel() {
        return Level.WARNING;
    }

    @Override
    protected int execute() {
        CloudBackupRequest request = buildRequest();

        if (test) {
            if (cloudBackupService.testConnectivity(request)) {
                return ExitCodes.OK;
            }
            log.error("Cloud destination {} is not reachable", destinationUrl);
            return ExitCodes.FAILURE;
        }

        BackupInfo backupInfo = cloudBackupService.backup(request);
        log.info("Backup {} of server {} uploaded to {}", backupInfo.getBackupId(), serverName, destinationUrl);
        return ExitCodes.OK;
    }

    CloudBackupRequest buildRequest() {
        return CloudBackupRequest.builder()
                .destinationUrl(destinationUrl)
                .serverName(serverName)
                .compression(getCompression())
                .encryption(encryption)
                .profile(profile)
                .host(host)
                .port(port)
                .user(user)
                .immediateCheckpoint(immediateCheckpoint)
                .build();
    }

    private PgStashProperties.CompressionType getCompression() {
        if (compressionOptions == null) {
            return null;
        }
        if (compressionOptions.gzip) {
            return PgStashProperties.CompressionType.GZIP;
        }
        if (compressionOptions.bzip2) {
            return PgStashProperties.CompressionType.BZIP2;
        }
        return null;
    }
}
