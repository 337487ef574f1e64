package com.pgstash.orchestration.copy;

import com.pgstash.catalog.model.BackupInfo;
import com.pgstash.catalog.model.ConfigFile;
import com.pgstash.catalog.model.Tablespace;
import com.pgstash.configuration.properties.constant.PgStashConstants;
import com.pgstash.orchestration.constant.PostgresPlumbingConstants;
import com.pgstash.orchestration.model.ItemClass;
import com.pgstash.postgres.model.PostgresVersion;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.io.FilenameUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns the layout of a running server, as recorded in {@link BackupInfo}, into copy jobs.
 * Destinations are logical: {@code data} for PGDATA and the oid for every tablespace.
 */
@Slf4j
@ApplicationScoped
public class BackupCopyPlanner {

    /**
     * Registers tablespace, PGDATA, pg_control and external configuration file jobs.
     *
     * @param reuseBackupDirectory directory of the backup to reuse, or null
     * @return included configuration files that live outside PGDATA and are not copied
     */
    public List<String> plan(BackupInfo backupInfo, BackupCopyController controller, Path reuseBackupDirectory, Integer bwlimit) {
        String pgdata = backupInfo.getPgdata();
        String majorVersion = PostgresVersion.fromVersionNum(backupInfo.getVersion()).toString();

        List<String> excludeAndProtect = new ArrayList<>();

        for (Tablespace tablespace : ListUtils.emptyIfNull(backupInfo.getTablespaces())) {
            if (isInside(pgdata, tablespace.getLocation())) {
                excludeAndProtect.add(tablespace.getLocation().substring(stripTrailingSlash(pgdata).length()));
            }
            excludeAndProtect.add(String.format(PostgresPlumbingConstants.TABLESPACE_LINK_FORMAT, tablespace.getOid()));

            String dst = String.valueOf(tablespace.getOid());

            List<String> exclude = new ArrayList<>();
            exclude.add("/*");
            exclude.addAll(PostgresPlumbingConstants.EXCLUDE_LIST);

            controller.addDirectory(
                    tablespace.getName(),
                    tablespace.getLocation(),
                    dst,
                    exclude,
                    null,
                    List.of(String.format(PostgresPlumbingConstants.TABLESPACE_INCLUDE_FORMAT, majorVersion)),
                    reuseBackupDirectory == null ? null : reuseBackupDirectory.resolve(dst),
                    bwlimit,
                    ItemClass.TABLESPACE
            );
        }

        List<String> pgdataExclude = new ArrayList<>(PostgresPlumbingConstants.PGDATA_EXCLUDE_LIST);
        pgdataExclude.addAll(PostgresPlumbingConstants.EXCLUDE_LIST);

        controller.addDirectory(
                "pgdata",
                pgdata,
                PgStashConstants.BACKUP_DATA_DIRECTORY_NAME,
                pgdataExclude,
                excludeAndProtect,
                null,
                reuseBackupDirectory == null ? null : reuseBackupDirectory.resolve(PgStashConstants.BACKUP_DATA_DIRECTORY_NAME),
                bwlimit,
                ItemClass.PGDATA
        );

        controller.addFile(
                "pg_control",
                stripTrailingSlash(pgdata) + "/" + PostgresPlumbingConstants.PG_CONTROL_PATH,
                PgStashConstants.BACKUP_DATA_DIRECTORY_NAME,
                PostgresPlumbingConstants.PG_CONTROL_PATH,
                ItemClass.CONTROL,
                false
        );

        for (ConfigFile configFile : getExternalConfigFiles(backupInfo)) {
            controller.addFile(
                    configFile.getFileType().getSettingName(),
                    configFile.getPath(),
                    PgStashConstants.BACKUP_DATA_DIRECTORY_NAME,
                    FilenameUtils.getName(configFile.getPath()),
                    ItemClass.CONFIG,
                    configFile.getFileType().isOptional()
            );
        }

        List<String> externalIncludes = ListUtils.emptyIfNull(backupInfo.getIncludedFiles())
                .stream()
                .filter(path -> !isInside(pgdata, path))
                .collect(Collectors.toList());

        if (!externalIncludes.isEmpty()) {
            log.warn("The usage of include directives is not supported for files that reside outside PGDATA. "
                            + "Please manually backup the following files:\n\t{}",
                    String.join("\n\t", externalIncludes));
        }

        return externalIncludes;
    }

    /**
     * Main, hba and ident files that live outside PGDATA.
     */
    public List<ConfigFile> getExternalConfigFiles(BackupInfo backupInfo) {
        List<ConfigFile> result = new ArrayList<>();
        addIfExternal(result, backupInfo, ConfigFile.FileType.CONFIG_FILE, backupInfo.getConfigFile());
        addIfExternal(result, backupInfo, ConfigFile.FileType.HBA_FILE, backupInfo.getHbaFile());
        addIfExternal(result, backupInfo, ConfigFile.FileType.IDENT_FILE, backupInfo.getIdentFile());
        return result;
    }

    private static void addIfExternal(List<ConfigFile> result, BackupInfo backupInfo, ConfigFile.FileType fileType, String path) {
        if (path != null && !isInside(backupInfo.getPgdata(), path)) {
            result.add(ConfigFile.builder().fileType(fileType).path(path).build());
        }
    }

    static boolean isInside(String directory, String path) {
        if (directory == null || path == null) {
            return false;
        }
        return path.startsWith(stripTrailingSlash(directory) + "/");
    }

    private static String stripTrailingSlash(String path) {
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
