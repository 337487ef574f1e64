package com.pgstash.catalog.store;

import com.pgstash.catalog.model.BackupInfo;
import com.pgstash.catalog.model.BackupStatus;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Base backups of one server, each stored as {@code <base>/<backupId>/backup.info}.
 */
@Slf4j
public class BackupCatalog {
    public static final DateTimeFormatter BACKUP_ID_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");
    public static final Set<BackupStatus> DEFAULT_STATUS_FILTER = EnumSet.of(BackupStatus.DONE);

    private static final String BACKUP_INFO_FILE_NAME = "backup.info";

    private final Path baseBackupsDirectory;

    public BackupCatalog(Path baseBackupsDirectory) {
        this.baseBackupsDirectory = baseBackupsDirectory;
    }

    /**
     * Backups with one of the given statuses, sorted by id. Unreadable backup.info files are skipped.
     */
    public List<BackupInfo> getAvailableBackups(Set<BackupStatus> statuses) {
        List<BackupInfo> backups = new ArrayList<>();
        for (String backupId : listBackupIds()) {
            Path infoFile = getBackupInfoFile(backupId);
            if (!Files.isRegularFile(infoFile)) {
                continue;
            }
            try {
                BackupInfo backupInfo = BackupInfoFile.load(infoFile);
                if (statuses.contains(backupInfo.getStatus())) {
                    backups.add(backupInfo);
                }
            } catch (IllegalArgumentException | UncheckedIOException e) {
                log.warn("Skipping unreadable backup info {}", infoFile, e);
            }
        }
        return backups;
    }

    public Optional<BackupInfo> getBackup(String backupId) {
        Path infoFile = getBackupInfoFile(backupId);
        if (!Files.isRegularFile(infoFile)) {
            return Optional.empty();
        }
        return Optional.of(BackupInfoFile.load(infoFile));
    }

    public Optional<BackupInfo> getPreviousBackup(String backupId, Set<BackupStatus> statuses) {
        return getAvailableBackups(statuses).stream()
                .filter(backup -> backup.getBackupId().compareTo(backupId) < 0)
                .reduce((first, second) -> second);
    }

    public Optional<BackupInfo> getNextBackup(String backupId, Set<BackupStatus> statuses) {
        return getAvailableBackups(statuses).stream()
                .filter(backup -> backup.getBackupId().compareTo(backupId) > 0)
                .findFirst();
    }

    public Optional<BackupInfo> getLastBackup(Set<BackupStatus> statuses) {
        return getAvailableBackups(statuses).stream()
                .reduce((first, second) -> second);
    }

    /**
     * New backup id from {@code now}, moved forward one second at a time until it sorts after every existing id.
     */
    public String newBackupId(LocalDateTime now) {
        List<String> existing = listBackupIds();
        String last = existing.isEmpty() ? null : existing.get(existing.size() - 1);

        LocalDateTime candidate = now.withNano(0);
        String backupId = BACKUP_ID_FORMATTER.format(candidate);
        while (last != null && backupId.compareTo(last) <= 0) {
            candidate = candidate.plusSeconds(1);
            backupId = BACKUP_ID_FORMATTER.format(candidate);
        }
        return backupId;
    }

    public void save(BackupInfo backupInfo) {
        BackupInfoFile.save(backupInfo, getBackupInfoFile(backupInfo.getBackupId()));
    }

    public Path getBackupDirectory(String backupId) {
        return baseBackupsDirectory.resolve(backupId);
    }

    public Path getBackupInfoFile(String backupId) {
        return getBackupDirectory(backupId).resolve(BACKUP_INFO_FILE_NAME);
    }

    private List<String> listBackupIds() {
        if (!Files.isDirectory(baseBackupsDirectory)) {
            return new ArrayList<>();
        }
        try (Stream<Path> children = Files.list(baseBackupsDirectory)) {
            return children
                    .filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .sorted(Comparator.naturalOrder())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list backups in " + baseBackupsDirectory, e);
        }
    }
}
