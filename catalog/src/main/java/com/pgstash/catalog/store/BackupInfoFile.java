package com.pgstash.catalog.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgstash.catalog.model.BackupInfo;
import com.pgstash.catalog.model.BackupStatus;
import com.pgstash.catalog.model.CopyStats;
import com.pgstash.catalog.model.Tablespace;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Reads and writes {@link BackupInfo} as {@code field=value} lines.
 * Every persisted attribute is listed in {@link #FIELDS}, in file order. Null attributes are not written.
 */
public class BackupInfoFile {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final TypeReference<List<Tablespace>> TABLESPACES_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {
    };

    static final Map<String, Field> FIELDS = new LinkedHashMap<>();

    static {
        field("backup_id", BackupInfo::getBackupId, BackupInfo::setBackupId);
        field("server_name", BackupInfo::getServerName, BackupInfo::setServerName);
        field("status", info -> info.getStatus() == null ? null : info.getStatus().name(),
                (info, value) -> info.setStatus(BackupStatus.valueOf(value)));
        field("mode", BackupInfo::getMode, BackupInfo::setMode);
        field("pgdata", BackupInfo::getPgdata, BackupInfo::setPgdata);
        field("tablespaces", info -> toJson(info.getTablespaces()),
                (info, value) -> info.setTablespaces(fromJson(value, TABLESPACES_TYPE)));
        field("version", info -> toStringOrNull(info.getVersion()),
                (info, value) -> info.setVersion(Integer.valueOf(value)));
        field("timeline", info -> toStringOrNull(info.getTimeline()),
                (info, value) -> info.setTimeline(Integer.valueOf(value)));
        field("systemid", BackupInfo::getSystemId, BackupInfo::setSystemId);
        field("xlog_segment_size", info -> toStringOrNull(info.getXlogSegmentSize()),
                (info, value) -> info.setXlogSegmentSize(Long.valueOf(value)));
        field("begin_wal", BackupInfo::getBeginWal, BackupInfo::setBeginWal);
        field("end_wal", BackupInfo::getEndWal, BackupInfo::setEndWal);
        field("begin_xlog", BackupInfo::getBeginXlog, BackupInfo::setBeginXlog);
        field("end_xlog", BackupInfo::getEndXlog, BackupInfo::setEndXlog);
        field("begin_offset", info -> toStringOrNull(info.getBeginOffset()),
                (info, value) -> info.setBeginOffset(Long.valueOf(value)));
        field("end_offset", info -> toStringOrNull(info.getEndOffset()),
                (info, value) -> info.setEndOffset(Long.valueOf(value)));
        field("begin_time", info -> toStringOrNull(info.getBeginTime()),
                (info, value) -> info.setBeginTime(OffsetDateTime.parse(value)));
        field("end_time", info -> toStringOrNull(info.getEndTime()),
                (info, value) -> info.setEndTime(OffsetDateTime.parse(value)));
        field("config_file", BackupInfo::getConfigFile, BackupInfo::setConfigFile);
        field("hba_file", BackupInfo::getHbaFile, BackupInfo::setHbaFile);
        field("ident_file", BackupInfo::getIdentFile, BackupInfo::setIdentFile);
        field("included_files", info -> toJson(info.getIncludedFiles()),
                (info, value) -> info.setIncludedFiles(fromJson(value, STRING_LIST_TYPE)));
        field("backup_label", info -> toJson(info.getBackupLabel()),
                (info, value) -> info.setBackupLabel(fromJson(value, new TypeReference<String>() {
                })));
        field("copy_stats", info -> toJson(info.getCopyStats()),
                (info, value) -> info.setCopyStats(fromJson(value, new TypeReference<CopyStats>() {
                })));
        field("compression", BackupInfo::getCompression, BackupInfo::setCompression);
        field("error", info -> info.getError() == null ? null : StringUtils.replaceChars(info.getError(), "\r\n", "  "),
                BackupInfo::setError);
        field("size", info -> toStringOrNull(info.getSize()),
                (info, value) -> info.setSize(Long.valueOf(value)));
    }

    public static String toText(BackupInfo backupInfo) {
        StringBuilder builder = new StringBuilder();
        for (Map.Entry<String, Field> entry : FIELDS.entrySet()) {
            String value = entry.getValue().dump.apply(backupInfo);
            if (value != null) {
                builder.append(entry.getKey()).append('=').append(value).append('\n');
            }
        }
        return builder.toString();
    }

    /**
     * @throws IllegalArgumentException on unknown fields or malformed lines
     */
    public static BackupInfo fromText(String text) {
        BackupInfo backupInfo = new BackupInfo();
        for (String line : text.split("\n")) {
            if (StringUtils.isBlank(line)) {
                continue;
            }
            int separator = line.indexOf('=');
            if (separator <= 0) {
                throw new IllegalArgumentException("Malformed backup info line: " + line);
            }
            String name = line.substring(0, separator);
            Field field = FIELDS.get(name);
            if (field == null) {
                throw new IllegalArgumentException("Unknown backup info field: " + name);
            }
            field.load.accept(backupInfo, line.substring(separator + 1));
        }
        return backupInfo;
    }

    /**
     * Writes through a temporary file renamed over the target.
     */
    public static void save(BackupInfo backupInfo, Path file) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(tmp, toText(backupInfo), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save backup info " + file, e);
        }
    }

    public static BackupInfo load(Path file) {
        try {
            return fromText(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load backup info " + file, e);
        }
    }

    public static List<String> fieldNames() {
        return List.copyOf(FIELDS.keySet());
    }

    private static void field(String name, Function<BackupInfo, String> dump, BiConsumer<BackupInfo, String> load) {
        FIELDS.put(name, new Field(dump, load));
    }

    private static String toStringOrNull(Object value) {
        return value == null ? null : value.toString();
    }

    private static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize backup info value", e);
        }
    }

    private static <T> T fromJson(String value, TypeReference<T> type) {
        try {
            return OBJECT_MAPPER.readValue(value, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed backup info value: " + value, e);
        }
    }

    static final class Field {
        private final Function<BackupInfo, String> dump;
        private final BiConsumer<BackupInfo, String> load;

        private Field(Function<BackupInfo, String> dump, BiConsumer<BackupInfo, String> load) {
            this.dump = dump;
            this.load = load;
        }
    }

    private BackupInfoFile() {
    }
}
