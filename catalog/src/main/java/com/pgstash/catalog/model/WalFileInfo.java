package com.pgstash.catalog.model;

import com.pgstash.catalog.util.CompressionUtils;
import com.pgstash.catalog.util.XlogUtils;
import lombok.Builder;
import lombok.Value;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Metadata of one archived WAL file, as stored in the WAL catalog.
 */
@Value
@Builder(toBuilder = true)
public class WalFileInfo {
    public static final String NONE_TOKEN = "None";

    String name;
    long size;
    /**
     * Modification time in epoch seconds.
     */
    double time;
    String compression;

    public String getHashDir() {
        return XlogUtils.hashDir(name);
    }

    /**
     * Path relative to the WAL archive root.
     */
    public String getRelativePath() {
        String hashDir = getHashDir();
        return hashDir.isEmpty() ? name : hashDir + "/" + name;
    }

    public String toXlogDbLine() {
        return name + "\t"
                + size + "\t"
                + formatTime(time) + "\t"
                + (compression == null ? NONE_TOKEN : compression)
                + "\n";
    }

    public static WalFileInfo fromXlogDbLine(String line) {
        String stripped = line.endsWith("\n") ? line.substring(0, line.length() - 1) : line;
        String[] fields = stripped.split("\t", -1);
        if (fields.length != 4) {
            throw new IllegalArgumentException("Malformed WAL catalog line: " + stripped);
        }
        return WalFileInfo.builder()
                .name(fields[0])
                .size(Long.parseLong(fields[1]))
                .time(Double.parseDouble(fields[2]))
                .compression(NONE_TOKEN.equals(fields[3]) ? null : fields[3])
                .build();
    }

    /**
     * Reads name, size and modification time from the file. Compression is detected from content,
     * falling back to {@code defaultCompression}.
     */
    public static WalFileInfo fromFile(Path file, String defaultCompression) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        String compression = CompressionUtils.identifyCompression(file);

        return WalFileInfo.builder()
                .name(file.getFileName().toString())
                .size(attributes.size())
                .time(attributes.lastModifiedTime().toMillis() / 1000.0)
                .compression(compression != null ? compression : defaultCompression)
                .build();
    }

    static String formatTime(double time) {
        return BigDecimal.valueOf(time).stripTrailingZeros().toPlainString();
    }
}
