package com.pgstash.catalog.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

public class CompressionUtils {
    public static final String GZIP = "gzip";
    public static final String BZIP2 = "bzip2";

    private static final byte[] GZIP_MAGIC = new byte[]{(byte) 0x1f, (byte) 0x8b};
    private static final byte[] BZIP2_MAGIC = new byte[]{'B', 'Z', 'h'};

    /**
     * Detects compression of a file from its leading magic bytes.
     *
     * @return {@link #GZIP}, {@link #BZIP2} or null when the content is not compressed
     */
    public static String identifyCompression(Path file) throws IOException {
        byte[] header = new byte[3];
        int read;
        try (InputStream inputStream = Files.newInputStream(file)) {
            read = inputStream.readNBytes(header, 0, header.length);
        }
        if (read >= GZIP_MAGIC.length && Arrays.equals(header, 0, GZIP_MAGIC.length, GZIP_MAGIC, 0, GZIP_MAGIC.length)) {
            return GZIP;
        }
        if (read >= BZIP2_MAGIC.length && Arrays.equals(header, 0, BZIP2_MAGIC.length, BZIP2_MAGIC, 0, BZIP2_MAGIC.length)) {
            return BZIP2;
        }
        return null;
    }

    private CompressionUtils() {
    }
}
