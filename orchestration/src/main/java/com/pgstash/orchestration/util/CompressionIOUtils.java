package com.pgstash.orchestration.util;

import com.pgstash.catalog.util.CompressionUtils;
import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;

public class CompressionIOUtils {

    /**
     * Maps a catalog compression name to the commons-compress compressor name.
     */
    public static String toCompressorName(String compression) {
        if (CompressionUtils.GZIP.equals(compression)) {
            return CompressorStreamFactory.GZIP;
        }
        if (CompressionUtils.BZIP2.equals(compression)) {
            return CompressorStreamFactory.BZIP2;
        }
        throw new IllegalArgumentException("Unsupported compression '" + compression + "'");
    }

    /**
     * Compresses {@code source} into {@code destination} and removes the source. The destination keeps the
     * modification time of the source. Writes go through a temporary file renamed into place when complete.
     */
    public static void compressAndMove(Path source, Path destination, String compression) throws IOException {
        Path tmp = destination.resolveSibling(destination.getFileName() + ".tmp");
        FileTime modifiedTime = Files.getLastModifiedTime(source);

        try (InputStream inputStream = Files.newInputStream(source);
             OutputStream fileOutputStream = Files.newOutputStream(tmp);
             OutputStream compressedOutputStream = new CompressorStreamFactory()
                     .createCompressorOutputStream(toCompressorName(compression), fileOutputStream)) {
            IOUtils.copy(inputStream, compressedOutputStream);
        } catch (CompressorException e) {
            Files.deleteIfExists(tmp);
            throw new IOException("Failed to compress " + source + " with " + compression, e);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }

        Files.setLastModifiedTime(tmp, modifiedTime);
        Files.move(tmp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        Files.delete(source);
    }

    /**
     * Opens {@code file} for reading, transparently decompressing it when {@code compression} is not null.
     */
    public static InputStream openDecompressed(Path file, String compression) throws IOException {
        InputStream inputStream = Files.newInputStream(file);
        if (compression == null) {
            return inputStream;
        }
        try {
            return new CompressorStreamFactory().createCompressorInputStream(toCompressorName(compression), inputStream);
        } catch (CompressorException e) {
            inputStream.close();
            throw new IOException("Failed to decompress " + file + " with " + compression, e);
        }
    }

    private CompressionIOUtils() {
    }
}
