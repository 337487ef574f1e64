package com.pgstash.orchestration.adapter.impl;

import com.pgstash.orchestration.adapter.api.TransportAdapter;
import com.pgstash.orchestration.command.Rsync;
import com.pgstash.orchestration.command.ShellCommand;
import com.pgstash.orchestration.constant.CommandsConstants;
import com.pgstash.orchestration.model.CopyJob;
import com.pgstash.orchestration.model.FileItem;
import com.pgstash.orchestration.model.ReuseMode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies into a local backup directory with rsync, reaching the server through the configured ssh command.
 */
@Slf4j
public class DirectTransportAdapter implements TransportAdapter {
    private final ShellCommand shellCommand;
    private final String sshCommand;
    private final boolean networkCompression;
    private final Path destinationDirectory;

    public DirectTransportAdapter(ShellCommand shellCommand, String sshCommand, boolean networkCompression, Path destinationDirectory) {
        this.shellCommand = shellCommand;
        this.sshCommand = sshCommand;
        this.networkCompression = networkCompression;
        this.destinationDirectory = destinationDirectory;
    }

    @Override
    public void copyDirectory(CopyJob job) {
        Path dst = destinationDirectory.resolve(job.getDst());
        createDirectories(dst);

        Rsync rsync = Rsync.builder()
                .shellCommand(shellCommand)
                .sshCommand(sshCommand)
                .networkCompression(networkCompression)
                .args(baseArgs())
                .include(job.getInclude())
                .exclude(job.getExclude())
                .excludeAndProtect(job.getExcludeAndProtect())
                .bwlimit(job.getBwlimit())
                .build();

        String src = sourcePath(job.getSrc(), true);
        String dstPath = dst + "/";
        List<String> reuseArgs = reuseArgs(job);

        if (job.getSafeHorizon() == null) {
            rsync.copy(src, dstPath, reuseArgs);
            return;
        }

        List<String> safeList = new ArrayList<>();
        List<String> checkList = new ArrayList<>();
        for (FileItem item : rsync.listFiles(src)) {
            if (".".equals(item.getPath())) {
                continue;
            }
            if (item.isDirectory() || item.getDate().toInstant().isBefore(job.getSafeHorizon())) {
                safeList.add(item.getPath());
            } else {
                checkList.add(item.getPath());
            }
        }
        log.debug("{}: {} entries older than {}, {} entries to check", job.getLabel(), safeList.size(), job.getSafeHorizon(), checkList.size());

        rsync.copyFileList(src, dstPath, safeList, reuseArgs);

        List<String> checkArgs = new ArrayList<>(reuseArgs);
        checkArgs.add(CommandsConstants.RSYNC_CHECKSUM_KEY);
        rsync.copyFileList(src, dstPath, checkList, checkArgs);
    }

    @Override
    public void copyFile(CopyJob job) {
        Path dst = destinationDirectory.resolve(job.getDst()).resolve(job.getPath());
        createDirectories(dst.getParent());

        Rsync rsync = Rsync.builder()
                .shellCommand(shellCommand)
                .sshCommand(sshCommand)
                .networkCompression(networkCompression)
                .args(baseArgs())
                .bwlimit(job.getBwlimit())
                .build();

        List<String> extraArgs = new ArrayList<>();
        if (job.isOptional()) {
            extraArgs.add(CommandsConstants.RSYNC_IGNORE_MISSING_ARGS_KEY);
        }
        rsync.copy(sourcePath(job.getSrc(), false), dst.toString(), extraArgs);
    }

    @Override
    public void close() {
        // every rsync run is complete when it returns
    }

    @Override
    public void abort() {
        log.warn("Copy to {} aborted, partial content is left in place", destinationDirectory);
    }

    public Path getDestinationDirectory() {
        return destinationDirectory;
    }

    List<String> reuseArgs(CopyJob job) {
        List<String> args = new ArrayList<>();
        if (job.getReuseDirectory() == null) {
            return args;
        }
        if (job.getReuse() == ReuseMode.LINK) {
            args.add(String.format(CommandsConstants.RSYNC_LINK_DEST_FORMAT, job.getReuseDirectory()));
        } else if (job.getReuse() == ReuseMode.COPY) {
            args.add(String.format(CommandsConstants.RSYNC_COPY_DEST_FORMAT, job.getReuseDirectory()));
        }
        return args;
    }

    private String sourcePath(String path, boolean directory) {
        String result = path;
        if (directory && !result.endsWith("/")) {
            result = result + "/";
        }
        return StringUtils.isNotBlank(sshCommand) ? ":" + result : result;
    }

    private static List<String> baseArgs() {
        List<String> args = new ArrayList<>(CommandsConstants.RSYNC_BASE_ARGS);
        args.add(CommandsConstants.RSYNC_ITEMIZE_CHANGES_KEY);
        return args;
    }

    private static void createDirectories(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + directory, e);
        }
    }
}
