package com.pgstash.orchestration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One unit of work of a backup copy: a whole directory or a single file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CopyJob {
    private String label;
    private String src;
    private String dst;
    /**
     * Entry name of a single file inside the destination, for example {@code global/pg_control}.
     */
    private String path;
    private ItemClass itemClass;
    private boolean directory;

    @Builder.Default
    private List<String> exclude = new ArrayList<>();
    @Builder.Default
    private List<String> include = new ArrayList<>();
    @Builder.Default
    private List<String> excludeAndProtect = new ArrayList<>();

    @Builder.Default
    private ReuseMode reuse = ReuseMode.NONE;
    private Path reuseDirectory;
    /**
     * Files modified at or after this instant are compared by checksum.
     */
    private Instant safeHorizon;
    private Integer bwlimit;
    private boolean optional;
}
