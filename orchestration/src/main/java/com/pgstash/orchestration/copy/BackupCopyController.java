package com.pgstash.orchestration.copy;

import com.pgstash.catalog.model.CopyStats;
import com.pgstash.orchestration.adapter.api.TransportAdapter;
import com.pgstash.orchestration.exception.CopyFailureException;
import com.pgstash.orchestration.model.CopyJob;
import com.pgstash.orchestration.model.ItemClass;
import com.pgstash.orchestration.model.ReuseMode;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Collects copy jobs and runs them against a {@link TransportAdapter}.
 * Jobs run in phases by {@link ItemClass}; inside a phase up to {@code workers} jobs run at once.
 * The first failing job stops the copy and aborts the transport.
 */
@Slf4j
public class BackupCopyController {
    private static final long JOB_STOP_TIMEOUT_SECONDS = 300;

    private final TransportAdapter transportAdapter;
    private final int workers;
    private final ReuseMode reuseMode;
    private final Instant safeHorizon;

    private final List<CopyJob> jobs = new ArrayList<>();
    private final Map<String, Double> jobTimes = Collections.synchronizedMap(new LinkedHashMap<>());

    public BackupCopyController(TransportAdapter transportAdapter, int workers, ReuseMode reuseMode, Instant safeHorizon) {
        this.transportAdapter = transportAdapter;
        this.workers = Math.max(1, workers);
        this.reuseMode = reuseMode == null ? ReuseMode.NONE : reuseMode;
        this.safeHorizon = safeHorizon;
    }

    /**
     * @param reuse directory of the previous backup matching {@code dst}, or null for a full copy
     */
    public void addDirectory(String label,
                             String src,
                             String dst,
                             List<String> exclude,
                             List<String> excludeAndProtect,
                             List<String> include,
                             Path reuse,
                             Integer bwlimit,
                             ItemClass itemClass) {
        boolean reusable = reuse != null && reuseMode != ReuseMode.NONE;
        jobs.add(
                CopyJob.builder()
                        .label(label)
                        .src(src)
                        .dst(dst)
                        .itemClass(itemClass)
                        .directory(true)
                        .exclude(exclude == null ? new ArrayList<>() : new ArrayList<>(exclude))
                        .excludeAndProtect(excludeAndProtect == null ? new ArrayList<>() : new ArrayList<>(excludeAndProtect))
                        .include(include == null ? new ArrayList<>() : new ArrayList<>(include))
                        .reuse(reusable ? reuseMode : ReuseMode.NONE)
                        .reuseDirectory(reusable ? reuse : null)
                        .safeHorizon(reusable ? safeHorizon : null)
                        .bwlimit(bwlimit)
                        .build()
        );
    }

    public void addFile(String label, String src, String dst, String path, ItemClass itemClass, boolean optional) {
        jobs.add(
                CopyJob.builder()
                        .label(label)
                        .src(src)
                        .dst(dst)
                        .path(path)
                        .itemClass(itemClass)
                        .directory(false)
                        .optional(optional)
                        .build()
        );
    }

    public List<CopyJob> getJobs() {
        return Collections.unmodifiableList(jobs);
    }

    /**
     * Runs every registered job.
     *
     * @throws CopyFailureException carrying the label of the first job that failed
     */
    public CopyStats copy() throws CopyFailureException {
        long start = System.nanoTime();

        Map<ItemClass, List<CopyJob>> phases = new EnumMap<>(ItemClass.class);
        for (CopyJob job : jobs) {
            phases.computeIfAbsent(job.getItemClass(), key -> new ArrayList<>()).add(job);
        }

        ExecutorService executorService = Executors.newFixedThreadPool(workers);
        try {
            for (Map.Entry<ItemClass, List<CopyJob>> phase : phases.entrySet()) {
                log.debug("Copy phase {} with {} job(s)", phase.getKey(), phase.getValue().size());
                runPhase(phase.getValue(), executorService);
            }
        } finally {
            executorService.shutdownNow();
        }

        double copyTime = (System.nanoTime() - start) / 1e9;
        log.info("Copy done in {} seconds", String.format("%.2f", copyTime));

        return CopyStats.builder()
                .copyTime(copyTime)
                .numberOfWorkers(workers)
                .jobTimes(new LinkedHashMap<>(jobTimes))
                .build();
    }

    private void runPhase(List<CopyJob> phaseJobs, ExecutorService executorService) {
        CompletableFuture<CopyJob> firstFailure = new CompletableFuture<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        for (CopyJob job : phaseJobs) {
            futures.add(
                    CompletableFuture.runAsync(() -> executeJob(job), executorService)
                            .whenComplete((ignored, throwable) -> {
                                if (throwable != null) {
                                    firstFailure.completeExceptionally(new JobFailure(job, unwrap(throwable)));
                                }
                            })
            );
        }

        CompletableFuture<Void> allDone = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            CompletableFuture.anyOf(allDone, firstFailure).join();
        } catch (CompletionException e) {
            futures.forEach(future -> future.cancel(true));
            executorService.shutdownNow();
            awaitRunningJobs(executorService);
            transportAdapter.abort();

            Throwable cause = unwrap(e);
            if (cause instanceof JobFailure) {
                JobFailure failure = (JobFailure) cause;
                log.error("Copy job '{}' failed", failure.job.getLabel(), failure.getCause());
                throw new CopyFailureException(failure.job.getLabel(), failure.getCause());
            }
            throw new CopyFailureException("unknown", cause);
        }
    }

    /**
     * Jobs already running were interrupted; the transport is aborted only once they are gone.
     */
    private void awaitRunningJobs(ExecutorService executorService) {
        try {
            if (!executorService.awaitTermination(JOB_STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Copy jobs still running {} seconds after the failure, aborting the transport anyway", JOB_STOP_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for copy jobs to stop");
        }
    }

    private void executeJob(CopyJob job) {
        long start = System.nanoTime();
        log.info("Copy started: {}", job.getLabel());

        if (job.isDirectory()) {
            transportAdapter.copyDirectory(job);
        } else {
            transportAdapter.copyFile(job);
        }

        double elapsed = (System.nanoTime() - start) / 1e9;
        jobTimes.put(job.getLabel(), elapsed);
        log.info("Copy finished: {} ({} seconds)", job.getLabel(), String.format("%.2f", elapsed));
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static class JobFailure extends RuntimeException {
        private final transient CopyJob job;

        JobFailure(CopyJob job, Throwable cause) {
            super(cause);
            this.job = job;
        }
    }
}
