package com.purchasingpower.codegraph.knowledge.impl;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.purchasingpower.codegraph.model.ast.FileExtraction;
import com.purchasingpower.codegraph.model.build.ScanError;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Runs per-file extraction with two deadlines.
 *
 * <p>At most {@code workers} files are in flight. A file's deadline starts
 * when a worker picks it up; when it passes, the future is cancelled, its
 * output discarded and the slot freed. Once the scan deadline passes, no
 * further file is started and every in-flight file is abandoned. Workers are
 * daemon threads so a parse that ignores interruption never blocks shutdown.
 */
@Slf4j
class FileExtractionRunner {

    private static final long POLL_INTERVAL_MS = 25;

    private final int workers;
    private final long fileTimeoutMs;

    FileExtractionRunner(int workers, long fileTimeoutMs) {
        Preconditions.checkArgument(workers > 0, "workers must be positive");
        Preconditions.checkArgument(fileTimeoutMs > 0, "fileTimeoutMs must be positive");
        this.workers = workers;
        this.fileTimeoutMs = fileTimeoutMs;
    }

    /**
     * @param files          paths in processing order
     * @param task           extraction of one file; exceptions become file errors
     * @param scanDeadline   {@link System#nanoTime()} value after which no file is started
     * @param onFileFinished called on the calling thread after each file settles
     */
    Outcome run(List<String> files, Function<String, FileExtraction> task, long scanDeadline,
                FileListener onFileFinished) {
        ExecutorService pool = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
            .setNameFormat("graph-extract-%d")
            .setDaemon(true)
            .build());
        CompletionService<FileExtraction> completion = new ExecutorCompletionService<>(pool);
        Deque<String> pending = new ArrayDeque<>(files);
        Map<Future<FileExtraction>, InFlight> inFlight = new HashMap<>();
        Map<String, FileExtraction> completed = new LinkedHashMap<>();
        List<ScanError> errors = new ArrayList<>();
        boolean timedOut = false;
        int settled = 0;

        try {
            while (!pending.isEmpty() || !inFlight.isEmpty()) {
                if (System.nanoTime() - scanDeadline >= 0) {
                    timedOut = true;
                    abandon(inFlight);
                    break;
                }
                while (inFlight.size() < workers && !pending.isEmpty()) {
                    String file = pending.poll();
                    InFlight entry = new InFlight(file);
                    Future<FileExtraction> future = completion.submit(() -> {
                        entry.startedAt = System.nanoTime();
                        return task.apply(file);
                    });
                    inFlight.put(future, entry);
                }

                long remainingMs = TimeUnit.NANOSECONDS.toMillis(scanDeadline - System.nanoTime());
                Future<FileExtraction> done = completion.poll(
                    Math.max(1, Math.min(POLL_INTERVAL_MS, remainingMs)), TimeUnit.MILLISECONDS);
                while (done != null) {
                    InFlight entry = inFlight.remove(done);
                    // cancelled futures are queued too; their entry is already gone
                    if (entry != null) {
                        settle(done, entry.file, completed, errors);
                        onFileFinished.onFileFinished(++settled, files.size(), entry.file);
                    }
                    done = completion.poll();
                }

                for (String expired : expire(inFlight)) {
                    errors.add(ScanError.file(expired, "Analysis timed out after " + fileTimeoutMs + "ms"));
                    log.warn("⏱️ {} exceeded the per-file timeout of {}ms", expired, fileTimeoutMs);
                    onFileFinished.onFileFinished(++settled, files.size(), expired);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(inFlight);
            timedOut = true;
            log.warn("⚠️ Extraction interrupted after {} of {} files", settled, files.size());
        } finally {
            pool.shutdownNow();
        }

        return new Outcome(completed, errors, timedOut, settled);
    }

    private void settle(Future<FileExtraction> done, String file,
                        Map<String, FileExtraction> completed, List<ScanError> errors) {
        try {
            completed.put(file, done.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            errors.add(ScanError.file(file, cause.getMessage() != null ? cause.getMessage() : cause.toString()));
            log.warn("❌ Failed to analyze {}: {}", file, cause.getMessage());
        } catch (CancellationException | InterruptedException e) {
            errors.add(ScanError.file(file, "Analysis cancelled"));
        }
    }

    private List<String> expire(Map<Future<FileExtraction>, InFlight> inFlight) {
        long now = System.nanoTime();
        long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(fileTimeoutMs);
        List<String> expired = new ArrayList<>();
        Iterator<Map.Entry<Future<FileExtraction>, InFlight>> it = inFlight.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Future<FileExtraction>, InFlight> entry = it.next();
            long startedAt = entry.getValue().startedAt;
            if (startedAt != 0 && now - startedAt >= timeoutNanos) {
                entry.getKey().cancel(true);
                expired.add(entry.getValue().file);
                it.remove();
            }
        }
        expired.sort(String::compareTo);
        return expired;
    }

    private static void abandon(Map<Future<FileExtraction>, InFlight> inFlight) {
        inFlight.keySet().forEach(future -> future.cancel(true));
        inFlight.clear();
    }

    @FunctionalInterface
    interface FileListener {
        void onFileFinished(int settled, int total, String file);
    }

    private static final class InFlight {
        private final String file;
        private volatile long startedAt;

        private InFlight(String file) {
            this.file = file;
        }
    }

    /**
     * @param completed extractions that finished in time, keyed by path
     * @param errors    per-file failures and timeouts
     * @param timedOut  the scan deadline passed before every file settled
     * @param settled   number of files that finished, failed or expired
     */
    record Outcome(Map<String, FileExtraction> completed, List<ScanError> errors, boolean timedOut, int settled) {
    }
}
