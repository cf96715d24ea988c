package com.example.payanalyzer.application.worker;

import com.example.payanalyzer.application.config.AnalyzerProperties;
import com.example.payanalyzer.application.exception.WorkerTerminatedException;
import com.example.payanalyzer.application.service.PdfProcessor;
import com.example.payanalyzer.domain.model.PriorSubmission;
import com.example.payanalyzer.domain.model.ProcessingResult;
import com.example.payanalyzer.domain.model.UploadedPdf;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs batch processing on one dedicated daemon thread. Callers only exchange messages with it:
 * a request goes in, progress events and exactly one result or error come back.
 */
@Component
public class PdfProcessingWorker {

    private static final Logger log = LoggerFactory.getLogger(PdfProcessingWorker.class);

    private final PdfProcessor processor;
    private final ExecutorService executor;
    private final Map<String, CompletableFuture<ProcessingResult>> pending = new ConcurrentHashMap<>();

    public PdfProcessingWorker(PdfProcessor processor, AnalyzerProperties properties) {
        this.processor = processor;
        String threadName = properties.getWorker().getThreadName();
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    public CompletableFuture<ProcessingResult> submit(List<UploadedPdf> files, List<PriorSubmission> priors) {
        return submit(files, priors, ProcessingProgressListener.NONE);
    }

    /**
     * Queues a batch. Requests run one after another in submission order.
     *
     * @param files    batch to process
     * @param priors   earlier submissions for duplicate and update detection
     * @param listener progress callback, invoked on the worker thread
     * @return future completed with the result, or exceptionally with
     *         {@link WorkerTerminatedException} when the worker stops first
     */
    public CompletableFuture<ProcessingResult> submit(List<UploadedPdf> files,
                                                      List<PriorSubmission> priors,
                                                      ProcessingProgressListener listener) {
        String requestId = UUID.randomUUID().toString();
        CompletableFuture<ProcessingResult> future = new CompletableFuture<>();
        ProcessingProgressListener progress = listener != null ? listener : ProcessingProgressListener.NONE;
        pending.put(requestId, future);
        try {
            executor.execute(() -> run(requestId, files, priors, progress, future));
            log.debug("Queued request {} with {} file(s)", requestId, files != null ? files.size() : 0);
        } catch (RejectedExecutionException ex) {
            pending.remove(requestId);
            future.completeExceptionally(new WorkerTerminatedException(requestId));
        }
        return future;
    }

    /**
     * Stops the worker. Every request not yet completed fails with {@link WorkerTerminatedException}.
     */
    @PreDestroy
    public void terminate() {
        executor.shutdownNow();
        pending.forEach((requestId, future) -> future.completeExceptionally(new WorkerTerminatedException(requestId)));
        pending.clear();
        log.info("Processing worker terminated");
    }

    public boolean isTerminated() {
        return executor.isShutdown();
    }

    int pendingCount() {
        return pending.size();
    }

    private void run(String requestId,
                     List<UploadedPdf> files,
                     List<PriorSubmission> priors,
                     ProcessingProgressListener listener,
                     CompletableFuture<ProcessingResult> future) {
        if (future.isDone()) {
            return;
        }
        try {
            ProcessingResult result = processor.processFiles(files, priors, (current, total, currentFile) -> {
                if (future.isDone()) {
                    return;
                }
                try {
                    listener.onProgress(ProcessingProgress.of(requestId, current, total, currentFile));
                } catch (RuntimeException ex) {
                    log.warn("Progress listener for request {} failed at {}/{}", requestId, current, total, ex);
                }
            });
            future.complete(result);
        } catch (RuntimeException ex) {
            log.error("Request {} failed", requestId, ex);
            future.completeExceptionally(ex);
        } finally {
            pending.remove(requestId);
        }
    }
}
