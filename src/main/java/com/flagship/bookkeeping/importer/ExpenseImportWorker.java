package com.flagship.bookkeeping.importer;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.bookkeeping.config.LedgerProperties;
import com.flagship.bookkeeping.observability.CorrelationContext;
import com.flagship.bookkeeping.result.LedgerResult;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs imports in the background so a caller can stay responsive.
 *
 * Cancelling the returned future before the import reaches its write skips the write.
 * Once the write has started it runs to commit or rollback under the ledger write lock;
 * cancellation then only discards the result.
 */
@Component
@Slf4j
public class ExpenseImportWorker {

    private final ExpenseImportService importService;
    private final ExecutorService executor;

    public ExpenseImportWorker(ExpenseImportService importService, LedgerProperties properties) {
        this.importService = importService;
        AtomicInteger threadCount = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "expense-import-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        this.executor = Executors.newFixedThreadPool(properties.getImporter().getWorkerThreads(), threadFactory);
    }

    public CompletableFuture<LedgerResult<ExpenseImportResult>> submit(JsonNode payload) {
        CompletableFuture<LedgerResult<ExpenseImportResult>> future = new CompletableFuture<>();
        String correlationId = CorrelationContext.getCorrelationId();
        try {
            executor.execute(() -> run(payload, future, correlationId));
        } catch (RejectedExecutionException e) {
            log.error("Import worker rejected task: {}", e.getMessage());
            future.completeExceptionally(e);
        }
        return future;
    }

    private void run(JsonNode payload,
                     CompletableFuture<LedgerResult<ExpenseImportResult>> future,
                     String correlationId) {
        CorrelationContext.setCorrelationId(correlationId);
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
        try {
            if (future.isCancelled()) {
                log.info("Import cancelled before start");
                return;
            }
            future.complete(importService.importPayload(payload, future::isCancelled));
        } catch (RuntimeException e) {
            log.error("Background import failed unexpectedly", e);
            future.completeExceptionally(e);
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            CorrelationContext.clear();
        }
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
            log.warn("Import worker did not finish within 10s, interrupting");
            executor.shutdownNow();
        }
    }
}
