package com.flagship.bookkeeping.storage;

import com.flagship.bookkeeping.observability.LedgerMetrics;
import com.flagship.bookkeeping.result.ErrorKind;
import com.flagship.bookkeeping.result.LedgerResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-writer gate for every mutation of the ledger database.
 *
 * The lock is taken before the transaction begins and released after it has committed or
 * rolled back, so at most one write transaction is in flight at any time. Readers never
 * take the lock; they see either the state before or after a write.
 *
 * A work unit returning a failed {@link LedgerResult} is rolled back. A
 * {@link DataAccessException} thrown inside the work unit is rolled back and converted to
 * a {@link ErrorKind#STORAGE} failure.
 */
@Component
@Slf4j
public class LedgerWriteSerializer {

    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;
    private final LedgerMetrics metrics;

    public LedgerWriteSerializer(PlatformTransactionManager transactionManager, LedgerMetrics metrics) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.metrics = metrics;
    }

    /**
     * Runs {@code work} inside one transaction while holding the write lock.
     *
     * @param operation short name used for logging and the write-duration timer
     * @param work      validation and mutation; must not start its own threads
     */
    public <T> LedgerResult<T> write(String operation, Supplier<LedgerResult<T>> work) {
        long startTime = System.currentTimeMillis();
        writeLock.lock();
        try {
            LedgerResult<T> result = transactionTemplate.execute(status -> {
                LedgerResult<T> outcome = work.get();
                if (outcome.isFailure()) {
                    status.setRollbackOnly();
                }
                return outcome;
            });
            return result;
        } catch (DataAccessException | TransactionException e) {
            log.error("Write '{}' rolled back after storage failure: {}", operation, e.getMessage(), e);
            return LedgerResult.failure(ErrorKind.STORAGE, null,
                "Storage failure during " + operation + ": " + rootMessage(e));
        } finally {
            writeLock.unlock();
            metrics.recordWriteDuration(operation, System.currentTimeMillis() - startTime);
        }
    }

    /**
     * True while the calling thread is inside {@link #write}.
     */
    public boolean isWriting() {
        return writeLock.isHeldByCurrentThread();
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
