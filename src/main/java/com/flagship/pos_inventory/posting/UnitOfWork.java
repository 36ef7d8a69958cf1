package com.flagship.pos_inventory.posting;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * All-or-nothing execution of a group of writes against the store.
 *
 * Every posting operation runs its inserts, updates and ledger adjustments
 * through {@link #execute}. Any exception thrown by the work rolls back
 * every effect of that attempt before it propagates.
 *
 * Retry policy:
 * - TransientDataAccessException (deadlock, lock timeout, serialization
 *   failure, query timeout) retries the whole unit with exponential backoff
 * - every other exception propagates after the first attempt
 *
 * The work must therefore be safe to run again from scratch, which holds
 * as long as it only writes through the store.
 */
@Component
@Slf4j
public class UnitOfWork {

    private final TransactionTemplate transactionTemplate;
    private final int maxAttempts;
    private final long backoffMs;

    public UnitOfWork(PlatformTransactionManager transactionManager,
                      @Value("${pos.unit-of-work.timeout-seconds:10}") int timeoutSeconds,
                      @Value("${pos.unit-of-work.max-attempts:3}") int maxAttempts,
                      @Value("${pos.unit-of-work.backoff-ms:50}") long backoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("pos.unit-of-work.max-attempts must be at least 1");
        }
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(timeoutSeconds);
        this.maxAttempts = maxAttempts;
        this.backoffMs = backoffMs;
    }

    /**
     * Runs the work in one transaction and returns its result.
     *
     * @param operation name used in log lines
     * @param work the reads and writes making up the unit
     * @return whatever the work returned, after a successful commit
     * @throws TransientDataAccessException if every attempt failed transiently
     */
    public <T> T execute(String operation, Supplier<T> work) {
        int attempt = 1;
        while (true) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (TransientDataAccessException e) {
                if (attempt >= maxAttempts) {
                    log.error("Unit of work {} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                long delay = backoffMs * (1L << (attempt - 1));
                log.warn("Transient storage failure in {} (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempt, maxAttempts, delay, e.getMessage());
                pause(delay);
                attempt++;
            }
        }
    }

    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }

    private void pause(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry unit of work", e);
        }
    }
}
