package com.flagship.pos_inventory.posting;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * Retry and rollback policy of the unit of work, against a mocked transaction manager.
 */
class UnitOfWorkTest {

    private PlatformTransactionManager transactionManager;
    private UnitOfWork unitOfWork;

    @BeforeEach
    void setUp() {
        transactionManager = mock(PlatformTransactionManager.class);
        when(transactionManager.getTransaction(any())).thenAnswer(invocation -> new SimpleTransactionStatus());
        unitOfWork = new UnitOfWork(transactionManager, 5, 3, 0);
    }

    @Test
    @DisplayName("Successful work commits once")
    void testCommit() {
        String result = unitOfWork.execute("test", () -> "done");

        assertEquals("done", result);
        verify(transactionManager, times(1)).commit(any());
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    @DisplayName("Transaction timeout is applied to every attempt")
    void testTimeout() {
        unitOfWork.execute("test", () -> "done");

        verify(transactionManager).getTransaction(argThat((TransactionDefinition definition) -> definition.getTimeout() == 5));
    }

    @Test
    @DisplayName("Transient failure is retried until it succeeds")
    void testTransientRetry() {
        AtomicInteger attempts = new AtomicInteger();

        String result = unitOfWork.execute("test", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new CannotAcquireLockException("deadlock detected");
            }
            return "done";
        });

        assertEquals("done", result);
        assertEquals(3, attempts.get());
        verify(transactionManager, times(2)).rollback(any());
        verify(transactionManager, times(1)).commit(any());
    }

    @Test
    @DisplayName("Transient failure surfaces once attempts are exhausted")
    void testTransientExhausted() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(CannotAcquireLockException.class, () -> unitOfWork.execute("test", () -> {
            attempts.incrementAndGet();
            throw new CannotAcquireLockException("lock timeout");
        }));

        assertEquals(3, attempts.get());
        verify(transactionManager, times(3)).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    @DisplayName("Non-transient failure rolls back without retry")
    void testNoRetryForOtherFailures() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(DataIntegrityViolationException.class, () -> unitOfWork.run("test", () -> {
            attempts.incrementAndGet();
            throw new DataIntegrityViolationException("duplicate key");
        }));
        assertThrows(IllegalStateException.class, () -> unitOfWork.run("test", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("business rule");
        }));

        assertEquals(2, attempts.get());
        verify(transactionManager, times(2)).rollback(any());
    }

    @Test
    @DisplayName("At least one attempt is required")
    void testInvalidMaxAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new UnitOfWork(transactionManager, 5, 0, 0));
    }
}
