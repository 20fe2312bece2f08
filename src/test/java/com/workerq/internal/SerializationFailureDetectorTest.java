package com.workerq.internal;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.jpa.JpaSystemException;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SerializationFailureDetectorTest {

    @Test
    void shouldDetectSerializationFailureSqlState() {
        assertTrue(SerializationFailureDetector.isRetryable(new SQLException("conflict", "40001")));
    }

    @Test
    void shouldDetectDeadlockSqlState() {
        assertTrue(SerializationFailureDetector.isRetryable(new SQLException("deadlock", "40P01")));
    }

    @Test
    void shouldLookThroughWrappingExceptions() {
        RuntimeException wrapped = new JpaSystemException(
                new RuntimeException("flush failed", new SQLException("conflict", "40001")));

        assertTrue(SerializationFailureDetector.isRetryable(wrapped));
    }

    @Test
    void shouldFollowChainedSqlExceptions() {
        SQLException batch = new SQLException("Batch entry 0 was aborted", "08000");
        batch.setNextException(new SQLException("conflict", "40001"));

        assertTrue(SerializationFailureDetector.isRetryable(batch));
    }

    @Test
    void shouldDetectKnownMessagesWithoutSqlState() {
        assertTrue(SerializationFailureDetector.isRetryable(new RuntimeException("ERROR: Deadlock detected")));
        assertTrue(SerializationFailureDetector.isRetryable(new RuntimeException(
                "current transaction is aborted, commands ignored until end of transaction block")));
        assertTrue(SerializationFailureDetector.isRetryable(new RuntimeException(
                "could not serialize access due to read/write dependencies among transactions")));
    }

    @Test
    void shouldNotRetryConstraintViolations() {
        assertFalse(SerializationFailureDetector.isRetryable(new DataIntegrityViolationException("duplicate key",
                new SQLException("duplicate key value violates unique constraint", "23505"))));
        assertFalse(SerializationFailureDetector.isRetryable(null));
    }

    @Test
    void shouldTerminateOnCyclicCauses() {
        CyclicException first = new CyclicException("first");
        CyclicException second = new CyclicException("second");
        first.setCause(second);
        second.setCause(first);

        assertFalse(SerializationFailureDetector.isRetryable(first));
    }

    private static final class CyclicException extends RuntimeException {
        private Throwable cause;

        private CyclicException(String message) {
            super(message);
        }

        private void setCause(Throwable cause) {
            this.cause = cause;
        }

        @Override
        public synchronized Throwable getCause() {
            return cause;
        }
    }
}
