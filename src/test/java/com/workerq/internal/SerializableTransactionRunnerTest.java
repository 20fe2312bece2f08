package com.workerq.internal;

import com.workerq.config.WorkerQProperties;
import com.workerq.exception.TransactionSerializationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SerializableTransactionRunnerTest {

    private PlatformTransactionManager transactionManager;
    private WorkerQProperties.Transaction settings;
    private List<Duration> sleeps;
    private SerializableTransactionRunner runner;

    @BeforeEach
    void setUp() {
        transactionManager = mock(PlatformTransactionManager.class);
        settings = new WorkerQProperties().getTransaction();
        settings.setMaxAttempts(4);
        settings.setInitialRetryDelay(Duration.ofMillis(10));
        settings.setJitterFactor(0.0);
        sleeps = new ArrayList<>();
        runner = new SerializableTransactionRunner(transactionManager, settings, sleeps::add);
    }

    @AfterEach
    void resetTransactionState() {
        TransactionSynchronizationManager.setActualTransactionActive(false);
    }

    @Test
    void shouldRunInSerializableTransaction() {
        String result = runner.execute(status -> "done");

        assertThat(result).isEqualTo("done");
        verify(transactionManager).getTransaction(argThat(definition ->
                definition.getIsolationLevel() == TransactionDefinition.ISOLATION_SERIALIZABLE));
        assertThat(sleeps).isEmpty();
    }

    @Test
    void shouldRetrySerializationFailureWithExponentialBackoff() {
        AtomicInteger attempts = new AtomicInteger();

        Integer result = runner.execute(status -> {
            if (attempts.incrementAndGet() < 3) {
                throw serializationFailure();
            }
            return attempts.get();
        });

        assertThat(result).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20));
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> runner.execute(status -> {
            attempts.incrementAndGet();
            throw serializationFailure();
        }))
                .isInstanceOfSatisfying(TransactionSerializationException.class,
                        e -> assertThat(e.getAttempts()).isEqualTo(4))
                .hasCauseInstanceOf(CannotAcquireLockException.class);

        assertThat(attempts).hasValue(4);
        // no pause after the final attempt
        assertThat(sleeps).hasSize(3);
    }

    @Test
    void shouldMakeSevenAttemptsByDefault() {
        runner = new SerializableTransactionRunner(transactionManager, new WorkerQProperties().getTransaction(),
                sleeps::add);
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> runner.execute(status -> {
            attempts.incrementAndGet();
            throw serializationFailure();
        })).isInstanceOf(TransactionSerializationException.class);

        assertThat(attempts).hasValue(7);
        assertThat(sleeps).hasSize(6);
    }

    @Test
    void shouldNotRetryOtherFailures() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> runner.execute(status -> {
            attempts.incrementAndGet();
            throw new DataIntegrityViolationException("duplicate key");
        })).isInstanceOf(DataIntegrityViolationException.class);

        assertThat(attempts).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void shouldRunExactlyOnceInsideActiveTransaction() {
        TransactionSynchronizationManager.setActualTransactionActive(true);
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> runner.execute(status -> {
            attempts.incrementAndGet();
            throw serializationFailure();
        })).isInstanceOf(CannotAcquireLockException.class);

        assertThat(attempts).hasValue(1);
        assertThat(sleeps).isEmpty();
        verify(transactionManager, atLeastOnce()).getTransaction(argThat(definition ->
                definition.getPropagationBehavior() == TransactionDefinition.PROPAGATION_REQUIRED));
    }

    @Test
    void shouldStopRetryingWhenInterrupted() {
        runner = new SerializableTransactionRunner(transactionManager, settings, duration -> {
            throw new InterruptedException();
        });

        try {
            assertThatThrownBy(() -> runner.execute(status -> {
                throw serializationFailure();
            })).isInstanceOfSatisfying(TransactionSerializationException.class,
                    e -> assertThat(e.getAttempts()).isEqualTo(1));
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void shouldRejectNonPositiveMaxAttempts() {
        settings.setMaxAttempts(0);

        assertThatThrownBy(() -> new SerializableTransactionRunner(transactionManager, settings, sleeps::add))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static RuntimeException serializationFailure() {
        return new CannotAcquireLockException("could not execute statement",
                new SQLException("ERROR: could not serialize access due to concurrent update", "40001"));
    }
}
