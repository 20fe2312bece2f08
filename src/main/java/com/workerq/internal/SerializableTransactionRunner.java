package com.workerq.internal;

import com.workerq.config.WorkerQProperties;
import com.workerq.exception.TransactionSerializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;

/**
 * Runs a unit of work in a SERIALIZABLE transaction and retries it when PostgreSQL reports a
 * serialization conflict or deadlock.
 * <p>
 * Calls made while a transaction is already active join it and run exactly once. Retrying
 * there would replay only part of the outer unit of work.
 */
@Component
public class SerializableTransactionRunner {

    private static final Logger log = LoggerFactory.getLogger(SerializableTransactionRunner.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final TransactionTemplate serializableTemplate;
    private final TransactionTemplate joiningTemplate;
    private final int maxAttempts;
    private final Duration initialRetryDelay;
    private final double jitterFactor;
    private final Sleeper sleeper;

    @Autowired
    public SerializableTransactionRunner(PlatformTransactionManager transactionManager, WorkerQProperties properties) {
        this(transactionManager, properties.getTransaction(), duration -> Thread.sleep(duration.toMillis()));
    }

    SerializableTransactionRunner(PlatformTransactionManager transactionManager,
            WorkerQProperties.Transaction settings, Sleeper sleeper) {
        if (settings.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("workerq.transaction.max-attempts must be >= 1");
        }
        this.serializableTemplate = new TransactionTemplate(transactionManager);
        this.serializableTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_SERIALIZABLE);
        this.serializableTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.joiningTemplate = new TransactionTemplate(transactionManager);
        this.joiningTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.maxAttempts = settings.getMaxAttempts();
        this.initialRetryDelay = settings.getInitialRetryDelay();
        this.jitterFactor = settings.getJitterFactor();
        this.sleeper = sleeper;
    }

    public <T> T execute(TransactionCallback<T> action) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return joiningTemplate.execute(action);
        }

        RuntimeException lastConflict = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return serializableTemplate.execute(action);
            } catch (RuntimeException e) {
                if (!SerializationFailureDetector.isRetryable(e)) {
                    throw e;
                }
                lastConflict = e;
                if (attempt + 1 < maxAttempts) {
                    Duration delay = Backoff.exponentialWithJitter(initialRetryDelay, attempt, jitterFactor);
                    log.debug("Serialization conflict on attempt {}/{}, retrying in {} ms", attempt + 1, maxAttempts,
                            delay.toMillis());
                    pause(delay, attempt + 1, e);
                }
            }
        }
        log.warn("Serializable transaction gave up after {} attempts", maxAttempts);
        throw new TransactionSerializationException(maxAttempts, lastConflict);
    }

    public void executeWithoutResult(Runnable action) {
        execute(status -> {
            action.run();
            return null;
        });
    }

    private void pause(Duration delay, int attemptsMade, RuntimeException conflict) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new TransactionSerializationException(attemptsMade, conflict);
        }
    }
}
