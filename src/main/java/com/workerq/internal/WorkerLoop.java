package com.workerq.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.workerq.JobScheduler;
import com.workerq.WorkerJob;
import com.workerq.WorkerJobStore;
import com.workerq.config.WorkerQProperties;
import com.workerq.exception.JobAlreadyClaimedException;
import com.workerq.exception.JobExecutionException;
import com.workerq.exception.JobNotFoundException;
import com.workerq.exception.TransactionSerializationException;
import com.workerq.exception.UnknownJobTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded polling engine of a worker process. Each cycle peeks at the earliest pending
 * job, claims it if it is due, runs it and records the outcome together with the follow-up
 * occurrence (cron continuation or failure retry) in one transaction.
 * <p>
 * Handler failures, including {@link Error}s short of an out-of-memory or internal JVM error,
 * never leave this class. A job whose row disappears while it runs is logged and skipped.
 * Transient persistence failures are logged and the next cycle tries again; any other
 * persistence failure ends {@link #run()}.
 */
@Component
@ConditionalOnProperty(prefix = "workerq", name = "role", havingValue = WorkerQProperties.ROLE_WORKER)
public class WorkerLoop {

    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    static final String MDC_JOB_ID = "workerJobId";
    static final String MDC_JOB_TYPE = "workerJobType";
    static final String MDC_WORKER_ID = "workerId";

    public enum CycleOutcome {
        /** Nothing pending. */
        IDLE,
        /** The earliest pending job is not due yet. */
        NOT_DUE,
        /** Another worker claimed the job between peek and claim. */
        CLAIM_LOST,
        SUCCEEDED,
        FAILED;

        public boolean executedJob() {
            return this == SUCCEEDED || this == FAILED;
        }
    }

    private final WorkerJobStore store;
    private final JobScheduler scheduler;
    private final JobHandlerRegistry registry;
    private final SerializableTransactionRunner transactionRunner;
    private final Duration pollInterval;
    private final String workerId;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile boolean running = false;

    public WorkerLoop(WorkerJobStore store, JobScheduler scheduler, JobHandlerRegistry registry,
            SerializableTransactionRunner transactionRunner, WorkerQProperties properties) {
        this.store = store;
        this.scheduler = scheduler;
        this.registry = registry;
        this.transactionRunner = transactionRunner;
        this.pollInterval = properties.getWorker().getPollInterval();
        this.workerId = String.valueOf(properties.getWorker().getId());
    }

    /**
     * Polls until {@link #stop()} is called. A job that is already running when stop is requested
     * is finished first.
     *
     * @throws org.springframework.dao.DataAccessException when the job store fails in a way that
     *                                                     retrying will not fix
     */
    public void run() {
        running = true;
        MDC.put(MDC_WORKER_ID, workerId);
        log.info("Worker {} polling for jobs every {} ms", workerId, pollInterval.toMillis());
        try {
            while (stopSignal.getCount() > 0) {
                CycleOutcome outcome;
                try {
                    outcome = runCycle();
                } catch (TransientDataAccessException | TransactionSerializationException e) {
                    log.warn("Worker cycle failed with a transient persistence error, retrying next cycle", e);
                    outcome = CycleOutcome.IDLE;
                }
                if (!outcome.executedJob() && awaitStop(pollInterval)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Worker {} interrupted", workerId);
        } finally {
            running = false;
            MDC.remove(MDC_WORKER_ID);
        }
        log.info("Worker {} stopped polling", workerId);
    }

    /**
     * Runs one iteration: idle check, peek, claim, execute, record.
     */
    public CycleOutcome runCycle() {
        if (store.countPending() == 0) {
            return CycleOutcome.IDLE;
        }
        Optional<WorkerJob> next = store.getNextPending();
        if (next.isEmpty()) {
            return CycleOutcome.IDLE;
        }
        WorkerJob candidate = next.get();
        if (candidate.getDue().isAfter(OffsetDateTime.now())) {
            return CycleOutcome.NOT_DUE;
        }

        WorkerJob claimed;
        try {
            claimed = store.markStarted(candidate.getId());
        } catch (JobAlreadyClaimedException | JobNotFoundException e) {
            log.debug("Job {} was taken before this worker could claim it", candidate.getId());
            return CycleOutcome.CLAIM_LOST;
        }
        return execute(claimed);
    }

    public void stop() {
        stopSignal.countDown();
    }

    public boolean isRunning() {
        return running;
    }

    private CycleOutcome execute(WorkerJob job) {
        MDC.put(MDC_JOB_ID, String.valueOf(job.getId()));
        MDC.put(MDC_JOB_TYPE, job.getType());
        long startedAt = System.nanoTime();
        try {
            JsonNode result = registry.execute(job);
            complete(job, true, result);
            log.debug("Job {} of type {} succeeded in {} ms", job.getId(), job.getType(), elapsedMillis(startedAt));
            return CycleOutcome.SUCCEEDED;
        } catch (UnknownJobTypeException e) {
            log.error("No handler registered for job {} of type {}", job.getId(), job.getType());
            complete(job, false, WorkerJobStore.errorResult(e.getMessage()));
            return CycleOutcome.FAILED;
        } catch (JobExecutionException e) {
            log.warn("Job {} of type {} failed after {} ms", job.getId(), job.getType(), elapsedMillis(startedAt),
                    e.getCause() != null ? e.getCause() : e);
            complete(job, false, WorkerJobStore.errorResult(e.getMessage()));
            return CycleOutcome.FAILED;
        } finally {
            MDC.remove(MDC_JOB_ID);
            MDC.remove(MDC_JOB_TYPE);
        }
    }

    private void complete(WorkerJob job, boolean success, JsonNode result) {
        try {
            transactionRunner.executeWithoutResult(() -> {
                WorkerJob finished = success
                        ? store.markSucceeded(job.getId(), result)
                        : store.markFailed(job.getId(), result);
                if (finished.isCron()) {
                    scheduler.rescheduleCronJob(finished);
                } else if (!success && finished.isAutoRescheduleOnFailure()) {
                    scheduler.rescheduleFailedJob(finished);
                }
            });
        } catch (JobNotFoundException e) {
            log.warn("Job {} of type {} was deleted while it ran, its outcome is dropped", job.getId(),
                    job.getType());
        }
    }

    private boolean awaitStop(Duration timeout) throws InterruptedException {
        return stopSignal.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static long elapsedMillis(long startedAtNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAtNanos);
    }
}
