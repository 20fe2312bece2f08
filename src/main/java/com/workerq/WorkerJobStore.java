package com.workerq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.workerq.config.WorkerQProperties;
import com.workerq.exception.JobAlreadyClaimedException;
import com.workerq.exception.JobNotFoundException;
import com.workerq.internal.SerializableTransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable access to the {@code worker_jobs} table. Every operation runs through the
 * {@link SerializableTransactionRunner}, so a call made inside a scheduler transaction
 * joins it and a standalone call gets its own retried transaction.
 */
@Service
public class WorkerJobStore {

    private static final Logger log = LoggerFactory.getLogger(WorkerJobStore.class);

    public static final String CANCELLED_MESSAGE = "Job cancelled due to new job being created";

    private final WorkerJobRepository repository;
    private final SerializableTransactionRunner transactionRunner;
    private final Duration staleClaimThreshold;

    public WorkerJobStore(WorkerJobRepository repository, SerializableTransactionRunner transactionRunner,
            WorkerQProperties properties) {
        this.repository = repository;
        this.transactionRunner = transactionRunner;
        this.staleClaimThreshold = properties.getWorker().getStaleClaimThreshold();
    }

    /**
     * Inserts a new row and returns it with its generated id.
     */
    public WorkerJob insert(WorkerJob job) {
        if (job.getId() != null) {
            throw new IllegalArgumentException("Cannot insert worker job that already has id " + job.getId());
        }
        return transactionRunner.execute(status -> repository.saveAndFlush(job));
    }

    public Optional<WorkerJob> getById(long id) {
        return repository.findById(id);
    }

    /**
     * Number of rows matching the pending predicate right now.
     */
    public long countPending() {
        return repository.countPending(staleBefore(OffsetDateTime.now()));
    }

    /**
     * The pending row with the earliest due date, or empty. This does not claim the row.
     */
    public Optional<WorkerJob> getNextPending() {
        List<WorkerJob> next = repository.findPending(staleBefore(OffsetDateTime.now()), PageRequest.of(0, 1));
        return next.isEmpty() ? Optional.empty() : Optional.of(next.get(0));
    }

    /**
     * Claims a row by setting {@code started}. The write only succeeds while the row is still
     * pending, which is what keeps two workers from running the same job.
     *
     * @throws JobNotFoundException       if the row does not exist
     * @throws JobAlreadyClaimedException if the row exists but is no longer pending
     */
    public WorkerJob markStarted(long id) {
        return transactionRunner.execute(status -> {
            OffsetDateTime now = OffsetDateTime.now();
            int updated = repository.claim(id, now, staleBefore(now));
            if (updated == 0) {
                if (!repository.existsById(id)) {
                    throw new JobNotFoundException(id);
                }
                throw new JobAlreadyClaimedException(id);
            }
            return repository.findById(id).orElseThrow(() -> new JobNotFoundException(id));
        });
    }

    public WorkerJob markSucceeded(long id, JsonNode result) {
        return finish(id, true, result);
    }

    public WorkerJob markFailed(long id, JsonNode result) {
        return finish(id, false, result);
    }

    /**
     * Marks every pending row of {@code (type, ownerId)} as finished and failed with a
     * cancellation result.
     *
     * @return number of cancelled rows
     */
    public int cancelPending(String type, int ownerId) {
        return cancelPending(type, ownerId, CANCELLED_MESSAGE);
    }

    public int cancelPending(String type, int ownerId, String reason) {
        return transactionRunner.execute(status -> {
            OffsetDateTime now = OffsetDateTime.now();
            List<WorkerJob> pending = repository.findPendingByTypeAndOwner(type, ownerId, staleBefore(now));
            for (WorkerJob job : pending) {
                job.setStarted(now);
                job.setFinished(now);
                job.setSuccess(false);
                job.setResult(errorResult(reason));
            }
            repository.saveAllAndFlush(pending);
            if (!pending.isEmpty()) {
                log.debug("Cancelled {} pending job(s) of type {} for owner {}", pending.size(), type, ownerId);
            }
            return pending.size();
        });
    }

    /**
     * Clears the cron schedule and the retry flag on unfinished rows of {@code (type, ownerId)}
     * so that an occurrence that is still running does not spawn a successor.
     */
    public int detachSuccessors(String type, int ownerId) {
        return transactionRunner.execute(status -> repository.detachSuccessors(type, ownerId, OffsetDateTime.now()));
    }

    /**
     * Whether a row of the same {@code (type, ownerId)} was created after {@code job}.
     */
    public boolean hasNewerJob(WorkerJob job) {
        return repository.existsByTypeAndOwnerIdAndIdGreaterThan(job.getType(), job.getOwnerId(), job.getId());
    }

    /**
     * Deletes finished, non-persistent rows whose {@code removeAt} has passed, except the
     * rows listed in {@code excludedIds}. A claimed row that is still running is never deleted.
     *
     * @return number of deleted rows
     */
    public int removeExpired(Collection<Long> excludedIds) {
        return transactionRunner.execute(status -> {
            OffsetDateTime now = OffsetDateTime.now();
            if (excludedIds == null || excludedIds.isEmpty()) {
                return repository.deleteExpired(now);
            }
            return repository.deleteExpiredExcluding(now, excludedIds);
        });
    }

    public WorkerJobRepository.LifecycleCounts countLifecycle() {
        return repository.countLifecycleCounts(staleBefore(OffsetDateTime.now()));
    }

    public Duration getStaleClaimThreshold() {
        return staleClaimThreshold;
    }

    private WorkerJob finish(long id, boolean success, JsonNode result) {
        return transactionRunner.execute(status -> {
            WorkerJob job = repository.findById(id).orElseThrow(() -> new JobNotFoundException(id));
            job.setFinished(OffsetDateTime.now());
            job.setSuccess(success);
            job.setResult(result);
            return repository.saveAndFlush(job);
        });
    }

    private OffsetDateTime staleBefore(OffsetDateTime now) {
        return now.minus(staleClaimThreshold);
    }

    /**
     * The {@code {"error": message}} shape used for every failed job result.
     */
    public static ObjectNode errorResult(String message) {
        return JsonNodeFactory.instance.objectNode().put("error", message);
    }
}
