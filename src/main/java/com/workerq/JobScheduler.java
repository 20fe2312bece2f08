package com.workerq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.workerq.exception.JobValidationException;
import com.workerq.internal.SerializableTransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for creating and cancelling work. Scheduling a job for a {@code (type, ownerId)}
 * pair cancels whatever is still pending for that pair in the same transaction, so at most one
 * job per pair is ever waiting to run.
 */
@Service
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    static final String EXPLICIT_CANCEL_MESSAGE = "Job cancelled";

    private final WorkerJobStore store;
    private final SerializableTransactionRunner transactionRunner;
    private final ObjectMapper objectMapper;

    public JobScheduler(WorkerJobStore store, SerializableTransactionRunner transactionRunner,
            ObjectMapper objectMapper) {
        this.store = store;
        this.transactionRunner = transactionRunner;
        this.objectMapper = objectMapper;
    }

    /**
     * Schedules a one-shot job, replacing any pending job of the same type and owner.
     *
     * @throws JobValidationException if the request is malformed; nothing is written then
     */
    public WorkerJob scheduleJob(JobRequest request) {
        WorkerJob job = toWorkerJob(request);
        job.setDue(request.getDue() != null ? request.getDue() : OffsetDateTime.now());
        job.setRemoveAt(job.getDue().plus(request.getRemoveDelay()));
        WorkerJob saved = replacePending(job);
        log.debug("Scheduled job {} of type {} for owner {} due at {}", saved.getId(), saved.getType(),
                saved.getOwnerId(), saved.getDue());
        return saved;
    }

    /**
     * Schedules a recurring job. The first occurrence is due at the next time the 6-field cron
     * expression (seconds first) fires; every completed occurrence schedules the next one.
     *
     * @throws JobValidationException if the request or the cron expression is malformed
     */
    public WorkerJob scheduleCronJob(JobRequest request, String cronExpression) {
        WorkerJob job = toWorkerJob(request);
        CronExpression cron = parseCron(cronExpression);
        OffsetDateTime due = nextOccurrence(cron, cronExpression, OffsetDateTime.now());
        job.setCronSchedule(cronExpression.trim());
        job.setDue(due);
        job.setRemoveAt(due.plus(request.getRemoveDelay()));
        WorkerJob saved = replacePending(job);
        log.debug("Scheduled cron job {} of type {} for owner {} with '{}', first run at {}", saved.getId(),
                saved.getType(), saved.getOwnerId(), saved.getCronSchedule(), saved.getDue());
        return saved;
    }

    /**
     * Creates the retry of a failed one-shot job, due {@code autoRescheduleOnFailureDelay} from
     * now. Empty when the job was cancelled or superseded by a newer schedule in the meantime.
     */
    public Optional<WorkerJob> rescheduleFailedJob(WorkerJob failedJob) {
        requirePersisted(failedJob);
        return transactionRunner.execute(status -> {
            WorkerJob current = store.getById(failedJob.getId()).orElse(failedJob);
            if (!current.isAutoRescheduleOnFailure() || store.hasNewerJob(current)) {
                log.debug("Not retrying job {} of type {}: retry was cancelled or superseded", current.getId(),
                        current.getType());
                return Optional.<WorkerJob>empty();
            }
            OffsetDateTime due = OffsetDateTime.now().plus(Duration.ofMillis(current.getAutoRescheduleOnFailureDelay()));
            WorkerJob successor = successorOf(current, due);
            successor.setCronSchedule(null);
            store.cancelPending(current.getType(), current.getOwnerId());
            WorkerJob saved = store.insert(successor);
            log.info("Rescheduled failed job {} of type {} as job {} due at {}", current.getId(), current.getType(),
                    saved.getId(), saved.getDue());
            return Optional.of(saved);
        });
    }

    /**
     * Creates the next occurrence of a cron job, due at the next time its expression fires after
     * the completed occurrence finished. Empty when the chain was cancelled or superseded.
     */
    public Optional<WorkerJob> rescheduleCronJob(WorkerJob completedJob) {
        requirePersisted(completedJob);
        return transactionRunner.execute(status -> {
            WorkerJob current = store.getById(completedJob.getId()).orElse(completedJob);
            if (!current.isCron() || store.hasNewerJob(current)) {
                log.debug("Cron chain of job {} of type {} was cancelled or superseded", current.getId(),
                        current.getType());
                return Optional.<WorkerJob>empty();
            }
            CronExpression cron = parseCron(current.getCronSchedule());
            OffsetDateTime after = current.getFinished() != null ? current.getFinished() : OffsetDateTime.now();
            OffsetDateTime due = nextOccurrence(cron, current.getCronSchedule(), after);
            WorkerJob successor = successorOf(current, due);
            store.cancelPending(current.getType(), current.getOwnerId());
            WorkerJob saved = store.insert(successor);
            log.debug("Next run of cron job {} is job {} at {}", current.getType(), saved.getId(), saved.getDue());
            return Optional.of(saved);
        });
    }

    /**
     * Cancels pending jobs of {@code (type, ownerId)} and stops a running occurrence from
     * spawning a cron successor or a retry.
     *
     * @return number of pending jobs cancelled
     */
    public int cancelJobs(String type, int ownerId) {
        String normalizedType = normalizeRequiredType(type);
        return transactionRunner.execute(status -> {
            int cancelled = store.cancelPending(normalizedType, ownerId, EXPLICIT_CANCEL_MESSAGE);
            int detached = store.detachSuccessors(normalizedType, ownerId);
            log.info("Cancelled {} pending and detached {} running job(s) of type {} for owner {}", cancelled,
                    detached, normalizedType, ownerId);
            return cancelled;
        });
    }

    /**
     * Deletes expired jobs except the ones in {@code excludedIds}.
     *
     * @return number of deleted rows
     */
    public int removeOldJobs(Collection<Long> excludedIds) {
        return store.removeExpired(excludedIds == null ? List.of() : excludedIds);
    }

    public Optional<WorkerJob> getJob(long id) {
        return store.getById(id);
    }

    public long countPendingJobs() {
        return store.countPending();
    }

    private WorkerJob replacePending(WorkerJob job) {
        return transactionRunner.execute(status -> {
            store.cancelPending(job.getType(), job.getOwnerId());
            return store.insert(job);
        });
    }

    private WorkerJob toWorkerJob(JobRequest request) {
        if (request == null) {
            throw new JobValidationException("Job request must not be null");
        }
        String type = normalizeRequiredType(request.getType());
        if (request.getOwnerId() < 0) {
            throw new JobValidationException("ownerId must be >= 0 but was " + request.getOwnerId());
        }
        int retryDelay = toMillis("autoRescheduleOnFailureDelay", request.getAutoRescheduleOnFailureDelay());
        int removeDelay = toMillis("removeDelay", request.getRemoveDelay());

        WorkerJob job = new WorkerJob();
        job.setType(type);
        job.setTag(normalizeTag(request.getTag(), type));
        job.setOwnerId(request.getOwnerId());
        job.setData(toData(request.getData()));
        job.setAutoRescheduleOnFailure(request.isAutoRescheduleOnFailure());
        job.setAutoRescheduleOnFailureDelay(retryDelay);
        job.setRemoveDelay(removeDelay);
        job.setPersistent(request.isPersistent());
        return job;
    }

    private WorkerJob successorOf(WorkerJob previous, OffsetDateTime due) {
        WorkerJob successor = new WorkerJob();
        successor.setTag(previous.getTag());
        successor.setType(previous.getType());
        successor.setOwnerId(previous.getOwnerId());
        successor.setData(previous.getData() != null ? previous.getData().deepCopy() : objectMapper.createObjectNode());
        successor.setCronSchedule(previous.getCronSchedule());
        successor.setAutoRescheduleOnFailure(previous.isAutoRescheduleOnFailure());
        successor.setAutoRescheduleOnFailureDelay(previous.getAutoRescheduleOnFailureDelay());
        successor.setRemoveDelay(previous.getRemoveDelay());
        successor.setPersistent(previous.isPersistent());
        successor.setRescheduledFromJob(previous.getId());
        successor.setDue(due);
        successor.setRemoveAt(due.plus(Duration.ofMillis(previous.getRemoveDelay())));
        return successor;
    }

    private JsonNode toData(Object data) {
        if (data == null) {
            return objectMapper.createObjectNode();
        }
        JsonNode node;
        try {
            node = objectMapper.valueToTree(data);
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("Job data cannot be converted to JSON: " + e.getMessage(), e);
        }
        if (node == null || node.isNull()) {
            return objectMapper.createObjectNode();
        }
        if (!(node instanceof ObjectNode)) {
            throw new JobValidationException("Job data must be a JSON object but was " + node.getNodeType());
        }
        return node;
    }

    private CronExpression parseCron(String cronExpression) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new JobValidationException("Cron expression must not be blank");
        }
        try {
            return CronExpression.parse(cronExpression.trim());
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("Invalid cron expression '" + cronExpression + "': " + e.getMessage(), e);
        }
    }

    private OffsetDateTime nextOccurrence(CronExpression cron, String expression, OffsetDateTime after) {
        OffsetDateTime next = cron.next(after);
        if (next == null) {
            throw new JobValidationException("Cron expression '" + expression + "' never fires after " + after);
        }
        return next;
    }

    private String normalizeRequiredType(String type) {
        if (type == null) {
            throw new JobValidationException("Job type must not be null");
        }
        String trimmed = type.trim();
        if (trimmed.isEmpty()) {
            throw new JobValidationException("Job type must not be blank");
        }
        return trimmed;
    }

    private String normalizeTag(String tag, String type) {
        if (tag == null) {
            return type;
        }
        String trimmed = tag.trim();
        return trimmed.isEmpty() ? type : trimmed;
    }

    private int toMillis(String name, Duration duration) {
        if (duration == null) {
            throw new JobValidationException(name + " must not be null");
        }
        if (duration.isNegative()) {
            throw new JobValidationException(name + " must not be negative but was " + duration);
        }
        long millis = duration.toMillis();
        if (millis > Integer.MAX_VALUE) {
            throw new JobValidationException(name + " is too large: " + duration);
        }
        return (int) millis;
    }

    private void requirePersisted(WorkerJob job) {
        if (job == null || job.getId() == null) {
            throw new IllegalArgumentException("Only stored jobs can be rescheduled");
        }
    }
}
