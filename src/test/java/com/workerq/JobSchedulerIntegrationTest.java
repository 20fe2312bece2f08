package com.workerq;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@SpringBootTest(classes = TestApplication.class)
class JobSchedulerIntegrationTest extends PostgresIntegrationTest {

    @Autowired
    JobScheduler scheduler;

    @Autowired
    WorkerJobStore store;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanTable() {
        jdbcTemplate.update("DELETE FROM worker_jobs");
    }

    @Test
    void shouldStoreScheduledJobWithDefaults() {
        WorkerJob job = scheduler.scheduleJob(JobRequest.of("sendEmail", 42).data(Map.of("to", "a@example.com")));

        assertThat(job.getId()).isNotNull();
        assertThat(job.getTag()).isEqualTo("sendEmail");
        assertThat(job.getOwnerId()).isEqualTo(42);
        assertThat(job.getData().get("to").asText()).isEqualTo("a@example.com");
        assertThat(job.getDue()).isCloseTo(OffsetDateTime.now(), within(5, ChronoUnit.SECONDS));
        assertThat(job.getRemoveAt()).isEqualTo(job.getDue());
        assertThat(job.getStarted()).isNull();
        assertThat(job.getCronSchedule()).isNull();
        assertThat(job.isPersistent()).isFalse();
    }

    @Test
    void shouldComputeRemoveAtFromDueAndRemoveDelay() {
        OffsetDateTime due = OffsetDateTime.now().plusHours(2).truncatedTo(ChronoUnit.SECONDS);

        WorkerJob job = scheduler.scheduleJob(JobRequest.of("archive", 1).due(due).removeDelay(Duration.ofDays(1)));

        WorkerJob stored = store.getById(job.getId()).orElseThrow();
        assertThat(stored.getDue().toInstant()).isEqualTo(due.toInstant());
        assertThat(stored.getRemoveAt().toInstant()).isEqualTo(due.plusDays(1).toInstant());
        assertThat(stored.getRemoveDelay()).isEqualTo((int) Duration.ofDays(1).toMillis());
    }

    @Test
    void shouldKeepAtMostOnePendingJobPerTypeAndOwner() {
        WorkerJob first = scheduler.scheduleJob(JobRequest.of("sync", 7).due(OffsetDateTime.now().plusMinutes(1)));
        WorkerJob second = scheduler.scheduleJob(JobRequest.of("sync", 7).due(OffsetDateTime.now().plusMinutes(2)));
        WorkerJob otherOwner = scheduler.scheduleJob(JobRequest.of("sync", 8));

        WorkerJob cancelled = store.getById(first.getId()).orElseThrow();
        assertThat(cancelled.getFinished()).isNotNull();
        assertThat(cancelled.getSuccess()).isFalse();
        assertThat(cancelled.getResult().get("error").asText()).isEqualTo(WorkerJobStore.CANCELLED_MESSAGE);
        assertThat(store.getById(second.getId()).orElseThrow().getFinished()).isNull();
        assertThat(store.getById(otherOwner.getId()).orElseThrow().getFinished()).isNull();
        assertThat(pendingRows("sync", 7)).isEqualTo(1);
    }

    @Test
    void shouldScheduleCronJobAtNextOccurrence() {
        OffsetDateTime before = OffsetDateTime.now();

        WorkerJob job = scheduler.scheduleCronJob(JobRequest.of("hourlyReport", 0), " 0 0 * * * * ");

        OffsetDateTime expected = CronExpression.parse("0 0 * * * *").next(before);
        assertThat(job.getCronSchedule()).isEqualTo("0 0 * * * *");
        assertThat(job.getDue().toInstant()).isEqualTo(expected.toInstant());
        assertThat(job.getRemoveAt()).isEqualTo(job.getDue());
    }

    @Test
    void shouldCreateNextCronOccurrenceAfterCompletion() {
        WorkerJob job = scheduler.scheduleCronJob(JobRequest.of("everySecond", 3).data(Map.of("n", 1)), "* * * * * *");
        store.markStarted(job.getId());
        WorkerJob finished = store.markSucceeded(job.getId(), JsonNodeFactory.instance.objectNode());

        Optional<WorkerJob> next = scheduler.rescheduleCronJob(finished);

        assertThat(next).isPresent();
        WorkerJob successor = next.get();
        assertThat(successor.getRescheduledFromJob()).isEqualTo(job.getId());
        assertThat(successor.getCronSchedule()).isEqualTo("* * * * * *");
        assertThat(successor.getData().get("n").asInt()).isEqualTo(1);
        assertThat(successor.getDue()).isAfter(finished.getFinished());
        assertThat(successor.getStarted()).isNull();
    }

    @Test
    void shouldNotContinueCronChainWhenANewerJobExists() {
        WorkerJob job = scheduler.scheduleCronJob(JobRequest.of("nightly", 3), "0 0 3 * * *");
        store.markStarted(job.getId());
        WorkerJob finished = store.markSucceeded(job.getId(), JsonNodeFactory.instance.objectNode());
        WorkerJob replacement = scheduler.scheduleJob(JobRequest.of("nightly", 3));

        assertThat(scheduler.rescheduleCronJob(finished)).isEmpty();
        assertThat(pendingRows("nightly", 3)).isEqualTo(1);
        assertThat(store.getById(replacement.getId()).orElseThrow().getFinished()).isNull();
    }

    @Test
    void shouldRetryFailedJobAfterConfiguredDelay() {
        WorkerJob job = scheduler.scheduleJob(JobRequest.of("flaky", 9)
                .autoRescheduleOnFailure(Duration.ofMinutes(5))
                .removeDelay(Duration.ofMinutes(1)));
        store.markStarted(job.getId());
        WorkerJob failed = store.markFailed(job.getId(), WorkerJobStore.errorResult("boom"));
        OffsetDateTime before = OffsetDateTime.now();

        WorkerJob retry = scheduler.rescheduleFailedJob(failed).orElseThrow();

        assertThat(retry.getRescheduledFromJob()).isEqualTo(job.getId());
        assertThat(retry.getCronSchedule()).isNull();
        assertThat(retry.isAutoRescheduleOnFailure()).isTrue();
        assertThat(retry.getDue()).isCloseTo(before.plusMinutes(5), within(5, ChronoUnit.SECONDS));
        assertThat(retry.getRemoveAt()).isEqualTo(retry.getDue().plusMinutes(1));
    }

    @Test
    void shouldCancelPendingJobsAndDetachRunningOccurrence() {
        WorkerJob running = scheduler.scheduleCronJob(JobRequest.of("poll", 4), "* * * * * *");
        jdbcTemplate.update("UPDATE worker_jobs SET due = now() - interval '1 second' WHERE id = ?", running.getId());
        store.markStarted(running.getId());

        int cancelled = scheduler.cancelJobs("poll", 4);

        assertThat(cancelled).isZero();
        WorkerJob detached = store.getById(running.getId()).orElseThrow();
        assertThat(detached.getCronSchedule()).isNull();
        WorkerJob finished = store.markSucceeded(running.getId(), JsonNodeFactory.instance.objectNode());
        assertThat(scheduler.rescheduleCronJob(finished)).isEmpty();
        assertThat(pendingRows("poll", 4)).isZero();
    }

    @Test
    void shouldReportExplicitCancellationMessage() {
        WorkerJob job = scheduler.scheduleJob(JobRequest.of("digest", 2).due(OffsetDateTime.now().plusHours(1)));

        assertThat(scheduler.cancelJobs("digest", 2)).isEqualTo(1);
        assertThat(store.getById(job.getId()).orElseThrow().getResult().get("error").asText())
                .isEqualTo(JobScheduler.EXPLICIT_CANCEL_MESSAGE);
        assertThat(scheduler.countPendingJobs()).isZero();
    }

    @Test
    void shouldRemoveOldJobsButNotPersistentOnes() {
        WorkerJob plain = scheduler.scheduleJob(JobRequest.of("once", 1));
        WorkerJob kept = scheduler.scheduleJob(JobRequest.of("keep", 1).persistent(true));
        for (WorkerJob job : List.of(plain, kept)) {
            store.markStarted(job.getId());
            store.markSucceeded(job.getId(), JsonNodeFactory.instance.objectNode());
        }

        assertThat(scheduler.removeOldJobs(List.of())).isEqualTo(1);
        assertThat(scheduler.getJob(plain.getId())).isEmpty();
        assertThat(scheduler.getJob(kept.getId())).isPresent();
    }

    private int pendingRows(String type, int ownerId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM worker_jobs WHERE type = ? AND user_id = ? AND finished IS NULL", Integer.class,
                type, ownerId);
        return count == null ? 0 : count;
    }
}
