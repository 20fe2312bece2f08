package com.workerq.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.workerq.JobContext;
import com.workerq.JobHandler;
import com.workerq.JobScheduler;
import com.workerq.annotation.WorkerJobType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * System job that deletes expired job rows. It runs as an ordinary cron job seeded at worker
 * startup, and never deletes the row it is running as.
 */
@Component
@ConditionalOnProperty(prefix = "workerq.cleanup", name = "enabled", havingValue = "true", matchIfMissing = true)
@WorkerJobType(value = RemoveOldWorkerJobsHandler.TYPE, cron = "${workerq.cleanup.cron:0 * * * * *}",
        autoRescheduleOnFailure = true, autoRescheduleOnFailureDelayMs = 60_000)
public class RemoveOldWorkerJobsHandler implements JobHandler<JsonNode> {

    public static final String TYPE = "removeOldWorkerJobs";

    private final JobScheduler scheduler;

    public RemoveOldWorkerJobsHandler(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public Object run(JobContext<JsonNode> context) {
        int removed = scheduler.removeOldJobs(List.of(context.jobId()));
        if (removed > 0) {
            context.log().info("Removed {} expired worker job(s)", removed);
        }
        return Map.of("removed", removed);
    }
}
