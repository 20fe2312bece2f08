package com.workerq.internal;

import com.workerq.JobHandler;
import com.workerq.JobRequest;
import com.workerq.JobScheduler;
import com.workerq.WorkerJob;
import com.workerq.annotation.WorkerJobType;
import com.workerq.config.WorkerQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds the system jobs declared via {@code @WorkerJobType(cron = "...")} when a worker starts.
 * Seeding goes through {@link JobScheduler#scheduleCronJob}, which replaces any pending
 * occurrence, so every worker process can do it without creating duplicates.
 */
@Component
@ConditionalOnProperty(prefix = "workerq", name = "role", havingValue = WorkerQProperties.ROLE_WORKER)
public class RecurringJobInitializer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RecurringJobInitializer.class);

    static final int SYSTEM_OWNER_ID = 0;

    private final JobScheduler scheduler;
    private final List<JobHandler<?>> handlers;
    private final Environment environment;
    private volatile boolean running = false;

    public RecurringJobInitializer(JobScheduler scheduler, List<JobHandler<?>> handlers, Environment environment) {
        this.scheduler = scheduler;
        this.handlers = handlers;
        this.environment = environment;
    }

    @Override
    public void start() {
        Map<String, RecurringDefinition> recurringJobs = new LinkedHashMap<>();
        for (JobHandler<?> handler : handlers) {
            WorkerJobType annotation = AnnotationUtils.findAnnotation(ClassUtils.getUserClass(handler),
                    WorkerJobType.class);
            if (annotation == null || annotation.cron().isBlank()) {
                continue;
            }
            String cron = environment.resolveRequiredPlaceholders(annotation.cron()).trim();
            if (cron.isEmpty()) {
                continue;
            }
            RecurringDefinition definition = new RecurringDefinition(handler.getJobType(), cron,
                    annotation.autoRescheduleOnFailure(), annotation.autoRescheduleOnFailureDelayMs(),
                    annotation.removeDelayMs());
            recurringJobs.put(definition.type(), definition);
        }

        if (!recurringJobs.isEmpty()) {
            log.info("Seeding {} recurring system job(s): {}", recurringJobs.size(), recurringJobs.keySet());
        }
        for (RecurringDefinition definition : recurringJobs.values()) {
            seed(definition);
        }
        this.running = true;
    }

    private void seed(RecurringDefinition definition) {
        JobRequest request = JobRequest.of(definition.type(), SYSTEM_OWNER_ID)
                .autoRescheduleOnFailure(definition.autoRescheduleOnFailure(),
                        Duration.ofMillis(definition.autoRescheduleOnFailureDelayMs()))
                .removeDelay(Duration.ofMillis(definition.removeDelayMs()));
        try {
            WorkerJob seeded = scheduler.scheduleCronJob(request, definition.cron());
            log.info("Recurring job {} with cron '{}' first runs at {}", definition.type(), definition.cron(),
                    seeded.getDue());
        } catch (RuntimeException e) {
            log.error("Failed to seed recurring job {} with cron '{}'", definition.type(), definition.cron(), e);
        }
    }

    @Override
    public void stop() {
        this.running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        // before the worker loop starts polling
        return Integer.MAX_VALUE - 1;
    }

    private record RecurringDefinition(String type, String cron, boolean autoRescheduleOnFailure,
            long autoRescheduleOnFailureDelayMs, long removeDelayMs) {
    }
}
