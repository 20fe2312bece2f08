package com.workerq.internal;

import com.workerq.WorkerJobRepository;
import com.workerq.WorkerJobStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Job lifecycle gauges. Every gauge reads the same {@link Sample}; a sample older than
 * {@link #MAX_SAMPLE_AGE} is replaced by one aggregate query, so a scrape costs a single round
 * trip no matter how many gauges it reads.
 */
public class WorkerQMetrics {

    private static final Logger log = LoggerFactory.getLogger(WorkerQMetrics.class);

    static final Duration MAX_SAMPLE_AGE = Duration.ofSeconds(1);

    enum Status {
        PENDING(WorkerJobRepository.LifecycleCounts::getPendingCount),
        RUNNING(WorkerJobRepository.LifecycleCounts::getRunningCount),
        SUCCEEDED(WorkerJobRepository.LifecycleCounts::getSucceededCount),
        FAILED(WorkerJobRepository.LifecycleCounts::getFailedCount);

        private final Function<WorkerJobRepository.LifecycleCounts, Long> column;

        Status(Function<WorkerJobRepository.LifecycleCounts, Long> column) {
            this.column = column;
        }

        long readFrom(WorkerJobRepository.LifecycleCounts counts) {
            Long value = column.apply(counts);
            return value != null ? value : 0L;
        }
    }

    private final WorkerJobStore store;
    private final MeterRegistry meterRegistry;
    private final AtomicReference<Sample> latest = new AtomicReference<>(Sample.NONE);

    public WorkerQMetrics(WorkerJobStore store, MeterRegistry meterRegistry) {
        this.store = store;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        for (Status status : Status.values()) {
            Gauge.builder("workerq.jobs.count", this, metrics -> metrics.countFor(status))
                    .description("Number of worker jobs by lifecycle status")
                    .tag("status", status.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry);
        }
        Gauge.builder("workerq.jobs.total", this, WorkerQMetrics::totalCount)
                .description("Total number of worker jobs in the database")
                .register(meterRegistry);
        log.debug("Registered {} worker job gauges", Status.values().length + 1);
    }

    double countFor(Status status) {
        return sample().count(status);
    }

    double totalCount() {
        return sample().total();
    }

    private Sample sample() {
        Sample current = latest.get();
        if (current.isFresh(System.nanoTime())) {
            return current;
        }
        synchronized (latest) {
            current = latest.get();
            long now = System.nanoTime();
            if (current.isFresh(now)) {
                return current;
            }
            Sample next = query(current, now);
            latest.set(next);
            return next;
        }
    }

    private Sample query(Sample previous, long now) {
        WorkerJobRepository.LifecycleCounts counts;
        try {
            counts = store.countLifecycle();
        } catch (RuntimeException e) {
            log.debug("Could not query worker job counts for metrics: {}", e.getMessage());
            return previous.restampedAt(now);
        }
        Map<Status, Long> values = new EnumMap<>(Status.class);
        for (Status status : Status.values()) {
            values.put(status, status.readFrom(counts));
        }
        return new Sample(Collections.unmodifiableMap(values), now);
    }

    /**
     * Counts per status as of {@code takenAtNanos}. A failed query re-stamps the previous sample
     * so the database is not queried again until it ages out.
     */
    record Sample(Map<Status, Long> counts, long takenAtNanos) {

        static final Sample NONE = new Sample(Map.of(), Long.MIN_VALUE);

        boolean isFresh(long nowNanos) {
            return takenAtNanos != Long.MIN_VALUE && nowNanos - takenAtNanos <= MAX_SAMPLE_AGE.toNanos();
        }

        long count(Status status) {
            return counts.getOrDefault(status, 0L);
        }

        long total() {
            return counts.values().stream().mapToLong(Long::longValue).sum();
        }

        Sample restampedAt(long nowNanos) {
            return new Sample(counts, nowNanos);
        }
    }
}
