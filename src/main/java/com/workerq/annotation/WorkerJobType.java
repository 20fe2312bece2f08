package com.workerq.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the job type a {@link com.workerq.JobHandler} bean executes, and optionally
 * turns it into a system job that every worker seeds on startup.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface WorkerJobType {

    /**
     * The job type name stored in {@code worker_jobs.type}.
     */
    String value();

    /**
     * A 6-field cron expression (seconds first). When set, a recurring system job of this type
     * (owner {@code 0}) is scheduled at worker startup. Property placeholders are resolved.
     */
    String cron() default "";

    /**
     * Retry policy for the seeded system job.
     */
    boolean autoRescheduleOnFailure() default false;

    long autoRescheduleOnFailureDelayMs() default 0;

    /**
     * How long after its due date a seeded occurrence may be cleaned up.
     */
    long removeDelayMs() default 0;
}
