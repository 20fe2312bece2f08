package com.workerq;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * What to schedule. Only {@code type} and {@code ownerId} are required:
 *
 * <pre>{@code
 * scheduler.scheduleJob(JobRequest.of("sendWelcomeEmail", 42)
 *         .data(Map.of("email", "someone@example.com"))
 *         .autoRescheduleOnFailure(Duration.ofMinutes(5)));
 * }</pre>
 */
public final class JobRequest {

    private final String type;
    private final int ownerId;
    private String tag;
    private OffsetDateTime due;
    private Object data;
    private boolean autoRescheduleOnFailure;
    private Duration autoRescheduleOnFailureDelay = Duration.ZERO;
    private Duration removeDelay = Duration.ZERO;
    private boolean persistent;

    private JobRequest(String type, int ownerId) {
        this.type = type;
        this.ownerId = ownerId;
    }

    public static JobRequest of(String type, int ownerId) {
        return new JobRequest(type, ownerId);
    }

    /**
     * Free-form label stored with the job. Defaults to the job type.
     */
    public JobRequest tag(String tag) {
        this.tag = tag;
        return this;
    }

    /**
     * When the job becomes eligible. Defaults to the moment it is scheduled. Ignored by
     * cron scheduling, which derives the due date from the expression.
     */
    public JobRequest due(OffsetDateTime due) {
        this.due = due;
        return this;
    }

    /**
     * Payload handed to the handler. Anything Jackson can turn into a JSON object.
     */
    public JobRequest data(Object data) {
        this.data = data;
        return this;
    }

    public JobRequest autoRescheduleOnFailure(Duration delay) {
        this.autoRescheduleOnFailure = true;
        this.autoRescheduleOnFailureDelay = delay;
        return this;
    }

    public JobRequest autoRescheduleOnFailure(boolean enabled, Duration delay) {
        this.autoRescheduleOnFailure = enabled;
        this.autoRescheduleOnFailureDelay = delay;
        return this;
    }

    /**
     * How long after {@code due} the row becomes eligible for cleanup.
     */
    public JobRequest removeDelay(Duration removeDelay) {
        this.removeDelay = removeDelay;
        return this;
    }

    /**
     * Persistent rows are never removed by cleanup.
     */
    public JobRequest persistent(boolean persistent) {
        this.persistent = persistent;
        return this;
    }

    public String getType() {
        return type;
    }

    public int getOwnerId() {
        return ownerId;
    }

    public String getTag() {
        return tag;
    }

    public OffsetDateTime getDue() {
        return due;
    }

    public Object getData() {
        return data;
    }

    public boolean isAutoRescheduleOnFailure() {
        return autoRescheduleOnFailure;
    }

    public Duration getAutoRescheduleOnFailureDelay() {
        return autoRescheduleOnFailureDelay;
    }

    public Duration getRemoveDelay() {
        return removeDelay;
    }

    public boolean isPersistent() {
        return persistent;
    }
}
