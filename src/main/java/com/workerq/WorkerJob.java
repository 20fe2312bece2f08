package com.workerq;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * One scheduled or completed job occurrence. Cron chains and failure retries are
 * sequences of rows linked through {@link #getRescheduledFromJob()}.
 */
@Entity
@Table(name = "worker_jobs")
public class WorkerJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String tag;

    @Column(nullable = false)
    private String type;

    @Column(name = "user_id", nullable = false)
    private int ownerId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private JsonNode data;

    @Column(nullable = false)
    private OffsetDateTime due;

    private OffsetDateTime started;

    private OffsetDateTime finished;

    @Column(name = "remove_at", nullable = false)
    private OffsetDateTime removeAt;

    private Boolean success;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode result;

    @Column(name = "cron_schedule")
    private String cronSchedule;

    @Column(name = "auto_reschedule_on_failure", nullable = false)
    private boolean autoRescheduleOnFailure;

    @Column(name = "auto_reschedule_on_failure_delay", nullable = false)
    private int autoRescheduleOnFailureDelay;

    @Column(name = "remove_delay", nullable = false)
    private int removeDelay;

    @Column(name = "rescheduled_from_job")
    private Long rescheduledFromJob;

    @Column(nullable = false)
    private boolean persistent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public WorkerJob() {
    }

    @PrePersist
    void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }

    /**
     * Whether the row matches the pending predicate at {@code now}: not finished,
     * and either never claimed or claimed longer ago than {@code staleClaimThreshold}.
     */
    @Transient
    public boolean isPendingAt(OffsetDateTime now, Duration staleClaimThreshold) {
        if (finished != null) {
            return false;
        }
        return started == null || !started.isAfter(now.minus(staleClaimThreshold));
    }

    @Transient
    public boolean isCron() {
        return cronSchedule != null && !cronSchedule.isBlank();
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getTag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = tag;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public int getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(int ownerId) {
        this.ownerId = ownerId;
    }

    public JsonNode getData() {
        return data;
    }

    public void setData(JsonNode data) {
        this.data = data;
    }

    public OffsetDateTime getDue() {
        return due;
    }

    public void setDue(OffsetDateTime due) {
        this.due = due;
    }

    public OffsetDateTime getStarted() {
        return started;
    }

    public void setStarted(OffsetDateTime started) {
        this.started = started;
    }

    public OffsetDateTime getFinished() {
        return finished;
    }

    public void setFinished(OffsetDateTime finished) {
        this.finished = finished;
    }

    public OffsetDateTime getRemoveAt() {
        return removeAt;
    }

    public void setRemoveAt(OffsetDateTime removeAt) {
        this.removeAt = removeAt;
    }

    public Boolean getSuccess() {
        return success;
    }

    public void setSuccess(Boolean success) {
        this.success = success;
    }

    public JsonNode getResult() {
        return result;
    }

    public void setResult(JsonNode result) {
        this.result = result;
    }

    public String getCronSchedule() {
        return cronSchedule;
    }

    public void setCronSchedule(String cronSchedule) {
        this.cronSchedule = cronSchedule;
    }

    public boolean isAutoRescheduleOnFailure() {
        return autoRescheduleOnFailure;
    }

    public void setAutoRescheduleOnFailure(boolean autoRescheduleOnFailure) {
        this.autoRescheduleOnFailure = autoRescheduleOnFailure;
    }

    public int getAutoRescheduleOnFailureDelay() {
        return autoRescheduleOnFailureDelay;
    }

    public void setAutoRescheduleOnFailureDelay(int autoRescheduleOnFailureDelay) {
        this.autoRescheduleOnFailureDelay = autoRescheduleOnFailureDelay;
    }

    public int getRemoveDelay() {
        return removeDelay;
    }

    public void setRemoveDelay(int removeDelay) {
        this.removeDelay = removeDelay;
    }

    public Long getRescheduledFromJob() {
        return rescheduledFromJob;
    }

    public void setRescheduledFromJob(Long rescheduledFromJob) {
        this.rescheduledFromJob = rescheduledFromJob;
    }

    public boolean isPersistent() {
        return persistent;
    }

    public void setPersistent(boolean persistent) {
        this.persistent = persistent;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "WorkerJob{id=" + id + ", type='" + type + "', ownerId=" + ownerId + ", due=" + due
                + (cronSchedule != null ? ", cron='" + cronSchedule + "'" : "") + "}";
    }
}
