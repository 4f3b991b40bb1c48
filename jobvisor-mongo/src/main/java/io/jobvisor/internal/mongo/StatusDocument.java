package io.jobvisor.internal.mongo;

import io.jobvisor.core.FailureReason;
import io.jobvisor.core.JobKind;
import io.jobvisor.core.JobState;
import io.jobvisor.core.JobStatus;
import io.jobvisor.core.Trigger;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for a job's latest status. The job name is the document id.
 */
@Document(collection = StatusDocument.COLLECTION)
public class StatusDocument {

    public static final String COLLECTION = "job_statuses";

    @Id
    private String name;

    private JobKind kind;
    private JobState state;
    private Long pid;
    private Instant lastStartTime;
    private Instant lastEndTime;
    private Integer lastExitCode;
    private int consecutiveFailures;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextDueTime;

    private Instant lastCheckTime;
    private boolean restartDisabled;
    private Trigger lastTrigger;
    private FailureReason failureReason;
    private String lastError;
    private Instant updatedAt;

    public StatusDocument() {
    }

    public static StatusDocument from(JobStatus status) {
        StatusDocument doc = new StatusDocument();
        doc.name = status.name();
        doc.kind = status.kind();
        doc.state = status.state();
        doc.pid = status.pid();
        doc.lastStartTime = status.lastStartTime();
        doc.lastEndTime = status.lastEndTime();
        doc.lastExitCode = status.lastExitCode();
        doc.consecutiveFailures = status.consecutiveFailures();
        doc.nextDueTime = status.nextDueTime();
        doc.lastCheckTime = status.lastCheckTime();
        doc.restartDisabled = status.restartDisabled();
        doc.lastTrigger = status.lastTrigger();
        doc.failureReason = status.failureReason();
        doc.lastError = status.lastError();
        doc.updatedAt = status.updatedAt();
        return doc;
    }

    public JobStatus toStatus() {
        return new JobStatus(name, kind, state, pid, lastStartTime, lastEndTime, lastExitCode,
                consecutiveFailures, nextDueTime, lastCheckTime, restartDisabled, lastTrigger,
                failureReason, lastError, updatedAt);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public JobKind getKind() {
        return kind;
    }

    public void setKind(JobKind kind) {
        this.kind = kind;
    }

    public JobState getState() {
        return state;
    }

    public void setState(JobState state) {
        this.state = state;
    }

    public Long getPid() {
        return pid;
    }

    public void setPid(Long pid) {
        this.pid = pid;
    }

    public Instant getLastStartTime() {
        return lastStartTime;
    }

    public void setLastStartTime(Instant lastStartTime) {
        this.lastStartTime = lastStartTime;
    }

    public Instant getLastEndTime() {
        return lastEndTime;
    }

    public void setLastEndTime(Instant lastEndTime) {
        this.lastEndTime = lastEndTime;
    }

    public Integer getLastExitCode() {
        return lastExitCode;
    }

    public void setLastExitCode(Integer lastExitCode) {
        this.lastExitCode = lastExitCode;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public void setConsecutiveFailures(int consecutiveFailures) {
        this.consecutiveFailures = consecutiveFailures;
    }

    public Instant getNextDueTime() {
        return nextDueTime;
    }

    public void setNextDueTime(Instant nextDueTime) {
        this.nextDueTime = nextDueTime;
    }

    public Instant getLastCheckTime() {
        return lastCheckTime;
    }

    public void setLastCheckTime(Instant lastCheckTime) {
        this.lastCheckTime = lastCheckTime;
    }

    public boolean isRestartDisabled() {
        return restartDisabled;
    }

    public void setRestartDisabled(boolean restartDisabled) {
        this.restartDisabled = restartDisabled;
    }

    public Trigger getLastTrigger() {
        return lastTrigger;
    }

    public void setLastTrigger(Trigger lastTrigger) {
        this.lastTrigger = lastTrigger;
    }

    public FailureReason getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(FailureReason failureReason) {
        this.failureReason = failureReason;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
