package dev.pagegraph.domain.entity;

import dev.pagegraph.domain.enums.PipelineStage;
import dev.pagegraph.domain.enums.VisitStatus;
import jakarta.persistence.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.UUID;

/**
 * Aggregate root for one revision of one page's processing lifecycle.
 *
 * Design: one row per (fingerprint, revision). activeFingerprint mirrors fingerprint
 * while the revision is non-terminal and is cleared once terminal; its unique index is
 * the storage-level guard that a Fingerprint never has two Visits in flight.
 * Optimistic locking (@Version) turns every transition into a compare-and-set.
 */
@Entity
@Table(name = "visits", indexes = {
        @Index(name = "idx_visit_fingerprint", columnList = "fingerprint, revision"),
        @Index(name = "idx_visit_status", columnList = "status"),
        @Index(name = "idx_visit_host", columnList = "host")
})
public class Visit {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(nullable = false, length = 64)
    private String fingerprint;

    @Column(name = "active_fingerprint", unique = true, length = 64)
    private String activeFingerprint;

    @Column(name = "normalized_url", nullable = false, length = 2048)
    private String normalizedUrl;

    @Column(nullable = false)
    private String host;

    @Column(nullable = false)
    private int revision;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private VisitStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "failed_stage", length = 20)
    private PipelineStage failedStage;

    @Column(name = "failure_reason", length = 2000)
    private String failureReason;

    @Column(nullable = false)
    private boolean cancelled;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested;

    @Column(name = "retry_at")
    private Instant retryAt;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "stage_attempts", nullable = false)
    private int stageAttempts;

    @Column(name = "lease_owner", length = 128)
    private String leaseOwner;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @Column(nullable = false)
    private boolean superseded;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected Visit() {
    }

    public static Visit create(String fingerprint, String normalizedUrl, String host, int revision, Instant now) {
        if (revision < 1) throw new IllegalArgumentException("revision starts at 1");
        Visit v = new Visit();
        v.id = UUID.randomUUID();
        v.fingerprint = fingerprint;
        v.activeFingerprint = fingerprint;
        v.normalizedUrl = normalizedUrl;
        v.host = host;
        v.revision = revision;
        v.status = VisitStatus.PENDING;
        v.createdAt = now;
        v.updatedAt = now;
        return v;
    }

    /** Done, or Failed with no retry scheduled. */
    public boolean isTerminal() {
        return status == VisitStatus.DONE || (status == VisitStatus.FAILED && retryAt == null);
    }

    public boolean isLeasedBy(String owner, Instant now) {
        return leaseOwner != null && leaseOwner.equals(owner) && leaseExpiresAt != null && leaseExpiresAt.isAfter(now);
    }

    public boolean isLeaseFree(Instant now) {
        return leaseOwner == null || leaseExpiresAt == null || !leaseExpiresAt.isAfter(now);
    }

    /** A runnable visit is non-terminal, unleased, and not waiting out a backoff. */
    public boolean isRunnable(Instant now) {
        if (isTerminal() || !isLeaseFree(now)) return false;
        return status != VisitStatus.FAILED || !retryAt.isAfter(now);
    }

    public boolean claim(String owner, Instant now, Duration leaseDuration) {
        if (isTerminal()) return false;
        if (!isLeaseFree(now) && !owner.equals(leaseOwner)) return false;
        this.leaseOwner = owner;
        this.leaseExpiresAt = now.plus(leaseDuration);
        touch(now);
        return true;
    }

    public void releaseLease(String owner, Instant now) {
        if (owner.equals(leaseOwner)) {
            this.leaseOwner = null;
            this.leaseExpiresAt = null;
            touch(now);
        }
    }

    /**
     * Starts one job execution. PENDING enters the first stage; a Failed visit with a
     * scheduled retry resumes at the stage that failed; a visit caught mid-stage by a
     * restart stays where it was.
     */
    public void beginAttempt(Instant now) {
        if (isTerminal()) {
            throw new IllegalStateException("Visit %s is terminal (%s)".formatted(id, status));
        }
        attemptCount++;
        if (status == VisitStatus.PENDING) {
            status = PipelineStage.FETCH.status();
        } else if (status == VisitStatus.FAILED) {
            status = failedStage.status();
            retryAt = null;
        }
        touch(now);
    }

    /** Records success of the running stage and moves forward exactly one step. */
    public void advance(PipelineStage completed, Instant now) {
        requireStatus(completed.status());
        status = completed.successor();
        stageAttempts = 0;
        failedStage = null;
        failureReason = null;
        if (status == VisitStatus.DONE) {
            completedAt = now;
            activeFingerprint = null;
        }
        touch(now);
    }

    /** Marks the running stage failed; returns how many times in a row it has now failed. */
    public int recordStageFailure(PipelineStage stage, String reason, Instant now) {
        requireStatus(stage.status());
        status = VisitStatus.FAILED;
        failedStage = stage;
        failureReason = truncate(reason);
        stageAttempts++;
        touch(now);
        return stageAttempts;
    }

    public void scheduleRetry(Instant at, Instant now) {
        requireStatus(VisitStatus.FAILED);
        retryAt = at;
        touch(now);
    }

    /** Terminal failure: retries exhausted. */
    public void exhaust(Instant now) {
        requireStatus(VisitStatus.FAILED);
        retryAt = null;
        activeFingerprint = null;
        touch(now);
    }

    public void requestCancel(Instant now) {
        cancelRequested = true;
        touch(now);
    }

    /** Terminal Failed(Cancelled). The stage it stopped at is kept for inspection. */
    public void cancel(Instant now) {
        if (isTerminal()) {
            throw new IllegalStateException("Visit %s is already terminal".formatted(id));
        }
        if (status.isStageInProgress()) {
            failedStage = PipelineStage.forStatus(status);
        }
        status = VisitStatus.FAILED;
        cancelled = true;
        failureReason = "cancelled";
        retryAt = null;
        activeFingerprint = null;
        touch(now);
    }

    public void markSuperseded(Instant now) {
        superseded = true;
        touch(now);
    }

    private void requireStatus(VisitStatus... allowed) {
        for (VisitStatus s : allowed) {
            if (this.status == s) return;
        }
        throw new IllegalStateException(
                "Expected one of %s but was %s".formatted(Arrays.toString(allowed), status));
    }

    private static String truncate(String reason) {
        if (reason == null) return null;
        return reason.length() <= 2000 ? reason : reason.substring(0, 2000);
    }

    private void touch(Instant now) {
        this.updatedAt = now;
    }

    // Getters
    public UUID getId() {
        return id;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getActiveFingerprint() {
        return activeFingerprint;
    }

    public String getNormalizedUrl() {
        return normalizedUrl;
    }

    public String getHost() {
        return host;
    }

    public int getRevision() {
        return revision;
    }

    public VisitStatus getStatus() {
        return status;
    }

    public PipelineStage getFailedStage() {
        return failedStage;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public Instant getRetryAt() {
        return retryAt;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public int getStageAttempts() {
        return stageAttempts;
    }

    public String getLeaseOwner() {
        return leaseOwner;
    }

    public Instant getLeaseExpiresAt() {
        return leaseExpiresAt;
    }

    public boolean isSuperseded() {
        return superseded;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
