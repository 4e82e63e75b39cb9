package mail.archiver.app.job;

import lombok.Getter;
import lombok.Setter;

import java.io.IOException;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared shape of every queued job. Counters and progress are written by the single
 * worker and read concurrently by status pollers; status transitions are synchronized
 * so that a cancel request and the worker picking the job up cannot interleave.
 */
public abstract class BackgroundJob {

    public enum CancelOutcome {
        CANCELLED_BEFORE_START,
        CANCELLATION_SIGNALLED,
        NOT_CANCELLABLE
    }

    @Getter
    private final String jobId = UUID.randomUUID().toString();
    @Getter
    private final JobType type;
    @Getter
    private final Instant created = Instant.now();
    @Getter
    private final CancellationToken cancellationToken = new CancellationToken();

    @Getter
    private volatile JobStatus status = JobStatus.QUEUED;
    @Getter
    private volatile Instant started;
    @Getter
    private volatile Instant completed;
    @Getter
    @Setter
    private volatile String currentItem;
    @Getter
    private volatile String errorMessage;
    @Getter
    @Setter
    private String requestedBy;

    private final AtomicInteger total = new AtomicInteger();
    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger succeeded = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();

    protected BackgroundJob(JobType type) {
        this.type = type;
    }

    public int getTotal() {
        return total.get();
    }

    public void setTotal(int value) {
        total.set(value);
    }

    public int getProcessed() {
        return processed.get();
    }

    public int getSucceeded() {
        return succeeded.get();
    }

    public int getFailed() {
        return failed.get();
    }

    public int getSkipped() {
        return skipped.get();
    }

    public void recordSuccess() {
        succeeded.incrementAndGet();
        processed.incrementAndGet();
    }

    public void recordFailure() {
        failed.incrementAndGet();
        processed.incrementAndGet();
    }

    public void recordSkipped() {
        skipped.incrementAndGet();
        processed.incrementAndGet();
    }

    public int getProgressPercent() {
        int t = total.get();
        if (t <= 0) {
            return status == JobStatus.COMPLETED ? 100 : 0;
        }
        return (int) Math.min(100, (processed.get() * 100.0) / t);
    }

    public synchronized void markQueued() {
        status = JobStatus.QUEUED;
    }

    /**
     * @return false if the job left QUEUED in the meantime (e.g. it was cancelled)
     */
    public synchronized boolean markRunning() {
        if (status != JobStatus.QUEUED) {
            return false;
        }
        status = JobStatus.RUNNING;
        started = Instant.now();
        return true;
    }

    public synchronized void markCompleted() {
        finish(JobStatus.COMPLETED);
    }

    public synchronized void markCancelled() {
        finish(JobStatus.CANCELLED);
    }

    public synchronized void markFailed(String message) {
        if (finish(JobStatus.FAILED)) {
            errorMessage = message;
        }
    }

    public synchronized CancelOutcome requestCancel() {
        if (status == JobStatus.QUEUED) {
            finish(JobStatus.CANCELLED);
            return CancelOutcome.CANCELLED_BEFORE_START;
        }
        if (status == JobStatus.RUNNING) {
            cancellationToken.cancel();
            return CancelOutcome.CANCELLATION_SIGNALLED;
        }
        return CancelOutcome.NOT_CANCELLABLE;
    }

    private boolean finish(JobStatus terminal) {
        if (status.isTerminal()) {
            return false;
        }
        status = terminal;
        completed = Instant.now();
        currentItem = null;
        return true;
    }

    /**
     * Releases temporary artifacts owned by this job. Called when a queued job is
     * cancelled and when the job is swept from the registry.
     */
    public void releaseResources() throws IOException {
    }

    /**
     * Short label of what the job works on, for logs and status views.
     */
    public abstract String getDescription();
}
