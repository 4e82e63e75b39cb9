package mail.archiver.app.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import mail.archiver.app.config.ArchiverProperties;
import mail.archiver.app.job.BackgroundJob;
import mail.archiver.app.job.JobCancelledException;
import mail.archiver.app.job.JobHandler;
import mail.archiver.app.job.JobStatus;
import mail.archiver.app.job.JobType;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

/**
 * In-memory job registry plus a FIFO queue drained by a single worker thread.
 * Jobs are visible to status queries from the moment they are enqueued until the
 * daily sweep removes them.
 */
@Slf4j
@Service
public class JobQueueService {
    private final Map<String, BackgroundJob> allJobs = new ConcurrentHashMap<>();
    private final Queue<BackgroundJob> jobQueue = new ConcurrentLinkedQueue<>();
    private final Map<JobType, JobHandler<?>> handlers = new EnumMap<>(JobType.class);
    private final TaskExecutor workerExecutor;
    private final ArchiverProperties.Jobs settings;

    private volatile boolean running;

    public JobQueueService(
            List<JobHandler<?>> jobHandlers,
            @Qualifier("jobWorkerExecutor") TaskExecutor workerExecutor,
            ArchiverProperties properties) {
        for (JobHandler<?> handler : jobHandlers) {
            JobHandler<?> previous = handlers.put(handler.getJobType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for job type " + handler.getJobType());
            }
        }
        this.workerExecutor = workerExecutor;
        this.settings = properties.getJobs();
    }

    public String enqueue(BackgroundJob job) {
        if (!handlers.containsKey(job.getType())) {
            throw new IllegalArgumentException("No handler for job type " + job.getType());
        }
        job.markQueued();
        allJobs.put(job.getJobId(), job);
        jobQueue.add(job);
        log.info("Queued {} job {}: {}", job.getType(), job.getJobId(), job.getDescription());
        return job.getJobId();
    }

    public Optional<BackgroundJob> getJob(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(allJobs.get(jobId));
    }

    public List<BackgroundJob> getActiveJobs() {
        return allJobs.values().stream()
            .filter(j -> j.getStatus().isActive())
            .sorted(Comparator.comparing(BackgroundJob::getCreated))
            .collect(Collectors.toList());
    }

    public List<BackgroundJob> getAllJobs() {
        Comparator<BackgroundJob> activeFirst = Comparator.comparing(j -> !j.getStatus().isActive());
        Comparator<BackgroundJob> mostRecent = Comparator.comparing(JobQueueService::lastActivity).reversed();
        return allJobs.values().stream()
            .sorted(activeFirst.thenComparing(mostRecent))
            .collect(Collectors.toList());
    }

    public boolean cancelJob(String jobId) {
        BackgroundJob job = allJobs.get(jobId);
        if (job == null) {
            return false;
        }
        switch (job.requestCancel()) {
            case CANCELLED_BEFORE_START:
                releaseResources(job);
                log.info("Cancelled queued job {}", jobId);
                return true;
            case CANCELLATION_SIGNALLED:
                log.info("Requested cancellation of running job {}", jobId);
                return true;
            default:
                return false;
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startWorker() {
        if (running) {
            return;
        }
        running = true;
        workerExecutor.execute(this::runWorkerLoop);
        log.info("Background job worker started");
    }

    @PreDestroy
    public void stopWorker() {
        running = false;
        getActiveJobs().stream()
            .filter(j -> j.getStatus() == JobStatus.RUNNING)
            .forEach(j -> j.getCancellationToken().cancel());
        log.info("Background job worker stopping");
    }

    void runWorkerLoop() {
        while (running) {
            try {
                if (!processNext()) {
                    Thread.sleep(settings.getIdlePollMs());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Background job worker interrupted");
                break;
            } catch (Exception e) {
                log.error("Error in background job worker: {}", e.getMessage(), e);
                try {
                    Thread.sleep(settings.getErrorBackoffMs());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.info("Background job worker stopped");
    }

    /**
     * Dequeues and runs one job on the calling thread.
     * @return false if the queue was empty
     */
    public boolean processNext() {
        BackgroundJob job = jobQueue.poll();
        if (job == null) {
            return false;
        }
        if (!job.markRunning()) {
            log.info("Skipping {} job {} ({})", job.getType(), job.getJobId(), job.getStatus());
            return true;
        }
        execute(job);
        return true;
    }

    private void execute(BackgroundJob job) {
        log.info("Starting {} job {}: {}", job.getType(), job.getJobId(), job.getDescription());
        try {
            dispatch(handlers.get(job.getType()), job);
            if (job.getCancellationToken().isCancellationRequested()) {
                job.markCancelled();
                log.info("{} job {} was cancelled after {} items", job.getType(), job.getJobId(), job.getProcessed());
            } else {
                job.markCompleted();
                log.info("Completed {} job {}. Success: {}, Failed: {}, Skipped: {}",
                    job.getType(), job.getJobId(), job.getSucceeded(), job.getFailed(), job.getSkipped());
            }
        } catch (JobCancelledException e) {
            job.markCancelled();
            log.info("{} job {} was cancelled after {} items", job.getType(), job.getJobId(), job.getProcessed());
        } catch (Exception e) {
            job.markFailed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            log.error("{} job {} failed: {}", job.getType(), job.getJobId(), e.getMessage(), e);
        }
    }

    private static <J extends BackgroundJob> void dispatch(JobHandler<J> handler, BackgroundJob job) throws Exception {
        handler.execute(handler.getJobClass().cast(job), job.getCancellationToken());
    }

    /**
     * Removes jobs that finished more than the retention period ago, together with
     * their temporary files.
     */
    @Scheduled(fixedRate = 24 * 60 * 60 * 1000L, initialDelay = 24 * 60 * 60 * 1000L)
    public void cleanupOldJobs() {
        Instant cutoff = Instant.now().minus(settings.getCompletedJobRetentionDays(), ChronoUnit.DAYS);
        cleanupJobsCompletedBefore(cutoff);
    }

    int cleanupJobsCompletedBefore(Instant cutoff) {
        List<BackgroundJob> toRemove = allJobs.values().stream()
            .filter(j -> j.getStatus().isTerminal() && j.getCompleted() != null && j.getCompleted().isBefore(cutoff))
            .collect(Collectors.toList());

        for (BackgroundJob job : toRemove) {
            allJobs.remove(job.getJobId());
            releaseResources(job);
        }
        if (!toRemove.isEmpty()) {
            log.info("Cleaned up {} old jobs", toRemove.size());
        }
        return toRemove.size();
    }

    private void releaseResources(BackgroundJob job) {
        try {
            job.releaseResources();
        } catch (Exception e) {
            log.warn("Failed to release resources of job {}: {}", job.getJobId(), e.getMessage());
        }
    }

    private static Instant lastActivity(BackgroundJob job) {
        return job.getStarted() != null ? job.getStarted() : job.getCreated();
    }
}
