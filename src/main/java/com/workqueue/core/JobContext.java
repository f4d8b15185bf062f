package com.workqueue.core;

import com.workqueue.db.JobRepository;

import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Execution environment handed to an operation handler while its job runs.
 *
 * <p>This class is the bridge between an operation's business logic and the queue.
 * It provides:</p>
 * <ul>
 *   <li>The id of the job being run</li>
 *   <li>The owner identity the operation executes as</li>
 *   <li>Persistent per-job logging to the {@code job_logs} table</li>
 * </ul>
 *
 * <p>A handler must not change the job record through this context; state changes
 * belong to the worker that wraps the call.</p>
 *
 * <p><b>Usage Pattern:</b></p>
 * <pre>{@code
 * registry.domain("Partner").operation("Archive", (context, subjects, args) -> {
 *     context.log("INFO", "Archiving " + subjects.size() + " partners as " + context.getOwner());
 *     return null;
 * });
 * }</pre>
 *
 * @see com.workqueue.registry.OperationHandler
 */
public class JobContext {
    private static final Logger logger = Logger.getLogger(JobContext.class.getName());

    private final long jobId;
    private final String owner;
    private final JobRepository repository;
    private final Clock clock;

    /**
     * Create a new job context for execution.
     *
     * @param jobId      the id of the job being executed
     * @param owner      identity the operation runs as
     * @param repository the job repository used for log entries
     * @param clock      source of log entry timestamps
     */
    public JobContext(long jobId, String owner, JobRepository repository, Clock clock) {
        this.jobId = jobId;
        this.owner = owner;
        this.repository = repository;
        this.clock = clock;
    }

    public long getJobId() {
        return jobId;
    }

    /**
     * Get the identity this job executes as: whoever enqueued it, or the
     * configured owner of the cron entry that spawned it.
     *
     * @return the owner identity
     */
    public String getOwner() {
        return owner;
    }

    /**
     * Log a message to the job_logs table.
     *
     * <p>Each entry is written in its own statement. If writing fails the error
     * goes to the class logger and the job carries on; logging failures never
     * fail a job.</p>
     *
     * @param level   the log level (INFO, WARN, ERROR, DEBUG)
     * @param message the log message
     */
    public void log(String level, String message) {
        try {
            repository.insertLog(jobId, LocalDateTime.now(clock), level, message);
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Failed to write job log for job " + jobId, e);
        }
    }

    @Override
    public String toString() {
        return "JobContext{jobId=" + jobId + ", owner='" + owner + "'}";
    }
}
