package com.workqueue.engine;

import com.workqueue.core.JobOutcome;
import com.workqueue.db.JobRepository;
import com.workqueue.db.JobRepository.JobData;

import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes a single claimed job in the worker pool.
 *
 * <p>The dispatcher has already moved the job to RUNNING before submitting the
 * Worker, so each job is run by exactly one Worker. The Worker:</p>
 * <ul>
 *   <li>Loads the job row</li>
 *   <li>Runs the target operation through {@link JobRunner}</li>
 *   <li>On success: records DONE with the result text</li>
 *   <li>On any failure: records FAILED with the error detail</li>
 * </ul>
 *
 * <p>The completion write is its own statement, separate from the run, so a
 * failing operation cannot roll back the record of its own failure. Nothing
 * thrown by a job leaves {@link #run()}; other jobs and the dispatcher loop are
 * never affected. There is no automatic retry.</p>
 *
 * @see Dispatcher
 */
public class Worker implements Runnable {
    private static final Logger logger = Logger.getLogger(Worker.class.getName());

    private final long jobId;
    private final JobRepository repository;
    private final JobRunner runner;
    private final Clock clock;

    /**
     * @param jobId      id of a job the caller has claimed (RUNNING)
     * @param repository job repository for the completion write
     * @param runner     runs the job's operation
     * @param clock      source of the completion timestamp
     */
    public Worker(long jobId, JobRepository repository, JobRunner runner, Clock clock) {
        this.jobId = jobId;
        this.repository = repository;
        this.runner = runner;
        this.clock = clock;
    }

    @Override
    public void run() {
        JobOutcome outcome;
        try {
            outcome = execute();
        } catch (Error e) {
            record(JobOutcome.failed(describe(e)));
            throw e;
        }
        record(outcome);
    }

    /**
     * Run the job and turn the result or the failure into an outcome.
     */
    JobOutcome execute() {
        try {
            JobData job = repository.getJobById(jobId);
            if (job == null) {
                return JobOutcome.failed("Job " + jobId + " not found");
            }
            logger.info("Worker starting job " + jobId + " (" + job.getName() + ")");
            return JobOutcome.done(runner.run(job));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Job " + jobId + " was interrupted");
            return JobOutcome.failed(describe(e));

        } catch (Exception e) {
            logger.log(Level.WARNING, "Job " + jobId + " failed", e);
            return JobOutcome.failed(describe(e));
        }
    }

    private void record(JobOutcome outcome) {
        LocalDateTime now = LocalDateTime.now(clock);
        String message = outcome.isSuccess() ? outcome.getResult() : outcome.getErrorInfo();
        try {
            if (repository.markFinished(jobId, outcome.getState(), now, message)) {
                logger.info("Job " + jobId + " finished: " + outcome.getState());
            } else {
                logger.warning("Job " + jobId + " was no longer RUNNING; outcome " + outcome + " dropped");
            }
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to record outcome of job " + jobId + ": " + outcome, e);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
