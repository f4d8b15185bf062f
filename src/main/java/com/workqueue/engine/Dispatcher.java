package com.workqueue.engine;

import com.workqueue.core.JobState;
import com.workqueue.db.ChannelRepository;
import com.workqueue.db.ChannelRepository.ChannelData;
import com.workqueue.db.JobRepository;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Admission control and execution loop over channels and jobs.
 *
 * <p>Each tick runs two phases:</p>
 * <ol>
 *   <li><b>Admission</b>, per channel: free slots = capacity − (ENQUEUED + RUNNING
 *       jobs); that many ready PENDING jobs are moved to ENQUEUED, lowest priority
 *       value first, then oldest, then lowest id. A job waiting on a prerequisite is
 *       ready only once the prerequisite is DONE.</li>
 *   <li><b>Execution</b>: every ENQUEUED job, in any channel, is claimed
 *       (ENQUEUED → RUNNING, committed on its own) and handed to the worker pool.
 *       The {@link Worker} records DONE or FAILED when the operation returns.</li>
 * </ol>
 *
 * <p><b>Thread Safety:</b></p>
 * <ul>
 *   <li>The loop runs on one thread; successive ticks never overlap each other</li>
 *   <li>Jobs run on a fixed worker pool, in parallel with later ticks</li>
 *   <li>Admission locks the channel row, so overlapping admission passes can
 *       neither admit a job twice nor exceed a channel's capacity</li>
 *   <li>The claim is a conditional update, so each job is launched once</li>
 * </ul>
 *
 * <p><b>Idle Backoff:</b> when no PENDING job is admissible after a tick, the loop
 * sleeps the hold delay on top of the polling period.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * Dispatcher dispatcher = new Dispatcher(8, jobRepository, channelRepository, runner,
 *         Clock.systemDefaultZone(), Duration.ofMillis(10), Duration.ofMillis(500), Duration.ofSeconds(60));
 * Thread thread = new Thread(dispatcher::start, "Dispatcher-Thread");
 * thread.start();
 * // ...
 * dispatcher.shutdown(); // drains running jobs
 * }</pre>
 *
 * @see Worker
 * @see JobRepository#admitCandidates(long, LocalDateTime)
 */
public class Dispatcher {
    private static final Logger logger = Logger.getLogger(Dispatcher.class.getName());

    private final JobRepository jobRepository;
    private final ChannelRepository channelRepository;
    private final JobRunner runner;
    private final ExecutorService executorService;  // Worker pool
    private final Clock clock;
    private final Duration period;
    private final Duration holdDelay;
    private final Duration shutdownTimeout;
    private final AtomicBoolean running;
    private final int workerCount;

    /**
     * Create a Dispatcher with its own fixed worker pool.
     *
     * @param workerCount     number of worker threads
     * @param jobRepository   job store
     * @param channelRepository channel store
     * @param runner          runs job operations
     * @param clock           source of timestamps
     * @param period          pause between ticks
     * @param holdDelay       extra pause when nothing is admissible
     * @param shutdownTimeout how long {@link #shutdown()} waits for running jobs
     */
    public Dispatcher(int workerCount, JobRepository jobRepository, ChannelRepository channelRepository,
                      JobRunner runner, Clock clock, Duration period, Duration holdDelay, Duration shutdownTimeout) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, got " + workerCount);
        }
        this.workerCount = workerCount;
        this.jobRepository = jobRepository;
        this.channelRepository = channelRepository;
        this.runner = runner;
        this.executorService = Executors.newFixedThreadPool(workerCount);
        this.clock = clock;
        this.period = period;
        this.holdDelay = holdDelay;
        this.shutdownTimeout = shutdownTimeout;
        this.running = new AtomicBoolean(false);

        logger.info("Dispatcher initialized with " + workerCount + " workers");
    }

    /**
     * Start the dispatch loop.
     *
     * <p><b>BLOCKING METHOD:</b> runs until {@link #shutdown()} is called. Call it
     * from a dedicated thread.</p>
     *
     * <p><b>Error Handling:</b> store failures inside a tick are logged per channel
     * or per job and the loop carries on; an interrupt ends the loop.</p>
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warning("Dispatcher is already running");
            return;
        }

        logger.info("Dispatcher started with " + workerCount + " workers");

        while (running.get()) {
            try {
                TickSummary summary = tick();
                if (summary.getAdmitted() > 0 || summary.getLaunched() > 0) {
                    logger.fine("Dispatcher tick: " + summary);
                }

                long pause = period.toMillis();
                if (!summary.hasMoreCandidates()) {
                    // Nothing admissible behind us, calm the loop down
                    pause += holdDelay.toMillis();
                }
                Thread.sleep(pause);

            } catch (InterruptedException e) {
                logger.info("Dispatcher interrupted, shutting down");
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Unexpected error in dispatch loop", e);
                try {
                    Thread.sleep(holdDelay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        logger.info("Dispatcher loop exited");
    }

    /**
     * Run one tick at the clock's current time.
     */
    public TickSummary tick() {
        return tick(LocalDateTime.now(clock));
    }

    /**
     * Run one tick: admission over every channel, then launch of every ENQUEUED job.
     *
     * @param now timestamp used for admission
     * @return what the tick did
     */
    public TickSummary tick(LocalDateTime now) {
        int admitted = admit(now);
        int launched = launchEnqueued();
        return new TickSummary(admitted, launched, hasMoreCandidates());
    }

    private int admit(LocalDateTime now) {
        List<ChannelData> channels;
        try {
            channels = channelRepository.findAll();
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to list channels for admission", e);
            return 0;
        }

        int total = 0;
        for (ChannelData channel : channels) {
            try {
                List<Long> admitted = jobRepository.admitCandidates(channel.getId(), now);
                if (!admitted.isEmpty()) {
                    logger.info("Admitted " + admitted.size() + " job(s) into channel '" + channel.getName()
                            + "': " + admitted);
                    total += admitted.size();
                }
            } catch (SQLException e) {
                logger.log(Level.SEVERE, "Admission failed for channel '" + channel.getName() + "'", e);
            }
        }
        return total;
    }

    private int launchEnqueued() {
        List<Long> enqueued;
        try {
            enqueued = jobRepository.getEnqueuedJobIds();
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to list enqueued jobs", e);
            return 0;
        }

        int launched = 0;
        for (Long jobId : enqueued) {
            if (executorService.isShutdown()) {
                // Left ENQUEUED; picked up by the next dispatcher on this store
                break;
            }
            try {
                // ATOMIC CLAIM: ENQUEUED → RUNNING, committed before the job starts
                if (!jobRepository.markRunning(jobId, LocalDateTime.now(clock))) {
                    logger.fine("Job " + jobId + " already claimed");
                    continue;
                }
                launch(jobId);
                launched++;
            } catch (SQLException e) {
                logger.log(Level.SEVERE, "Failed to claim job " + jobId, e);
            }
        }
        return launched;
    }

    private void launch(long jobId) throws SQLException {
        try {
            executorService.submit(new Worker(jobId, jobRepository, runner, clock));
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "Worker pool rejected job " + jobId, e);
            jobRepository.markFinished(jobId, JobState.FAILED, LocalDateTime.now(clock),
                    "Dispatcher shut down before the job could start");
        }
    }

    private boolean hasMoreCandidates() {
        try {
            return jobRepository.hasAdmissibleCandidate();
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to check for admissible jobs", e);
            return false;
        }
    }

    /**
     * Stop the loop and drain the worker pool.
     *
     * <p>Running jobs get up to the configured shutdown timeout to finish; after that
     * the pool is interrupted. A job interrupted this way is recorded as FAILED if it
     * lets the interrupt surface, and stays RUNNING if the process dies first.</p>
     */
    public void shutdown() {
        running.set(false);
        logger.info("Initiating graceful shutdown...");

        executorService.shutdown();

        try {
            if (!executorService.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warning("Forcing shutdown of remaining jobs");
                executorService.shutdownNow();

                if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.severe("Worker pool did not terminate after forced shutdown");
                }
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("Dispatcher shutdown complete");
    }

    /**
     * Get the current status of the dispatcher.
     *
     * @return map with running flag, worker count and per-state job counts
     */
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("running", running.get());
        status.put("workerCount", workerCount);
        status.put("executorShutdown", executorService.isShutdown());
        status.put("executorTerminated", executorService.isTerminated());
        try {
            for (JobState state : JobState.values()) {
                status.put(state.name().toLowerCase(Locale.ROOT) + "Jobs", jobRepository.getJobsByState(state).size());
            }
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Failed to read job counts", e);
            status.put("countsError", e.getMessage());
        }
        return status;
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getWorkerCount() {
        return workerCount;
    }
}
