package com.workqueue.engine;

import com.workqueue.core.QueueException;
import com.workqueue.db.CronRepository;
import com.workqueue.db.CronRepository.CronData;
import com.workqueue.db.JobRepository.JobData;
import com.workqueue.service.JobRequest;
import com.workqueue.service.JobService;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic loop turning due cron entries into PENDING jobs.
 *
 * <p>A tick reads every active entry whose next call is at or before now, then:</p>
 * <ol>
 *   <li>creates one job per entry, named {@code "Cron Job: <name>"}, with the entry's
 *       target and owner. A creation failure is logged and does not stop the
 *       other entries.</li>
 *   <li>advances each entry's next call by one interval from its previous value,
 *       even when its job could not be created. The advance is conditional on the
 *       value read, so an edit made during the tick is never overwritten and the
 *       next call never moves twice for one firing.</li>
 * </ol>
 *
 * <p>One tick fires an entry at most once: an entry that is several intervals
 * late catches up one interval per tick.</p>
 */
public class CronTicker {
    private static final Logger logger = Logger.getLogger(CronTicker.class.getName());

    static final String JOB_NAME_PREFIX = "Cron Job: ";

    private final CronRepository cronRepository;
    private final JobService jobService;
    private final Clock clock;
    private final ZoneId zone;
    private final Duration period;
    private final AtomicBoolean running;

    public CronTicker(CronRepository cronRepository, JobService jobService, Clock clock, ZoneId zone,
                      Duration period) {
        this.cronRepository = cronRepository;
        this.jobService = jobService;
        this.clock = clock;
        this.zone = zone;
        this.period = period;
        this.running = new AtomicBoolean(false);
    }

    /**
     * Run the cron loop until {@link #shutdown()}. Blocking; call it from a
     * dedicated thread.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warning("Cron ticker is already running");
            return;
        }
        logger.info("Cron ticker started, period " + period.toMillis() + "ms");

        while (running.get()) {
            try {
                int created = tick();
                if (created > 0) {
                    logger.info("Cron tick created " + created + " job(s)");
                }
                Thread.sleep(period.toMillis());

            } catch (InterruptedException e) {
                logger.info("Cron ticker interrupted, shutting down");
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Unexpected error in cron loop", e);
                try {
                    Thread.sleep(period.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        logger.info("Cron ticker exited");
    }

    public int tick() {
        return tick(LocalDateTime.now(clock));
    }

    /**
     * Fire every entry due at {@code now}.
     *
     * @return number of jobs created
     */
    public int tick(LocalDateTime now) {
        List<CronData> due;
        try {
            due = cronRepository.getDueCrons(now);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to read due crons", e);
            return 0;
        }
        if (due.isEmpty()) {
            return 0;
        }

        int created = 0;
        for (CronData cron : due) {
            try {
                JobData job = jobService.create(
                        JobRequest.of(JOB_NAME_PREFIX + cron.getName(), cron.getTarget(), cron.getOwner()));
                logger.fine("Cron " + cron.getId() + " spawned job " + job.getId());
                created++;
            } catch (QueueException e) {
                logger.log(Level.WARNING, "Cron " + cron.getId() + " (" + cron.getName()
                        + ") could not create its job: " + e.getMessage(), e);
            }
        }

        for (CronData cron : due) {
            LocalDateTime next = cron.getIntervalUnit().advance(cron.getNextCallAt(), cron.getIntervalNumber(), zone);
            try {
                if (!cronRepository.advanceNextCall(cron.getId(), cron.getNextCallAt(), next)) {
                    logger.warning("Cron " + cron.getId() + " changed during the tick, next call left as is");
                }
            } catch (SQLException e) {
                logger.log(Level.SEVERE, "Failed to advance cron " + cron.getId(), e);
            }
        }
        return created;
    }

    public void shutdown() {
        running.set(false);
        logger.info("Cron ticker stopping");
    }

    public boolean isRunning() {
        return running.get();
    }
}
