package com.workqueue.app;

import com.workqueue.core.IntervalUnit;
import com.workqueue.core.QueueException;
import com.workqueue.core.TargetRef;
import com.workqueue.db.ChannelRepository;
import com.workqueue.db.CronRepository;
import com.workqueue.db.Database;
import com.workqueue.db.JobRepository;
import com.workqueue.db.JobRepository.JobData;
import com.workqueue.engine.CronTicker;
import com.workqueue.engine.Dispatcher;
import com.workqueue.engine.JobRunner;
import com.workqueue.registry.ArgumentDecoder;
import com.workqueue.registry.OperationRegistry;
import com.workqueue.registry.TargetValidator;
import com.workqueue.service.ChannelService;
import com.workqueue.service.CronDefinition;
import com.workqueue.service.CronService;
import com.workqueue.service.JobService;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Host process: wires the store, the operation registry and the services, then
 * runs the dispatcher and the cron ticker on their own threads until the JVM is
 * asked to stop.
 *
 * <p>Pass {@code --demo} to seed a few sample jobs and a cron entry.</p>
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    private static Database database;
    private static Dispatcher dispatcher;
    private static CronTicker cronTicker;
    private static Thread dispatcherThread;
    private static Thread cronThread;

    public static void main(String[] args) {
        configureLogging();
        logger.info("=== Work Queue Starting ===");

        try {
            QueueConfig config = QueueConfig.load();
            logger.info("Configuration: " + config);
            Clock clock = Clock.system(config.getZone());

            // 1. Store
            initializeDatabase(config);
            JobRepository jobRepository = new JobRepository(database);
            ChannelRepository channelRepository = new ChannelRepository(database);
            CronRepository cronRepository = new CronRepository(database);

            // 2. Operations
            OperationRegistry registry = new OperationRegistry();
            DemoOperations.register(registry);
            TargetValidator validator = new TargetValidator(registry);

            // 3. Services
            ChannelService channelService = new ChannelService(channelRepository, config.getDefaultChannelCapacity());
            channelService.defaultChannel();
            JobService jobService = new JobService(jobRepository, channelService, validator, clock);
            CronService cronService = new CronService(cronRepository, validator, clock);

            // 4. Loops
            dispatcher = new Dispatcher(config.getWorkers(), jobRepository, channelRepository,
                    new JobRunner(registry, jobRepository, clock), clock,
                    config.getDispatchPeriod(), config.getHoldDelay(), config.getShutdownTimeout());
            cronTicker = new CronTicker(cronRepository, jobService, clock, config.getZone(), config.getCronPeriod());
            startLoops();

            if (List.of(args).contains("--demo")) {
                submitDemoJobs(channelService, jobService, cronService);
            }

            // 5. Graceful shutdown on Ctrl+C
            addShutdownHook();

            logger.info("=== Work Queue is running ===");
            logger.info("Press Ctrl+C to stop");

            while (dispatcherThread.isAlive()) {
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException e) {
                    logger.info("Main thread interrupted");
                    Thread.currentThread().interrupt();
                    break;
                }
            }

        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error during startup", e);
            System.exit(1);
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not load logging.properties, using JVM defaults", e);
        }
    }

    private static void initializeDatabase(QueueConfig config) {
        try {
            logger.info("Initializing database...");
            database = new Database(config.getDbUrl(), config.getDbUser(), config.getDbPassword(),
                    config.getDbPoolSize());
            database.initialize();
            logger.info("Database initialized successfully");
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to initialize database", e);
            throw new IllegalStateException("Database initialization failed", e);
        }
    }

    private static void startLoops() {
        dispatcherThread = new Thread(() -> {
            try {
                dispatcher.start();
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Dispatcher error", e);
            }
        }, "Dispatcher-Thread");
        dispatcherThread.setDaemon(false);
        dispatcherThread.start();

        cronThread = new Thread(() -> {
            try {
                cronTicker.start();
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Cron ticker error", e);
            }
        }, "Cron-Thread");
        cronThread.setDaemon(true);
        cronThread.start();

        logger.info("Dispatcher and cron ticker started");
    }

    /**
     * Seed a "reports" channel, a handful of jobs (one waiting on another) and a
     * cron entry firing every minute.
     */
    private static void submitDemoJobs(ChannelService channelService, JobService jobService,
                                       CronService cronService) {
        try {
            logger.info("Submitting demo jobs...");
            if (channelService.findChannel("reports").isEmpty()) {
                channelService.createChannel("reports", 2);
            }

            for (int i = 1; i <= 5; i++) {
                JobData mail = jobService.enqueue("demo", "Newsletter #" + i, "Mail", "Send",
                        List.of((long) i, (long) i + 100), "Newsletter #" + i, "Hello from the work queue");
                jobService.withPriority(mail.getId(), 10 - i);
            }

            JobData cleanup = jobService.enqueue("demo", "Clean temp files", "Maintenance", "Cleanup",
                    List.of(), Map.of("directory", "/tmp/cache", "daysOld", 7, "filePattern", "*.tmp"));
            JobData report = jobService.enqueue("demo", "Monthly sales report", "Report", "Generate",
                    List.of(), "sales", "2026-09");
            jobService.onChannel(report.getId(), "reports");
            jobService.afterJob(report.getId(), cleanup.getId());

            jobService.enqueue("demo", "Broken job", "Maintenance", "Fail", List.of(), "simulated failure");

            cronService.schedule(CronDefinition.of("Inventory report",
                            new TargetRef("Report", "Generate", TargetRef.EMPTY_LIST,
                                    ArgumentDecoder.encodeList(List.of("inventory", "current"))),
                            "demo")
                    .every(1, IntervalUnit.MINUTES));

            logger.info("Demo submission complete");
        } catch (QueueException e) {
            logger.log(Level.WARNING, "Demo submission failed: " + e.getMessage(), e);
        }
    }

    private static void addShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("\n=== Shutdown signal received ===");
            try {
                if (cronTicker != null) {
                    cronTicker.shutdown();
                    cronThread.interrupt();
                }
                if (dispatcher != null) {
                    dispatcher.shutdown();
                    dispatcherThread.interrupt();
                }
                if (database != null) {
                    database.close();
                }
                logger.info("=== Work Queue stopped ===");
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Error during shutdown", e);
            }
        }, "Shutdown-Hook"));
    }
}
