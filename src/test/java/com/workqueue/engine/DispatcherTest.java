package com.workqueue.engine;

import com.workqueue.core.JobState;
import com.workqueue.core.TargetRef;
import com.workqueue.db.ChannelRepository;
import com.workqueue.db.Database;
import com.workqueue.db.JobRepository;
import com.workqueue.db.JobRepository.JobData;
import com.workqueue.registry.OperationRegistry;
import com.workqueue.registry.ParamKind;
import com.workqueue.registry.SubjectSet;
import com.workqueue.registry.TargetValidator;
import com.workqueue.service.ChannelService;
import com.workqueue.service.JobRequest;
import com.workqueue.service.JobService;
import com.workqueue.support.InMemoryDatabase;
import com.workqueue.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Dispatcher ticks driven by hand against an in-memory store.
 */
public class DispatcherTest {
    private static final LocalDateTime T0 = LocalDateTime.of(2026, 6, 1, 8, 0);

    private Database database;
    private JobRepository jobRepository;
    private OperationRegistry registry;
    private ChannelService channelService;
    private JobService jobService;
    private Dispatcher dispatcher;
    private MutableClock clock;

    private final List<Long> executionOrder = new CopyOnWriteArrayList<>();
    private final List<List<Object>> receivedArguments = new CopyOnWriteArrayList<>();
    private final List<SubjectSet> receivedSubjects = new CopyOnWriteArrayList<>();
    private final CountDownLatch gate = new CountDownLatch(1);

    @BeforeEach
    public void setUp() throws SQLException {
        database = InMemoryDatabase.create();
        clock = new MutableClock(T0);
        jobRepository = new JobRepository(database);
        ChannelRepository channelRepository = new ChannelRepository(database);

        registry = new OperationRegistry();
        registry.domain("Partner")
                .operation("Record", (context, subjects, args) -> {
                    executionOrder.add(context.getJobId());
                    return null;
                })
                .operation("Collect", (context, subjects, args) -> {
                    receivedSubjects.add(subjects);
                    receivedArguments.add(args);
                    return "collected " + args.size();
                }, ParamKind.SCALAR, ParamKind.SCALAR, ParamKind.SCALAR)
                .operation("Fail", (context, subjects, args) -> {
                    throw new IllegalStateException("boom");
                })
                .operation("FailWithoutMessage", (context, subjects, args) -> {
                    throw new UnsupportedOperationException();
                })
                .operation("Wait", (context, subjects, args) -> {
                    gate.await(10, TimeUnit.SECONDS);
                    return null;
                })
                .operation("Log", (context, subjects, args) -> {
                    context.log("INFO", "hello " + context.getOwner());
                    return "logged";
                });

        channelService = new ChannelService(channelRepository, 1);
        channelService.defaultChannel();
        jobService = new JobService(jobRepository, channelService, new TargetValidator(registry), clock);
        dispatcher = new Dispatcher(4, jobRepository, channelRepository, new JobRunner(registry, jobRepository, clock),
                clock, Duration.ofMillis(10), Duration.ofMillis(50), Duration.ofSeconds(5));
    }

    @AfterEach
    public void tearDown() {
        gate.countDown();
        if (dispatcher != null) {
            dispatcher.shutdown();
        }
        if (database != null) {
            database.close();
        }
    }

    @Test
    public void testTickOnEmptyStore() {
        TickSummary summary = dispatcher.tick();

        assertEquals(0, summary.getAdmitted());
        assertEquals(0, summary.getLaunched());
        assertFalse(summary.hasMoreCandidates());
    }

    @Test
    public void testAdmissionFollowsPriorityThenCreationTimeThenId() throws Exception {
        long a = create("A", "Record", 5);
        clock.advance(Duration.ofSeconds(1));
        long b = create("B", "Record", 1);
        clock.advance(Duration.ofSeconds(1));
        long c = create("C", "Record", 1);
        long d = create("D", "Record", 1);

        runUntilSettled();

        assertEquals(List.of(b, c, d, a), executionOrder);
    }

    @Test
    public void testChannelCapacityBoundsEnqueuedAndRunning() throws Exception {
        channelService.createChannel("batch", 2);
        for (int i = 0; i < 5; i++) {
            jobService.create(JobRequest.of("wait-" + i, TargetRef.of("Partner", "Wait"), "admin").onChannel("batch"));
        }

        TickSummary first = dispatcher.tick();
        assertEquals(2, first.getAdmitted());
        assertEquals(2, first.getLaunched());

        TickSummary second = dispatcher.tick();
        assertEquals(0, second.getAdmitted(), "channel is full");
        assertFalse(second.hasMoreCandidates());
        assertEquals(2, jobRepository.getJobsByState(JobState.RUNNING).size());
        assertEquals(3, jobRepository.getJobsByState(JobState.PENDING).size());

        gate.countDown();
        runUntilSettled();

        assertEquals(5, jobRepository.getJobsByState(JobState.DONE).size());
    }

    @Test
    public void testDependencyOverridesPriority() throws Exception {
        JobData job2 = jobService.create(JobRequest.of("Job2", TargetRef.of("Partner", "Record"), "admin")
                .withPriority(1));
        JobData job1 = jobService.create(JobRequest.of("Job1", TargetRef.of("Partner", "Record"), "admin")
                .withPriority(12)
                .afterJob(job2.getId()));

        runUntilSettled(() -> {
            JobData dependent = jobRepository.getJobById(job1.getId());
            if (dependent.getState() != JobState.PENDING) {
                assertEquals(JobState.DONE, jobRepository.getJobById(job2.getId()).getState(),
                        "Job1 left PENDING before Job2 was DONE");
            }
        });

        JobData prerequisite = jobRepository.getJobById(job2.getId());
        JobData dependent = jobRepository.getJobById(job1.getId());
        assertEquals(JobState.DONE, prerequisite.getState());
        assertEquals(JobState.DONE, dependent.getState());
        assertTrue(prerequisite.getDoneAt().isBefore(dependent.getEnqueuedAt()));
        assertEquals(List.of(job2.getId(), job1.getId()), executionOrder);
    }

    @Test
    public void testDependencyWinsOverBetterPriority() throws Exception {
        long prerequisite = create("slow lane", "Record", 10);
        long dependent = create("urgent", "Record", 0);
        assertTrue(jobService.afterJob(dependent, prerequisite));

        runUntilSettled();

        assertEquals(List.of(prerequisite, dependent), executionOrder);
    }

    @Test
    public void testArgumentsReachHandlerInOrder() throws Exception {
        JobData job = jobService.enqueue("admin", "collect", "Partner", "Collect", List.of(1L, 2L), 12, "x", true);

        runUntilSettled();

        assertEquals(List.of(12L, "x", true), receivedArguments.get(0));
        assertEquals(List.of(1L, 2L), receivedSubjects.get(0).getIds());
        assertEquals("Partner", receivedSubjects.get(0).getDomain());

        JobData done = jobRepository.getJobById(job.getId());
        assertEquals(JobState.DONE, done.getState());
        assertEquals("collected 3", done.getResult());
        assertNotNull(done.getStartedAt());
        assertNotNull(done.getDoneAt());
    }

    @Test
    public void testFailuresAreRecordedAndDoNotStopOtherJobs() throws Exception {
        long failing = create("failing", "Fail", 0);
        long silent = create("silent", "FailWithoutMessage", 1);
        long healthy = create("healthy", "Record", 2);

        runUntilSettled();

        JobData failed = jobRepository.getJobById(failing);
        assertEquals(JobState.FAILED, failed.getState());
        assertEquals("boom", failed.getErrorInfo());
        assertNull(failed.getResult());

        assertEquals("java.lang.UnsupportedOperationException", jobRepository.getJobById(silent).getErrorInfo());

        JobData done = jobRepository.getJobById(healthy);
        assertEquals(JobState.DONE, done.getState());
        assertEquals(JobRunner.DEFAULT_RESULT, done.getResult());
    }

    @Test
    public void testArityCheckedAgainAtRunTime() throws Exception {
        JobData job = jobService.enqueue("admin", "collect", "Partner", "Collect", List.of(), 1, 2, 3);
        registry.domain("Partner").operation("Collect", (context, subjects, args) -> null, ParamKind.SCALAR);

        runUntilSettled();

        JobData failed = jobRepository.getJobById(job.getId());
        assertEquals(JobState.FAILED, failed.getState());
        assertEquals("wrong number of arguments given: expected 1 arguments, received 3", failed.getErrorInfo());
    }

    @Test
    public void testHandlerRunsAsOwnerAndWritesJobLogs() throws Exception {
        JobData job = jobService.create(JobRequest.of("log", TargetRef.of("Partner", "Log"), "alice"));

        runUntilSettled();

        assertEquals("logged", jobRepository.getJobById(job.getId()).getResult());
        assertEquals(List.of("INFO: hello alice"), jobRepository.getLogs(job.getId()));
        assertEquals(T0, jobRepository.getLogEntries(job.getId()).get(0).getLoggedAt(),
                "log entries are stamped from the dispatcher clock");
    }

    @Test
    public void testStatusReportsCounts() throws Exception {
        create("one", "Record", 0);
        create("two", "Record", 0);

        Map<String, Object> status = dispatcher.getStatus();

        assertEquals(false, status.get("running"));
        assertEquals(4, status.get("workerCount"));
        assertEquals(2, status.get("pendingJobs"));
        assertEquals(0, status.get("doneJobs"));
    }

    private long create(String name, String operation, int priority) {
        return jobService.create(JobRequest.of(name, TargetRef.of("Partner", operation), "admin")
                .withPriority(priority)).getId();
    }

    private interface Check {
        void run() throws Exception;
    }

    private void runUntilSettled() throws Exception {
        runUntilSettled(() -> { });
    }

    /**
     * Tick, wait for launched jobs to finish, move the clock, repeat until nothing
     * is left to admit. {@code check} runs after every tick and every wait.
     */
    private void runUntilSettled(Check check) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            dispatcher.tick();
            check.run();
            waitForActiveJobs(deadline);
            check.run();
            if (!jobRepository.hasAdmissibleCandidate()) {
                return;
            }
            clock.advance(Duration.ofSeconds(1));
        }
        fail("Queue did not settle within 10 seconds");
    }

    private void waitForActiveJobs(long deadline) throws Exception {
        while (System.currentTimeMillis() < deadline) {
            if (jobRepository.getJobsByState(JobState.ENQUEUED).isEmpty()
                    && jobRepository.getJobsByState(JobState.RUNNING).isEmpty()) {
                return;
            }
            Thread.sleep(10);
        }
        fail("Jobs still active at the deadline");
    }
}
