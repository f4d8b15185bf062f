package com.workqueue.service;

import com.workqueue.core.IntervalUnit;
import com.workqueue.core.TargetRef;
import com.workqueue.core.ValidationException;
import com.workqueue.db.CronRepository;
import com.workqueue.db.CronRepository.CronData;
import com.workqueue.db.Database;
import com.workqueue.registry.OperationRegistry;
import com.workqueue.registry.ParamKind;
import com.workqueue.registry.TargetValidator;
import com.workqueue.support.InMemoryDatabase;
import com.workqueue.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

public class CronServiceTest {
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 4, 15, 12, 0);
    private static final TargetRef CLEANUP = new TargetRef("Maintenance", "Cleanup", "[]", "[{\"days\": 7}]");

    private Database database;
    private CronService cronService;

    @BeforeEach
    public void setUp() throws SQLException {
        database = InMemoryDatabase.create();
        OperationRegistry registry = new OperationRegistry();
        registry.domain("Maintenance").operation("Cleanup", (context, subjects, args) -> null, ParamKind.STRUCTURED);
        cronService = new CronService(new CronRepository(database), new TargetValidator(registry), new MutableClock(NOW));
    }

    @AfterEach
    public void tearDown() {
        if (database != null) {
            database.close();
        }
    }

    @Test
    public void testScheduleCreatesEntryWithDefaults() {
        CronData cron = cronService.schedule(CronDefinition.of("Cleanup", CLEANUP, "ops"));

        CronData stored = cronService.findCron(cron.getId()).orElseThrow();
        assertEquals("Cleanup", stored.getName());
        assertEquals(CLEANUP, stored.getTarget());
        assertEquals("ops", stored.getOwner());
        assertEquals(1, stored.getIntervalNumber());
        assertEquals(IntervalUnit.MONTHS, stored.getIntervalUnit());
        assertEquals(NOW, stored.getNextCallAt());
        assertTrue(stored.isActive());
    }

    @Test
    public void testScheduleWithIdUpdatesEntry() {
        CronData cron = cronService.schedule(CronDefinition.of("Cleanup", CLEANUP, "ops")
                .every(1, IntervalUnit.DAYS)
                .startingAt(NOW.plusDays(1)));

        cronService.schedule(CronDefinition.of("Nightly cleanup", CLEANUP, "root")
                .withId(cron.getId())
                .every(2, IntervalUnit.HOURS)
                .active(false));

        CronData stored = cronService.findCron(cron.getId()).orElseThrow();
        assertEquals("Nightly cleanup", stored.getName());
        assertEquals("root", stored.getOwner());
        assertEquals(2, stored.getIntervalNumber());
        assertEquals(IntervalUnit.HOURS, stored.getIntervalUnit());
        assertEquals(NOW.plusDays(1), stored.getNextCallAt());
        assertFalse(stored.isActive());
        assertEquals(1, cronService.listCrons().size());
    }

    @Test
    public void testEditNeverMovesNextCallBackwards() {
        CronData cron = cronService.schedule(CronDefinition.of("Cleanup", CLEANUP, "ops")
                .startingAt(NOW.plusDays(3)));

        cronService.schedule(CronDefinition.of("Cleanup", CLEANUP, "ops")
                .withId(cron.getId())
                .startingAt(NOW));
        assertEquals(NOW.plusDays(3), cronService.findCron(cron.getId()).orElseThrow().getNextCallAt());

        cronService.schedule(CronDefinition.of("Cleanup", CLEANUP, "ops")
                .withId(cron.getId())
                .startingAt(NOW.plusDays(5)));
        assertEquals(NOW.plusDays(5), cronService.findCron(cron.getId()).orElseThrow().getNextCallAt());
    }

    @Test
    public void testInvalidDefinitionsAreRejected() {
        assertThrows(ValidationException.class, () -> cronService.schedule(
                CronDefinition.of("Cleanup", CLEANUP, "ops").every(0, IntervalUnit.DAYS)));
        assertThrows(ValidationException.class, () -> cronService.schedule(
                CronDefinition.of("Cleanup", CLEANUP, "ops").every(1, null)));
        assertThrows(ValidationException.class, () -> cronService.schedule(
                CronDefinition.of("Cleanup", TargetRef.of("Maintenance", "Cleanup"), "ops")));
        assertThrows(ValidationException.class, () -> cronService.schedule(
                CronDefinition.of("Cleanup", CLEANUP, "ops").withId(404L)));
        assertThrows(ValidationException.class, () -> cronService.schedule(
                CronDefinition.of("", CLEANUP, "ops")));
        assertTrue(cronService.listCrons().isEmpty());
    }

    @Test
    public void testActivateAndDelete() {
        CronData cron = cronService.schedule(CronDefinition.of("Cleanup", CLEANUP, "ops"));

        assertTrue(cronService.setActive(cron.getId(), false));
        assertFalse(cronService.findCron(cron.getId()).orElseThrow().isActive());
        assertFalse(cronService.setActive(404L, true));

        assertTrue(cronService.deleteCron(cron.getId()));
        assertTrue(cronService.findCron(cron.getId()).isEmpty());
        assertFalse(cronService.deleteCron(cron.getId()));
    }
}
