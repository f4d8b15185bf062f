package com.workqueue.service;

import com.workqueue.core.TargetRef;
import com.workqueue.core.ValidationException;
import com.workqueue.db.ChannelRepository;
import com.workqueue.db.ChannelRepository.ChannelData;
import com.workqueue.db.Database;
import com.workqueue.db.JobRepository;
import com.workqueue.registry.OperationRegistry;
import com.workqueue.registry.TargetValidator;
import com.workqueue.support.InMemoryDatabase;
import com.workqueue.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

public class ChannelServiceTest {

    private Database database;
    private ChannelService channelService;

    @BeforeEach
    public void setUp() throws SQLException {
        database = InMemoryDatabase.create();
        channelService = new ChannelService(new ChannelRepository(database), 3);
    }

    @AfterEach
    public void tearDown() {
        if (database != null) {
            database.close();
        }
    }

    @Test
    public void testDefaultChannelCreatedOnceWithConfiguredCapacity() {
        ChannelData first = channelService.defaultChannel();
        ChannelData second = channelService.defaultChannel();

        assertEquals(ChannelRepository.DEFAULT_CHANNEL, first.getName());
        assertEquals(3, first.getCapacity());
        assertTrue(first.isDefault());
        assertEquals(first.getId(), second.getId());
        assertEquals(1, channelService.listChannels().size());
    }

    @Test
    public void testDefaultChannelIsNeverDeleted() {
        channelService.defaultChannel();

        assertFalse(channelService.deleteChannel(ChannelRepository.DEFAULT_CHANNEL));
        assertTrue(channelService.findChannel(ChannelRepository.DEFAULT_CHANNEL).isPresent());
    }

    @Test
    public void testCreateUpdateAndDelete() {
        ChannelData reports = channelService.createChannel("reports", 2);
        assertEquals(2, reports.getCapacity());
        assertFalse(reports.isDefault());

        channelService.updateCapacity("reports", 5);
        assertEquals(5, channelService.findChannel("reports").orElseThrow().getCapacity());

        assertTrue(channelService.deleteChannel("reports"));
        assertTrue(channelService.findChannel("reports").isEmpty());
        assertFalse(channelService.deleteChannel("reports"), "already gone");
    }

    @Test
    public void testInvalidChannelsAreRejected() {
        channelService.createChannel("reports", 1);

        assertThrows(ValidationException.class, () -> channelService.createChannel("reports", 4));
        assertThrows(ValidationException.class, () -> channelService.createChannel("zero", 0));
        assertThrows(ValidationException.class, () -> channelService.createChannel(" ", 1));
        assertThrows(ValidationException.class, () -> channelService.updateCapacity("reports", -1));
        assertThrows(ValidationException.class, () -> channelService.updateCapacity("missing", 2));
    }

    @Test
    public void testChannelUsedByJobsCannotBeDeleted() {
        OperationRegistry registry = new OperationRegistry();
        registry.domain("Partner").operation("NameGet", (context, subjects, args) -> null);
        JobService jobService = new JobService(new JobRepository(database), channelService,
                new TargetValidator(registry), new MutableClock(LocalDateTime.of(2026, 1, 1, 0, 0)));
        channelService.createChannel("busy", 1);
        jobService.create(JobRequest.of("job", TargetRef.of("Partner", "NameGet"), "admin").onChannel("busy"));

        ValidationException e = assertThrows(ValidationException.class, () -> channelService.deleteChannel("busy"));
        assertTrue(e.getMessage().contains("still used by 1 job"));
    }

    @Test
    public void testDefaultCapacityMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new ChannelService(new ChannelRepository(database), 0));
    }
}
