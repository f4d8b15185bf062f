package com.workqueue.service;

import com.workqueue.core.StoreException;
import com.workqueue.core.ValidationException;
import com.workqueue.db.ChannelRepository;
import com.workqueue.db.ChannelRepository.ChannelData;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Administration of channels.
 *
 * <p>The default channel is created on demand with the configured capacity and
 * can never be deleted. Channels referenced by jobs cannot be deleted either,
 * since jobs are never removed by the queue itself.</p>
 */
public class ChannelService {
    private static final Logger logger = Logger.getLogger(ChannelService.class.getName());

    private final ChannelRepository repository;
    private final int defaultCapacity;

    public ChannelService(ChannelRepository repository, int defaultCapacity) {
        if (defaultCapacity < 1) {
            throw new IllegalArgumentException("Default channel capacity must be positive, got " + defaultCapacity);
        }
        this.repository = repository;
        this.defaultCapacity = defaultCapacity;
    }

    /**
     * Get the default channel, creating it if needed.
     */
    public ChannelData defaultChannel() {
        try {
            return repository.ensureDefaultChannel(defaultCapacity);
        } catch (SQLException e) {
            throw new StoreException("Cannot load default channel", e);
        }
    }

    public ChannelData createChannel(String name, int capacity) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("A channel name is required");
        }
        checkCapacity(capacity);
        try {
            if (repository.findByName(name).isPresent()) {
                throw new ValidationException("Channel already exists: " + name);
            }
            ChannelData channel = repository.insert(name, capacity);
            logger.info("Created channel " + channel);
            return channel;
        } catch (SQLException e) {
            throw new StoreException("Cannot create channel " + name, e);
        }
    }

    /**
     * Change a channel's capacity. Jobs already admitted keep running; lowering the
     * capacity only holds back new admissions until occupancy drops below it.
     */
    public void updateCapacity(String name, int capacity) {
        checkCapacity(capacity);
        try {
            if (!repository.updateCapacity(name, capacity)) {
                throw new ValidationException("Unknown channel: " + name);
            }
            logger.info("Channel '" + name + "' capacity set to " + capacity);
        } catch (SQLException e) {
            throw new StoreException("Cannot update channel " + name, e);
        }
    }

    /**
     * Delete a channel.
     *
     * @return false for the default channel and for unknown names, true once deleted
     * @throws ValidationException if jobs still reference the channel
     */
    public boolean deleteChannel(String name) {
        if (ChannelRepository.DEFAULT_CHANNEL.equals(name)) {
            logger.warning("Refusing to delete the default channel");
            return false;
        }
        try {
            Optional<ChannelData> channel = repository.findByName(name);
            if (channel.isEmpty()) {
                return false;
            }
            int jobs = repository.countJobs(channel.get().getId());
            if (jobs > 0) {
                throw new ValidationException("Channel '" + name + "' is still used by " + jobs + " job(s)");
            }
            boolean deleted = repository.delete(name);
            if (deleted) {
                logger.info("Deleted channel '" + name + "'");
            }
            return deleted;
        } catch (SQLException e) {
            throw new StoreException("Cannot delete channel " + name, e);
        }
    }

    public Optional<ChannelData> findChannel(String name) {
        try {
            return repository.findByName(name);
        } catch (SQLException e) {
            throw new StoreException("Cannot load channel " + name, e);
        }
    }

    public List<ChannelData> listChannels() {
        try {
            return repository.findAll();
        } catch (SQLException e) {
            throw new StoreException("Cannot list channels", e);
        }
    }

    /**
     * Channel a job should go to: the named one, or the default channel when the
     * name is null or unknown (an unknown name is logged).
     */
    ChannelData resolveForJob(String name) {
        if (name == null) {
            return defaultChannel();
        }
        Optional<ChannelData> channel = findChannel(name);
        if (channel.isEmpty()) {
            logger.warning("Trying to use non existent channel '" + name + "', using default channel");
            return defaultChannel();
        }
        return channel.get();
    }

    private static void checkCapacity(int capacity) {
        if (capacity < 1) {
            throw new ValidationException("Channel capacity must be a positive integer, got " + capacity);
        }
    }
}
