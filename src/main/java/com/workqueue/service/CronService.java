package com.workqueue.service;

import com.workqueue.core.StoreException;
import com.workqueue.core.ValidationException;
import com.workqueue.db.CronRepository;
import com.workqueue.db.CronRepository.CronData;
import com.workqueue.registry.TargetValidator;

import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Administration of cron entries.
 *
 * <p>The target of an entry is validated the same way as a job's when the entry
 * is saved, so a bad definition is rejected up front instead of at every firing.
 * An edit never moves the next call backwards: an earlier {@code startingAt} than
 * the stored one is ignored.</p>
 */
public class CronService {
    private static final Logger logger = Logger.getLogger(CronService.class.getName());

    private final CronRepository repository;
    private final TargetValidator validator;
    private final Clock clock;

    public CronService(CronRepository repository, TargetValidator validator, Clock clock) {
        this.repository = repository;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Create or edit a cron entry.
     *
     * @param definition the entry; a null id creates it
     * @return the stored entry
     * @throws ValidationException if the definition is invalid or names an unknown id
     */
    public CronData schedule(CronDefinition definition) {
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new ValidationException("A cron name is required");
        }
        if (definition.getOwner() == null || definition.getOwner().isBlank()) {
            throw new ValidationException("A cron owner is required");
        }
        if (definition.getIntervalNumber() < 1) {
            throw new ValidationException("Interval number must be at least 1, got " + definition.getIntervalNumber());
        }
        if (definition.getIntervalUnit() == null) {
            throw new ValidationException("An interval unit is required");
        }
        validator.validate(definition.getTarget());

        CronData cron = new CronData();
        cron.setName(definition.getName());
        cron.setTarget(definition.getTarget());
        cron.setOwner(definition.getOwner());
        cron.setIntervalNumber(definition.getIntervalNumber());
        cron.setIntervalUnit(definition.getIntervalUnit());
        cron.setActive(definition.isActive());

        try {
            if (definition.getId() == null) {
                cron.setNextCallAt(definition.getNextCallAt() != null
                        ? definition.getNextCallAt()
                        : LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS));
                cron.setId(repository.insert(cron));
                logger.info("Scheduled " + cron);
                return cron;
            }

            CronData existing = repository.getCronById(definition.getId());
            if (existing == null) {
                throw new ValidationException("Unknown cron: " + definition.getId());
            }
            LocalDateTime requested = definition.getNextCallAt();
            cron.setId(existing.getId());
            cron.setNextCallAt(requested != null && requested.isAfter(existing.getNextCallAt())
                    ? requested
                    : existing.getNextCallAt());
            repository.update(cron);
            logger.info("Updated " + cron);
            return cron;

        } catch (SQLException e) {
            throw new StoreException("Failed to save cron " + definition.getName(), e);
        }
    }

    public boolean setActive(long cronId, boolean active) {
        try {
            boolean changed = repository.setActive(cronId, active);
            if (changed) {
                logger.info("Cron " + cronId + (active ? " activated" : " deactivated"));
            }
            return changed;
        } catch (SQLException e) {
            throw new StoreException("Failed to change cron " + cronId, e);
        }
    }

    public Optional<CronData> findCron(long cronId) {
        try {
            return Optional.ofNullable(repository.getCronById(cronId));
        } catch (SQLException e) {
            throw new StoreException("Failed to load cron " + cronId, e);
        }
    }

    public List<CronData> listCrons() {
        try {
            return repository.getAllCrons();
        } catch (SQLException e) {
            throw new StoreException("Failed to list crons", e);
        }
    }

    public boolean deleteCron(long cronId) {
        try {
            return repository.delete(cronId);
        } catch (SQLException e) {
            throw new StoreException("Failed to delete cron " + cronId, e);
        }
    }
}
