package com.workqueue.service;

import com.workqueue.core.IntervalUnit;
import com.workqueue.core.TargetRef;

import java.time.LocalDateTime;

/**
 * Values for creating or editing a cron entry. A null id creates a new entry.
 * Defaults: every 1 month, active, first call at the time of scheduling.
 */
public class CronDefinition {
    private Long id;
    private final String name;
    private final TargetRef target;
    private final String owner;
    private int intervalNumber = 1;
    private IntervalUnit intervalUnit = IntervalUnit.MONTHS;
    private LocalDateTime nextCallAt;
    private boolean active = true;

    private CronDefinition(String name, TargetRef target, String owner) {
        this.name = name;
        this.target = target;
        this.owner = owner;
    }

    public static CronDefinition of(String name, TargetRef target, String owner) {
        return new CronDefinition(name, target, owner);
    }

    /** Edit the existing entry with this id instead of creating one. */
    public CronDefinition withId(Long id) {
        this.id = id;
        return this;
    }

    public CronDefinition every(int intervalNumber, IntervalUnit intervalUnit) {
        this.intervalNumber = intervalNumber;
        this.intervalUnit = intervalUnit;
        return this;
    }

    public CronDefinition startingAt(LocalDateTime nextCallAt) {
        this.nextCallAt = nextCallAt;
        return this;
    }

    public CronDefinition active(boolean active) {
        this.active = active;
        return this;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public TargetRef getTarget() {
        return target;
    }

    public String getOwner() {
        return owner;
    }

    public int getIntervalNumber() {
        return intervalNumber;
    }

    public IntervalUnit getIntervalUnit() {
        return intervalUnit;
    }

    public LocalDateTime getNextCallAt() {
        return nextCallAt;
    }

    public boolean isActive() {
        return active;
    }
}
