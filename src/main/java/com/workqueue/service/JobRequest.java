package com.workqueue.service;

import com.workqueue.core.TargetRef;

/**
 * Everything needed to create a job. Only the name, the target and the owner are
 * required; the job goes to the default channel with priority 0 otherwise.
 *
 * <pre>{@code
 * JobRequest request = JobRequest.of("Get name", TargetRef.of("Partner", "NameGet"), "admin")
 *         .onChannel("reports")
 *         .withPriority(12)
 *         .afterJob(otherJobId);
 * }</pre>
 */
public class JobRequest {
    private final String name;
    private final TargetRef target;
    private final String owner;
    private String channel;
    private int priority;
    private Long dependsOn;
    private int maxRetries;

    private JobRequest(String name, TargetRef target, String owner) {
        this.name = name;
        this.target = target;
        this.owner = owner;
    }

    public static JobRequest of(String name, TargetRef target, String owner) {
        return new JobRequest(name, target, owner);
    }

    /** Channel name; null or unknown means the default channel. */
    public JobRequest onChannel(String channel) {
        this.channel = channel;
        return this;
    }

    /** Lower values are admitted first. */
    public JobRequest withPriority(int priority) {
        this.priority = priority;
        return this;
    }

    /** Admit this job only once the given job is DONE. */
    public JobRequest afterJob(Long prerequisiteId) {
        this.dependsOn = prerequisiteId;
        return this;
    }

    /** Stored with the job; the dispatcher does not retry failed jobs. */
    public JobRequest withMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
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

    public String getChannel() {
        return channel;
    }

    public int getPriority() {
        return priority;
    }

    public Long getDependsOn() {
        return dependsOn;
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
