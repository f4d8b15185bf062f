package com.workqueue.service;

import com.workqueue.core.JobState;
import com.workqueue.core.StoreException;
import com.workqueue.core.TargetRef;
import com.workqueue.core.ValidationException;
import com.workqueue.db.ChannelRepository.ChannelData;
import com.workqueue.db.JobRepository;
import com.workqueue.db.JobRepository.JobData;
import com.workqueue.registry.ArgumentDecoder;
import com.workqueue.registry.TargetValidator;

import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Creation and adjustment of jobs.
 *
 * <p>A job is validated before anything is written: a request that fails
 * validation leaves no row behind. Adjustments ({@link #withPriority},
 * {@link #onChannel}, {@link #afterJob}) apply only while the job is PENDING and
 * report {@code false} once the dispatcher has admitted it.</p>
 */
public class JobService {
    private static final Logger logger = Logger.getLogger(JobService.class.getName());

    private final JobRepository repository;
    private final ChannelService channels;
    private final TargetValidator validator;
    private final Clock clock;

    public JobService(JobRepository repository, ChannelService channels, TargetValidator validator, Clock clock) {
        this.repository = repository;
        this.channels = channels;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Validate and store a new PENDING job.
     *
     * @param request what to run, as whom, where and when
     * @return the stored job
     * @throws ValidationException if the request is invalid; nothing is stored
     * @throws StoreException      if the store fails
     */
    public JobData create(JobRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("A job name is required");
        }
        if (request.getOwner() == null || request.getOwner().isBlank()) {
            throw new ValidationException("A job owner is required");
        }
        validator.validate(request.getTarget());

        try {
            if (request.getDependsOn() != null && repository.getJobById(request.getDependsOn()) == null) {
                throw new ValidationException("Unknown prerequisite job: " + request.getDependsOn());
            }
            ChannelData channel = channels.resolveForJob(request.getChannel());

            JobData job = new JobData();
            job.setName(request.getName());
            job.setTarget(request.getTarget());
            job.setOwner(request.getOwner());
            job.setChannelId(channel.getId());
            job.setPriority(request.getPriority());
            job.setDependsOn(request.getDependsOn());
            job.setState(JobState.PENDING);
            job.setCreatedAt(now());
            job.setMaxRetries(request.getMaxRetries());

            long id = repository.insert(job);
            job.setId(id);
            logger.info("Job created: " + job + " on channel '" + channel.getName() + "'");
            return job;

        } catch (SQLException e) {
            throw new StoreException("Failed to create job " + request.getName(), e);
        }
    }

    /**
     * Queue an operation on some subjects.
     *
     * <p>Subjects and arguments are marshalled into the stored list encoding; a
     * {@link com.workqueue.registry.SubjectSet} argument is stored as its ids.</p>
     *
     * @param owner       identity the operation will run as
     * @param description job name
     * @param domain      operation domain
     * @param operation   operation name
     * @param subjectIds  ids of the subjects, in order
     * @param arguments   positional arguments
     * @return the stored PENDING job
     */
    public JobData enqueue(String owner, String description, String domain, String operation,
                           List<Long> subjectIds, Object... arguments) {
        TargetRef target = new TargetRef(domain, operation,
                ArgumentDecoder.encodeList(subjectIds),
                ArgumentDecoder.encodeList(Arrays.asList(arguments)));
        return create(JobRequest.of(description, target, owner));
    }

    public boolean withPriority(long jobId, int priority) {
        try {
            return logAdjustment(jobId, "priority", repository.updatePendingPriority(jobId, priority));
        } catch (SQLException e) {
            throw new StoreException("Failed to change priority of job " + jobId, e);
        }
    }

    /**
     * Move a PENDING job to the named channel. An unknown channel name is logged
     * and leaves the job where it is.
     */
    public boolean onChannel(long jobId, String channelName) {
        Optional<ChannelData> channel = channels.findChannel(channelName);
        if (channel.isEmpty()) {
            logger.warning("Trying to set non existent channel '" + channelName + "' on job " + jobId);
            return false;
        }
        try {
            return logAdjustment(jobId, "channel", repository.updatePendingChannel(jobId, channel.get().getId()));
        } catch (SQLException e) {
            throw new StoreException("Failed to change channel of job " + jobId, e);
        }
    }

    /**
     * Make a PENDING job wait until another job is DONE.
     *
     * @throws ValidationException if the prerequisite is unknown, is the job itself,
     *                             or already waits (directly or not) on the job
     */
    public boolean afterJob(long jobId, long prerequisiteId) {
        if (jobId == prerequisiteId) {
            throw new ValidationException("Job " + jobId + " cannot depend on itself");
        }
        try {
            JobData prerequisite = repository.getJobById(prerequisiteId);
            if (prerequisite == null) {
                throw new ValidationException("Unknown prerequisite job: " + prerequisiteId);
            }
            Set<Long> seen = new HashSet<>();
            Long next = prerequisite.getDependsOn();
            while (next != null && seen.add(next)) {
                if (next == jobId) {
                    throw new ValidationException("Job " + prerequisiteId + " already waits for job " + jobId);
                }
                JobData link = repository.getJobById(next);
                next = link == null ? null : link.getDependsOn();
            }
            return logAdjustment(jobId, "dependency", repository.updatePendingDependency(jobId, prerequisiteId));
        } catch (SQLException e) {
            throw new StoreException("Failed to set prerequisite of job " + jobId, e);
        }
    }

    public Optional<JobData> findJob(long jobId) {
        try {
            return Optional.ofNullable(repository.getJobById(jobId));
        } catch (SQLException e) {
            throw new StoreException("Failed to load job " + jobId, e);
        }
    }

    public List<JobData> listJobs(JobState state) {
        try {
            return repository.getJobsByState(state);
        } catch (SQLException e) {
            throw new StoreException("Failed to list " + state + " jobs", e);
        }
    }

    private boolean logAdjustment(long jobId, String what, boolean applied) {
        if (!applied) {
            logger.warning("Job " + jobId + " is not pending anymore, " + what + " left unchanged");
        }
        return applied;
    }

    // H2 timestamps keep microseconds
    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
