package com.workqueue.engine;

import com.google.gson.JsonElement;
import com.workqueue.core.JobContext;
import com.workqueue.core.JobExecutionException;
import com.workqueue.db.JobRepository;
import com.workqueue.db.JobRepository.JobData;
import com.workqueue.registry.ArgumentDecoder;
import com.workqueue.registry.OperationDefinition;
import com.workqueue.registry.OperationRegistry;
import com.workqueue.registry.ParamKind;
import com.workqueue.registry.SubjectSet;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs the operation a job targets.
 *
 * <p>Decodes the job's subjects and arguments, converts each argument for the
 * declared kind of the parameter receiving it, and invokes the handler as the
 * job's owner. Never writes to the job row: state changes are the worker's job.
 * Failures propagate to the caller.</p>
 */
public class JobRunner {
    private static final Logger logger = Logger.getLogger(JobRunner.class.getName());

    /** Result stored when the operation returns nothing or a non-string value. */
    public static final String DEFAULT_RESULT = "Job executed successfully.";

    private final OperationRegistry registry;
    private final JobRepository repository;
    private final Clock clock;

    public JobRunner(OperationRegistry registry, JobRepository repository, Clock clock) {
        this.registry = registry;
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Run a job's target operation.
     *
     * @param job the job, in RUNNING state
     * @return the operation's String result, or {@link #DEFAULT_RESULT}
     * @throws Exception if decoding fails or the operation raises
     */
    public String run(JobData job) throws Exception {
        OperationDefinition operation = registry.resolve(job.getOperationDomain(), job.getOperationName());

        SubjectSet subjects;
        List<JsonElement> rawArguments;
        try {
            subjects = new SubjectSet(job.getOperationDomain(), ArgumentDecoder.decodeSubjectIds(job.getSubjectIds()));
            rawArguments = ArgumentDecoder.decodeArgumentList(job.getArguments());
        } catch (IllegalArgumentException e) {
            throw new JobExecutionException("Cannot decode job " + job.getId() + ": " + e.getMessage(), e);
        }

        List<ParamKind> kinds = operation.getParameterKinds();
        if (rawArguments.size() != kinds.size()) {
            throw new JobExecutionException(String.format(
                    "wrong number of arguments given: expected %d arguments, received %d",
                    kinds.size(), rawArguments.size()));
        }
        List<Object> arguments = new ArrayList<>(kinds.size());
        for (int i = 0; i < kinds.size(); i++) {
            arguments.add(ArgumentDecoder.decodeArgument(kinds.get(i), rawArguments.get(i), job.getOperationDomain()));
        }

        JobContext context = new JobContext(job.getId(), job.getOwner(), repository, clock);
        long startTime = System.currentTimeMillis();
        Object result = operation.getHandler().invoke(context, subjects, arguments);
        logger.fine("Job " + job.getId() + " ran " + operation + " as " + job.getOwner() + " in "
                + (System.currentTimeMillis() - startTime) + "ms");

        return result instanceof String ? (String) result : DEFAULT_RESULT;
    }
}
