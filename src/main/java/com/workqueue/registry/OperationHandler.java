package com.workqueue.registry;

import com.workqueue.core.JobContext;

import java.util.List;

/**
 * Code behind a registered operation.
 */
@FunctionalInterface
public interface OperationHandler {

    /**
     * Run the operation.
     *
     * @param context   job id, owner identity and job log of the running job
     * @param subjects  the subjects addressed by the job
     * @param arguments decoded positional arguments, one per declared parameter
     * @return a result; a String is stored as the job result, anything else
     *         (including null) stores the default success text
     * @throws Exception any failure; the job ends FAILED with the message as error info
     */
    Object invoke(JobContext context, SubjectSet subjects, List<Object> arguments) throws Exception;
}
