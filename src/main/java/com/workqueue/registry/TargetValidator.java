package com.workqueue.registry;

import com.google.gson.JsonElement;
import com.workqueue.core.TargetRef;
import com.workqueue.core.ValidationException;

import java.util.List;

/**
 * Checks a {@link TargetRef} before a job or cron entry carrying it is stored.
 *
 * <p>Checks run in this order, the first failure wins:</p>
 * <ol>
 *   <li>the domain is registered</li>
 *   <li>the subject ids decode as a JSON list of integers</li>
 *   <li>the arguments decode as a JSON list</li>
 *   <li>the operation exists in the domain</li>
 *   <li>the number of arguments equals the operation's parameter count</li>
 * </ol>
 */
public class TargetValidator {
    private final OperationRegistry registry;

    public TargetValidator(OperationRegistry registry) {
        this.registry = registry;
    }

    /**
     * Validate a target reference.
     *
     * @param target the target to check
     * @return the resolved operation
     * @throws ValidationException describing the first failed check
     */
    public OperationDefinition validate(TargetRef target) {
        if (target == null) {
            throw new ValidationException("A target reference is required");
        }
        if (!registry.hasDomain(target.getOperationDomain())) {
            throw new ValidationException("Unknown domain: " + target.getOperationDomain());
        }
        try {
            ArgumentDecoder.decodeSubjectIds(target.getSubjectIds());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unable to decode SubjectIDs: " + e.getMessage(), e);
        }
        List<JsonElement> arguments;
        try {
            arguments = ArgumentDecoder.decodeArgumentList(target.getArguments());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unable to decode Arguments: " + e.getMessage(), e);
        }
        OperationDefinition operation =
                registry.resolve(target.getOperationDomain(), target.getOperationName());
        if (arguments.size() != operation.getArity()) {
            throw new ValidationException(String.format(
                    "wrong number of arguments given: expected %d arguments, received %d",
                    operation.getArity(), arguments.size()));
        }
        return operation;
    }
}
