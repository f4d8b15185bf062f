package com.workqueue.core;

import java.util.Objects;

/**
 * Descriptor of the work a job or cron entry performs: an operation of a domain,
 * applied to a list of subjects with a list of positional arguments.
 *
 * <p>Subject ids and arguments are kept in their stored encoding, a JSON list
 * such as {@code [1, 2]} or {@code [[1, 2], "My string value", true]}, because
 * a target read back from the store must be re-validated exactly as written.
 * A null encoding is treated as the empty list.</p>
 */
public final class TargetRef {
    public static final String EMPTY_LIST = "[]";

    private final String operationDomain;
    private final String operationName;
    private final String subjectIds;
    private final String arguments;

    public TargetRef(String operationDomain, String operationName, String subjectIds, String arguments) {
        this.operationDomain = operationDomain;
        this.operationName = operationName;
        this.subjectIds = subjectIds == null ? EMPTY_LIST : subjectIds;
        this.arguments = arguments == null ? EMPTY_LIST : arguments;
    }

    /**
     * Target with no subjects and no arguments.
     */
    public static TargetRef of(String operationDomain, String operationName) {
        return new TargetRef(operationDomain, operationName, EMPTY_LIST, EMPTY_LIST);
    }

    public String getOperationDomain() {
        return operationDomain;
    }

    public String getOperationName() {
        return operationName;
    }

    /**
     * @return the JSON list encoding of the subject ids
     */
    public String getSubjectIds() {
        return subjectIds;
    }

    /**
     * @return the JSON list encoding of the positional arguments
     */
    public String getArguments() {
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TargetRef)) {
            return false;
        }
        TargetRef other = (TargetRef) o;
        return Objects.equals(operationDomain, other.operationDomain)
                && Objects.equals(operationName, other.operationName)
                && subjectIds.equals(other.subjectIds)
                && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operationDomain, operationName, subjectIds, arguments);
    }

    @Override
    public String toString() {
        return operationDomain + "." + operationName + subjectIds + arguments;
    }
}
