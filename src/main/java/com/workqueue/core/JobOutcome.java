package com.workqueue.core;

/**
 * Result of running one job: the terminal state to record plus the result text
 * (on success) or the error info (on failure).
 */
public final class JobOutcome {
    private final JobState state;
    private final String result;
    private final String errorInfo;

    private JobOutcome(JobState state, String result, String errorInfo) {
        this.state = state;
        this.result = result;
        this.errorInfo = errorInfo;
    }

    public static JobOutcome done(String result) {
        return new JobOutcome(JobState.DONE, result, null);
    }

    public static JobOutcome failed(String errorInfo) {
        return new JobOutcome(JobState.FAILED, null, errorInfo);
    }

    public JobState getState() {
        return state;
    }

    public String getResult() {
        return result;
    }

    public String getErrorInfo() {
        return errorInfo;
    }

    public boolean isSuccess() {
        return state == JobState.DONE;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Done(" + result + ")" : "Failed(" + errorInfo + ")";
    }
}
