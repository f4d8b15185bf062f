package com.workqueue.registry;

/**
 * Declared kind of an operation parameter. Decides how the stored argument value
 * is turned into the Java value the handler receives.
 */
public enum ParamKind {
    /** An id or a list of ids, decoded into a {@link SubjectSet} of the job's domain. */
    SUBJECTS,
    /** A JSON object, decoded into an unmodifiable {@code Map<String, Object>}. */
    STRUCTURED,
    /** A plain value: number, string, boolean or null (nested lists and objects as collections). */
    SCALAR
}
