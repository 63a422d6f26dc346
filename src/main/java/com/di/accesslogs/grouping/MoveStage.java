package com.di.accesslogs.grouping;

/** Step of an object move at which it failed. */
public enum MoveStage {
    /** Copy to the grouped key failed; the source is untouched. */
    COPY,
    /** Copy succeeded but the source could not be deleted; the object now exists twice. */
    DELETE,
    /**
     * The move did not settle before the invocation deadline. The outcome is indeterminate: the
     * in-flight copy and delete may still have completed, so check whether the source key still
     * exists before redelivering it.
     */
    TIMEOUT
}
