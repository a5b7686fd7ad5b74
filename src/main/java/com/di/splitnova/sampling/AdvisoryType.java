package com.di.splitnova.sampling;

/**
 * Non-fatal conditions found while refining thresholds.
 */
public enum AdvisoryType {

    /** The waitlist was shorter than the number of records still required; the set is under-filled. */
    WAITLIST_SHORT,

    /** Pass 1 accepted more records than the target; the set is over-filled and the waitlist is dropped. */
    TARGET_OVERSATISFIED
}
