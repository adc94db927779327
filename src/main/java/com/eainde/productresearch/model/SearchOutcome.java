package com.eainde.productresearch.model;

/**
 * Classification of one search attempt.
 */
public enum SearchOutcome {
    /** Structured results with a non-empty result array. */
    SUCCESS,
    /** The provider answered authoritatively that nothing matched. Never retried. */
    EMPTY_RESULT,
    /** Every try failed, timed out or produced unparseable output. */
    EXHAUSTED,
    /** The attempt has not run yet. */
    NOT_RUN
}
