package com.vidnyan.archgate.domain.rule;

/**
 * Rule severity. Fixed per rule; there is no profile that relaxes it.
 */
public enum Severity {
    /** Fails the stage. */
    ERROR,
    /** Reported, never fails the stage. */
    ADVISORY
}
