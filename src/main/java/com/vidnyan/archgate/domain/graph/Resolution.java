package com.vidnyan.archgate.domain.graph;

/**
 * Outcome of resolving one raw reference against the scanned tree.
 */
public enum Resolution {
    RESOLVED,
    EXTERNAL,
    UNRESOLVED_AMBIGUOUS
}
