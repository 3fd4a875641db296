package io.flowscan.analysis;

/**
 * Termination status of a function. Ordered: {@code ALWAYS} below {@code MAY_DIVERGE}.
 */
public enum Termination {
    ALWAYS,
    MAY_DIVERGE
}
