package dev.jobharvest.model;

/**
 * Candidate selection strategies, in the order they are attempted.
 */
public enum SelectionTier {
    ORACLE,
    HEURISTIC,
    ATS_BOARD,
    NONE
}
