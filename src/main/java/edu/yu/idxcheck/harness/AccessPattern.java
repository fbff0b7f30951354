package edu.yu.idxcheck.harness;

/**
 * The order in which a worker visits its assigned ids.
 */
public enum AccessPattern {
    SEQUENTIAL, REVERSE, RANDOM
}
