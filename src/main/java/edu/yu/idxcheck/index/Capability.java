package edu.yu.idxcheck.index;

/**
 * Optional operation kinds an index may support. Point reads are mandatory
 * and therefore not listed.
 */
public enum Capability {
    WRITE, INSERT, UPDATE, DELETE, SCAN, BULKLOAD
}
