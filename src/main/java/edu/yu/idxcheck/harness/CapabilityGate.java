package edu.yu.idxcheck.harness;

import edu.yu.idxcheck.index.Capabilities;

/**
 * Answers whether a scenario, or a single driver call, may run against an
 * index with the given capabilities.
 */
public class CapabilityGate {

    private final Capabilities capabilities;

    public CapabilityGate(Capabilities capabilities) {
        if (capabilities == null) {
            throw new IllegalArgumentException("Capabilities can't be null");
        }

        this.capabilities = capabilities;
    }

    public boolean hasWrite() {
        return this.capabilities.hasWrite();
    }

    public boolean hasInsert() {
        return this.capabilities.hasInsert();
    }

    public boolean hasUpdate() {
        return this.capabilities.hasUpdate();
    }

    public boolean hasDelete() {
        return this.capabilities.hasDelete();
    }

    public boolean hasScan() {
        return this.capabilities.hasScan();
    }

    public boolean hasBulkload() {
        return this.capabilities.hasBulkload();
    }
}
