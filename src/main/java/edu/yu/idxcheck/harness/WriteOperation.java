package edu.yu.idxcheck.harness;

import java.util.EnumSet;
import java.util.Set;

import edu.yu.idxcheck.index.Capability;

/**
 * The mutation a composite scenario applies after (or alongside) its setup.
 */
public enum WriteOperation {

    NONE(null), WRITE(Capability.WRITE), INSERT(Capability.INSERT), UPDATE(Capability.UPDATE),
    DELETE(Capability.DELETE);

    private final Capability requires;

    WriteOperation(Capability requires) {
        this.requires = requires;
    }

    /**
     * @return the capabilities the index needs to run this operation
     */
    public Set<Capability> requiredCapabilities() {
        return this.requires == null ? EnumSet.noneOf(Capability.class) : EnumSet.of(this.requires);
    }
}
