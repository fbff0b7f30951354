package edu.yu.idxcheck.index;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * An immutable set of {@link Capability} traits describing what an index
 * implementation supports.
 */
public final class Capabilities {

    private static final Capabilities ALL = new Capabilities(EnumSet.allOf(Capability.class));

    private final Set<Capability> supported;

    private Capabilities(EnumSet<Capability> supported) {
        this.supported = Collections.unmodifiableSet(supported);
    }

    public static Capabilities all() {
        return ALL;
    }

    public static Capabilities none() {
        return new Capabilities(EnumSet.noneOf(Capability.class));
    }

    public static Capabilities of(Capability... capabilities) {
        EnumSet<Capability> set = EnumSet.noneOf(Capability.class);
        set.addAll(Arrays.asList(capabilities));
        return new Capabilities(set);
    }

    public static Capabilities allExcept(Capability... capabilities) {
        EnumSet<Capability> set = EnumSet.allOf(Capability.class);
        set.removeAll(Arrays.asList(capabilities));
        return new Capabilities(set);
    }

    public boolean has(Capability capability) {
        return this.supported.contains(capability);
    }

    public boolean hasWrite() {
        return has(Capability.WRITE);
    }

    public boolean hasInsert() {
        return has(Capability.INSERT);
    }

    public boolean hasUpdate() {
        return has(Capability.UPDATE);
    }

    public boolean hasDelete() {
        return has(Capability.DELETE);
    }

    public boolean hasScan() {
        return has(Capability.SCAN);
    }

    public boolean hasBulkload() {
        return has(Capability.BULKLOAD);
    }

    /**
     * @param required
     * @return the required capabilities that are not supported, possibly empty
     */
    public Set<Capability> missing(Collection<Capability> required) {
        EnumSet<Capability> missing = EnumSet.noneOf(Capability.class);
        for (Capability capability : required) {
            if (!has(capability)) {
                missing.add(capability);
            }
        }
        return missing;
    }

    public Set<Capability> asSet() {
        return this.supported;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || !(o instanceof Capabilities)) {
            return false;
        }
        return this.supported.equals(((Capabilities) o).supported);
    }

    @Override
    public int hashCode() {
        return this.supported.hashCode();
    }

    @Override
    public String toString() {
        return "Capabilities: " + this.supported;
    }
}
