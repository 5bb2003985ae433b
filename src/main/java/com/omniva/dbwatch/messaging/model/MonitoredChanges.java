package com.omniva.dbwatch.messaging.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Immutable bitmask of {@link ChangeType} values.
 * <p>
 * Used both as the set of changes a watch session is interested in and as the
 * set of changes reported for a table in a single event.
 */
public final class MonitoredChanges {

    public static final MonitoredChanges NONE = new MonitoredChanges(0);
    public static final MonitoredChanges ALL = of(ChangeType.INSERT, ChangeType.UPDATE, ChangeType.DELETE);

    private static final int VALID_BITS = 0x7;

    private final int mask;

    private MonitoredChanges(int mask) {
        this.mask = mask;
    }

    public static MonitoredChanges of(ChangeType... types) {
        return of(Arrays.asList(types));
    }

    public static MonitoredChanges of(Collection<ChangeType> types) {
        int mask = 0;
        for (ChangeType type : types) {
            mask |= type.getFlag();
        }
        return fromMask(mask);
    }

    public static MonitoredChanges fromMask(int mask) {
        int masked = mask & VALID_BITS;
        return masked == 0 ? NONE : new MonitoredChanges(masked);
    }

    public int getMask() {
        return mask;
    }

    public boolean contains(ChangeType type) {
        return (mask & type.getFlag()) == type.getFlag();
    }

    public MonitoredChanges with(ChangeType type) {
        return fromMask(mask | type.getFlag());
    }

    public MonitoredChanges with(MonitoredChanges other) {
        return fromMask(mask | other.mask);
    }

    public boolean isEmpty() {
        return mask == 0;
    }

    public Set<ChangeType> toSet() {
        Set<ChangeType> types = EnumSet.noneOf(ChangeType.class);
        for (ChangeType type : ChangeType.values()) {
            if (contains(type)) {
                types.add(type);
            }
        }
        return types;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MonitoredChanges other)) return false;
        return mask == other.mask;
    }

    @Override
    public int hashCode() {
        return mask;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "NONE";
        }
        StringJoiner joiner = new StringJoiner("|");
        toSet().forEach(type -> joiner.add(type.name()));
        return joiner.toString();
    }
}
