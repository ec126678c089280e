package com.kingpin.pins;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot produced by one load pass.
 * <p>
 * {@code pins} are in file order, then in-file order; {@code lists} has one entry per attempted file in input
 * order, including files that yielded no pins. A reload builds a new snapshot instead of changing this one.
 */
public record PinCollection(List<Pin> pins, List<PinList> lists, List<LoadWarning> warnings, long version, Instant loadedAt) {
    public PinCollection {
        pins = List.copyOf(pins);
        lists = List.copyOf(lists);
        warnings = List.copyOf(warnings);
    }

    public static PinCollection empty() {
        return new PinCollection(List.of(), List.of(), List.of(), 0, Instant.EPOCH);
    }

    /**
     * @return a copy of this snapshot carrying the given version
     */
    public PinCollection withVersion(long newVersion) {
        return new PinCollection(pins, lists, warnings, newVersion, loadedAt);
    }

    /**
     * @return true when the load produced no pins at all
     */
    public boolean isEmpty() {
        return pins.isEmpty();
    }
}
