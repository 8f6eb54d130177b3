package com.platform.clusterchaos.model;

/**
 * {@code <matched> of <total>} as reported by an exist run.
 */
public record ExistTally(long matched, long total) {

    public boolean isComplete() {
        return matched == total;
    }

    @Override
    public String toString() {
        return matched + " of " + total;
    }
}
