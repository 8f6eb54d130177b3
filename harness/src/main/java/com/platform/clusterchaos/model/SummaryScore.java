package com.platform.clusterchaos.model;

/**
 * {@code Final summary: <passed>/<total>} as reported by the operation tester.
 */
public record SummaryScore(long passed, long total) {

    public boolean isComplete() {
        return passed == total;
    }

    @Override
    public String toString() {
        return passed + "/" + total;
    }
}
