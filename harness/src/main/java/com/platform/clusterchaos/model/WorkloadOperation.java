package com.platform.clusterchaos.model;

/**
 * Driver behaviour passed with {@code -b}.
 */
public enum WorkloadOperation {
    PUT,
    GET,
    EXIST;

    public String behaviour() {
        return name().toLowerCase();
    }

    /**
     * Put and get report an error total; exist reports a tally.
     */
    public boolean reportsErrors() {
        return this != EXIST;
    }
}
