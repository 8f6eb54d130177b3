package com.platform.clusterchaos.model;

/**
 * Key-generation order used by the workload driver.
 */
public enum KeyMode {
    RANDOM,
    NORMAL;

    public String cliValue() {
        return name().toLowerCase();
    }
}
