package com.platform.clusterchaos.model;

/**
 * Flag the driver receives the first key index under for put and get.
 * Exist always takes {@link #FIRST}.
 */
public enum RangeFlag {
    FIRST("-f"),
    START("-s");

    private final String flag;

    RangeFlag(String flag) {
        this.flag = flag;
    }

    public String flag() {
        return flag;
    }
}
