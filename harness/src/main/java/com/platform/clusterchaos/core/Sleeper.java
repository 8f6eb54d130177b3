package com.platform.clusterchaos.core;

import java.time.Duration;

/**
 * Blocking pause on the control thread.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
