package com.platform.clusterchaos.core;

import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * {@link Sleeper} backed by {@link Thread#sleep(long)}.
 */
@Component
public class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    }
}
