package com.platform.clusterchaos.core;

/**
 * How a bounded polling loop ended.
 *
 * @param ready      the probe reported ready before attempts ran out
 * @param attempts   probes issued, never more than the policy allows
 * @param lastReason reason given by the last retryable probe, null when ready on the first try
 */
public record PollResult(boolean ready, int attempts, String lastReason) {
}
