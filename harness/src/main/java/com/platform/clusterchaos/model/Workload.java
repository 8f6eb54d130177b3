package com.platform.clusterchaos.model;

import com.platform.clusterchaos.config.HarnessProperties;
import com.platform.clusterchaos.error.ValidationException;
import lombok.Builder;

/**
 * Immutable description of one workload driver invocation.
 */
@Builder(toBuilder = true)
public record Workload(
    WorkloadOperation operation,
    long first,
    long count,
    int payloadBytes,
    int keySize,
    int threads,
    KeyMode mode,
    RangeFlag rangeFlag,
    String host,
    int port,
    String user,
    String password
) {

    public Workload {
        if (operation == null) {
            throw new ValidationException("operation", null, "operation is required");
        }
        if (!isSupportedKeySize(keySize)) {
            throw new ValidationException("keySize", keySize, "key size must be 8 or 16");
        }
        if (count < 0 || first < 0) {
            throw new ValidationException("count", count, "key range cannot be negative");
        }
        if (rangeFlag == null) {
            rangeFlag = RangeFlag.FIRST;
        }
        if (mode == null) {
            mode = KeyMode.NORMAL;
        }
    }

    /**
     * Builder pre-filled with the run-wide load settings; callers set operation,
     * range and target port.
     */
    public static WorkloadBuilder template(HarnessProperties.Load load, String host) {
        return Workload.builder()
            .payloadBytes(load.payload())
            .keySize(load.keySize())
            .threads(load.threads())
            .mode(load.mode())
            .rangeFlag(load.rangeFlag())
            .host(host)
            .user(load.user())
            .password(load.password());
    }

    /**
     * The generator only accepts 8- or 16-byte keys.
     */
    public static boolean isSupportedKeySize(int keySize) {
        return keySize == 8 || keySize == 16;
    }

    public boolean hasCredentials() {
        return user != null && !user.isBlank();
    }

    @Override
    public String toString() {
        return String.format("%s[first=%d, count=%d, port=%d]", operation.behaviour(), first, count, port);
    }
}
