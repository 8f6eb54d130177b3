package com.platform.clusterchaos.error;

/**
 * The control thread was interrupted while blocked in a sleep or a subprocess wait.
 */
public class HarnessInterruptedException extends HarnessException {

    public HarnessInterruptedException(String during, InterruptedException cause) {
        super(ErrorCode.INTERRUPTED, "Interrupted while " + during, cause);
    }
}
