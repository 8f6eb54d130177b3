package com.platform.clusterchaos.workload;

import com.platform.clusterchaos.model.ExistTally;
import com.platform.clusterchaos.model.SummaryScore;
import com.platform.clusterchaos.model.Workload;
import com.platform.clusterchaos.model.WorkloadResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed reading of the generators' text output. Nothing outside this package sees raw output
 * except for diagnostics.
 */
@Slf4j
public final class DriverOutputParser {

    static final String ZERO_ERRORS_MARKER = "total err: 0";
    static final String PANIC_MARKER = "panicked";

    private static final Pattern TOTAL_ERRORS = Pattern.compile("total err:\\s*(\\d+)");
    private static final Pattern EXIST_TALLY = Pattern.compile("\\b(\\d+)\\s+of\\s+(\\d+)\\b");
    private static final Pattern FINAL_SUMMARY = Pattern.compile("\\bFinal\\s+summary:\\s*(\\d+)/(\\d+)\\b");

    private DriverOutputParser() {
    }

    public static WorkloadResult parse(Workload workload, String output) {
        String text = output == null ? "" : output;
        boolean panicked = text.contains(PANIC_MARKER);

        if (workload.operation().reportsErrors()) {
            boolean zeroMarker = text.contains(ZERO_ERRORS_MARKER);
            OptionalLong lastErrors = lastErrorCount(text);
            Long errorCount = lastErrors.isPresent() ? lastErrors.getAsLong() : null;
            boolean passed = zeroMarker && !panicked && (errorCount == null || errorCount == 0);
            return new WorkloadResult(workload, text, errorCount, null, zeroMarker, panicked, passed);
        }

        ExistTally tally = findExistTally(text).orElse(null);
        boolean passed = tally != null && tally.isComplete() && !panicked;
        return new WorkloadResult(workload, text, null, tally, false, panicked, passed);
    }

    /**
     * Last {@code total err: <n>} in the output; the generator reports a running total.
     * A total too large for a long saturates at {@link Long#MAX_VALUE}.
     */
    public static OptionalLong lastErrorCount(String text) {
        Matcher matcher = TOTAL_ERRORS.matcher(text);
        Long last = null;
        while (matcher.find()) {
            Long value = toLong(matcher.group(1));
            last = value != null ? value : Long.MAX_VALUE;
        }
        return last == null ? OptionalLong.empty() : OptionalLong.of(last);
    }

    /**
     * First {@code <n> of <m>} in the output; whitespace between the tokens may include line breaks.
     * A tally with a number too large for a long counts as not captured.
     */
    public static Optional<ExistTally> findExistTally(String text) {
        Matcher matcher = EXIST_TALLY.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        Long matched = toLong(matcher.group(1));
        Long total = toLong(matcher.group(2));
        if (matched == null || total == null) {
            log.warn("Exist tally '{}' is out of range", matcher.group());
            return Optional.empty();
        }
        return Optional.of(new ExistTally(matched, total));
    }

    public static Optional<SummaryScore> findSummary(String text) {
        Matcher matcher = FINAL_SUMMARY.matcher(text == null ? "" : text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        Long passed = toLong(matcher.group(1));
        Long total = toLong(matcher.group(2));
        if (passed == null || total == null) {
            log.warn("Summary '{}' is out of range", matcher.group());
            return Optional.empty();
        }
        return Optional.of(new SummaryScore(passed, total));
    }

    private static Long toLong(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
