package com.platform.clusterchaos.workload;

import com.platform.clusterchaos.Fixtures;
import com.platform.clusterchaos.model.ExistTally;
import com.platform.clusterchaos.model.SummaryScore;
import com.platform.clusterchaos.model.Workload;
import com.platform.clusterchaos.model.WorkloadOperation;
import com.platform.clusterchaos.model.WorkloadResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DriverOutputParserTest {

    @Test
    void zeroErrorPutPasses() {
        String output = "put 100 records\n"
            + "elapsed: 1.2s, rps: 83, total err: 0\n";

        WorkloadResult result = DriverOutputParser.parse(workload(WorkloadOperation.PUT, 100), output);

        assertThat(result.passed()).isTrue();
        assertThat(result.zeroErrorMarker()).isTrue();
        assertThat(result.errorCount()).isZero();
    }

    @Test
    void lastRunningTotalWins() {
        String output = "total err: 0\ntotal err: 0\ntotal err: 7\n";

        WorkloadResult result = DriverOutputParser.parse(workload(WorkloadOperation.GET, 100), output);

        assertThat(result.errorCount()).isEqualTo(7L);
        assertThat(result.passed()).isFalse();
    }

    @Test
    void panicFailsEvenWithZeroErrors() {
        String output = "total err: 0\nthread 'main' panicked at 'connection reset'\n";

        WorkloadResult result = DriverOutputParser.parse(workload(WorkloadOperation.PUT, 100), output);

        assertThat(result.panicked()).isTrue();
        assertThat(result.passed()).isFalse();
    }

    @Test
    void missingMarkerFails() {
        WorkloadResult result = DriverOutputParser.parse(workload(WorkloadOperation.PUT, 100), "");

        assertThat(result.passed()).isFalse();
        assertThat(result.errorCount()).isNull();
    }

    @Test
    void errorTotalBeyondLongRangeFails() {
        String output = "total err: 0\ntotal err: 99999999999999999999\n";

        WorkloadResult result = DriverOutputParser.parse(workload(WorkloadOperation.GET, 100), output);

        assertThat(result.errorCount()).isEqualTo(Long.MAX_VALUE);
        assertThat(result.passed()).isFalse();
    }

    @Test
    void existTallyBeyondLongRangeIsNotCaptured() {
        assertThat(DriverOutputParser.findExistTally("12345678901234567890 of 9 keys present")).isEmpty();
        assertThat(DriverOutputParser.findSummary("Final summary: 1/99999999999999999999")).isEmpty();
    }

    @Test
    void existTallyToleratesLineBreaks() {
        assertThat(DriverOutputParser.findExistTally("exist done\n9\n  of \t9 keys present"))
            .contains(new ExistTally(9, 9));
    }

    @Test
    void firstTallyIsTaken() {
        assertThat(DriverOutputParser.findExistTally("9 of 19 keys present\n3 of 3 batches"))
            .contains(new ExistTally(9, 19));
    }

    @Test
    void absentTallyIsEmpty() {
        assertThat(DriverOutputParser.findExistTally("connection refused")).isEmpty();

        WorkloadResult result = DriverOutputParser.parse(workload(WorkloadOperation.EXIST, 9), "connection refused");
        assertThat(result.existTally()).isEmpty();
        assertThat(result.passed()).isFalse();
    }

    @Test
    void readsOperationTesterSummary() {
        assertThat(DriverOutputParser.findSummary("ok ...\nFinal summary: 98/100\n"))
            .contains(new SummaryScore(98, 100));
        assertThat(DriverOutputParser.findSummary("no summary here")).isEmpty();
    }

    private static Workload workload(WorkloadOperation operation, long count) {
        return Workload.template(Fixtures.load(count, null, null), "127.0.0.1")
            .operation(operation)
            .count(count)
            .port(20000)
            .build();
    }
}
