package com.platform.clusterchaos;

import com.platform.clusterchaos.config.HarnessProperties;
import com.platform.clusterchaos.config.HarnessProperties.Scenario;
import com.platform.clusterchaos.model.KeyMode;
import com.platform.clusterchaos.model.RangeFlag;

import java.time.Duration;

/**
 * Harness settings for unit tests: ports 20000+/8000+ on localhost, short backoff, no settle delays.
 */
public final class Fixtures {

    public static final int TRANSPORT_MIN_PORT = 20000;
    public static final int REST_MIN_PORT = 8000;

    private Fixtures() {
    }

    public static HarnessProperties properties(int nodesAmount, long count) {
        return properties(nodesAmount, count, false);
    }

    public static HarnessProperties properties(int nodesAmount, long count, boolean doubledExist) {
        return new HarnessProperties(
            Scenario.ALIENS,
            new HarnessProperties.Cluster(nodesAmount, TRANSPORT_MIN_PORT, REST_MIN_PORT,
                "127.0.0.1", "127.0.0.1", null, null),
            load(count, null, null),
            new HarnessProperties.Health(3, Duration.ofSeconds(1), 1.75, Duration.ofSeconds(15),
                Duration.ofSeconds(1), Duration.ofSeconds(1)),
            new HarnessProperties.Driver("./bobp", null),
            new HarnessProperties.Timing(Duration.ofSeconds(10), Duration.ofMillis(5000)),
            new HarnessProperties.DoubledExist(doubledExist, null),
            new HarnessProperties.OperationTest("./bobt", 100000, 0, 10000)
        );
    }

    public static HarnessProperties.Load load(long count, String user, String password) {
        return new HarnessProperties.Load(count, 4096, 0, 1, KeyMode.NORMAL, 8, RangeFlag.FIRST, user, password);
    }

    public static HarnessProperties withLoad(HarnessProperties properties, HarnessProperties.Load load) {
        return new HarnessProperties(properties.scenario(), properties.cluster(), load, properties.health(),
            properties.driver(), properties.timing(), properties.doubledExist(), properties.operationTest());
    }
}
