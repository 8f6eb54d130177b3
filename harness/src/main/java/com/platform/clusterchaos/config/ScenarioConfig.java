package com.platform.clusterchaos.config;

import com.platform.clusterchaos.chaos.HarnessScenario;
import com.platform.clusterchaos.config.HarnessProperties.Scenario;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration for scenario lookup.
 */
@Configuration
public class ScenarioConfig {

    /**
     * Register all scenarios as a map keyed by the scenario they handle.
     */
    @Bean
    public Map<Scenario, HarnessScenario> scenariosMap(List<HarnessScenario> scenarios) {
        return scenarios.stream()
            .collect(Collectors.toMap(
                HarnessScenario::getScenario,
                Function.identity(),
                (first, second) -> {
                    throw new IllegalStateException("Two implementations for scenario " + first.getScenario());
                },
                () -> new EnumMap<>(Scenario.class)
            ));
    }
}
