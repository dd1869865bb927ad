package com.gt.srs.conf;

import com.gt.srs.scheduling.SchedulingParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class BeanConfig {

    private static final Logger log = LoggerFactory.getLogger(BeanConfig.class);

    @Bean
    public Clock getClock() {
        return Clock.systemUTC();
    }

    @Bean
    public SchedulingParameters getSchedulingParameters(@Value("${srs.scheduling.againMultiplier}") double againMultiplier,
                                                        @Value("${srs.scheduling.hardMultiplier}") double hardMultiplier,
                                                        @Value("${srs.scheduling.goodMultiplier}") double goodMultiplier,
                                                        @Value("${srs.scheduling.easyMultiplier}") double easyMultiplier,
                                                        @Value("${srs.scheduling.stabilityFloor}") double stabilityFloor,
                                                        @Value("${srs.scheduling.maximumStabilityDays}") double maximumStabilityDays,
                                                        @Value("${srs.scheduling.initialStability}") double initialStability,
                                                        @Value("${srs.scheduling.defaultDifficulty}") double defaultDifficulty,
                                                        @Value("${srs.scheduling.difficultyIncrease}") double difficultyIncrease,
                                                        @Value("${srs.scheduling.difficultyDecrease}") double difficultyDecrease,
                                                        @Value("${srs.scheduling.masteryThresholdDays}") double masteryThresholdDays) {
        SchedulingParameters parameters = new SchedulingParameters(againMultiplier, hardMultiplier, goodMultiplier, easyMultiplier,
                stabilityFloor, maximumStabilityDays, initialStability, defaultDifficulty, difficultyIncrease, difficultyDecrease,
                masteryThresholdDays);

        log.info("Using scheduling parameters {}", parameters);

        return parameters;
    }
}
