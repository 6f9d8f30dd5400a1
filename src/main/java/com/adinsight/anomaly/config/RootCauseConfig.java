package com.adinsight.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly.root-cause")
public class RootCauseConfig {

    // Changes older than this, relative to the analysis date, are ignored
    private int recentChangeLookbackDays = 3;

    private int maxTopCauses = 3;
    private int maxNextSteps = 5;

    // Causes below this probability are dropped
    private double minProbability = 0.1;
    private double probabilityCap = 0.95;

    private double marketCauseProbability = 0.8;
    private double recentChangeProbability = 0.75;
}
