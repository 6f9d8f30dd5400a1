package com.adinsight.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CampaignAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(CampaignAnomalyApplication.class, args);
    }
}
