package com.adinsight.anomaly.config;

import com.adinsight.anomaly.model.AlertRecipient;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly.schedule")
public class ScheduleConfig {

    private boolean enabled = true;

    // Daily at 08:00
    private String cron = "0 0 8 * * *";

    private String zone = "Asia/Seoul";

    // Deadline for one user's evaluation, detection and dispatch together
    private int userTimeoutMinutes = 10;

    private List<AlertRecipient> recipients = new ArrayList<>();
}
