package com.adinsight.anomaly.config;

import com.adinsight.anomaly.model.AnomalySeverity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly.alert")
public class AlertConfig {

    private boolean emailEnabled = true;

    // CRITICAL only, WARNING and above, or everything with INFO
    private AnomalySeverity minimumSeverity = AnomalySeverity.WARNING;

    private int maxAlertsPerCampaignPerDay = 5;

    // Same campaign and metric is not alerted twice within this window
    private int deduplicationWindowHours = 24;

    private int sendTimeoutSeconds = 10;

    // Threads available for email sends
    private int sendPoolSize = 2;

    // Link target in the email; omitted when blank
    private String dashboardUrl = "";

    private String subjectPrefix = "[Campaign Alert]";
}
