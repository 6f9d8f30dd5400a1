package com.adinsight.anomaly.service;

import com.adinsight.anomaly.config.ScheduleConfig;
import com.adinsight.anomaly.model.AlertRecipient;
import com.adinsight.anomaly.port.AlertRecipientDirectory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Recipients listed under {@code anomaly.schedule.recipients}.
 */
@Component
public class ConfiguredRecipientDirectory implements AlertRecipientDirectory {

    private final ScheduleConfig config;

    public ConfiguredRecipientDirectory(ScheduleConfig config) {
        this.config = config;
    }

    @Override
    public List<AlertRecipient> recipients() {
        return List.copyOf(config.getRecipients());
    }
}
