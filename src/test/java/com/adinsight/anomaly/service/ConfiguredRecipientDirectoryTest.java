package com.adinsight.anomaly.service;

import com.adinsight.anomaly.config.ScheduleConfig;
import com.adinsight.anomaly.model.AlertRecipient;
import com.adinsight.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfiguredRecipientDirectoryTest {

    @Test
    void recipients_returnsConfiguredUsersAsSnapshot() {
        ScheduleConfig config = new ScheduleConfig();
        AlertRecipient recipient = TestDataFactory.createRecipient("user-1");
        config.getRecipients().add(recipient);
        ConfiguredRecipientDirectory directory = new ConfiguredRecipientDirectory(config);

        assertThat(directory.recipients()).containsExactly(recipient);
        assertThatThrownBy(() -> directory.recipients().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void recipients_noneConfigured_returnsEmpty() {
        assertThat(new ConfiguredRecipientDirectory(new ScheduleConfig()).recipients()).isEmpty();
    }
}
