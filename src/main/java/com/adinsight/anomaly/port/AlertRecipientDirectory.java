package com.adinsight.anomaly.port;

import com.adinsight.anomaly.model.AlertRecipient;

import java.util.List;

/**
 * Users whose campaigns are evaluated on the schedule.
 */
public interface AlertRecipientDirectory {

    List<AlertRecipient> recipients();
}
