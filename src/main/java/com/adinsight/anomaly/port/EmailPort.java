package com.adinsight.anomaly.port;

/**
 * Outbound email delivery. Retries, if any, belong to the implementation.
 */
public interface EmailPort {

    EmailSendResult send(EmailMessage message);
}
