package com.adinsight.anomaly.service;

import com.adinsight.anomaly.port.EmailMessage;
import com.adinsight.anomaly.port.EmailPort;
import com.adinsight.anomaly.port.EmailSendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default {@link EmailPort} that writes alerts to the log instead of a mail provider.
 */
@Component
public class LoggingEmailSender implements EmailPort {

    private static final Logger log = LoggerFactory.getLogger(LoggingEmailSender.class);

    @Override
    public EmailSendResult send(EmailMessage message) {
        log.info("Alert email to={}, subject={}, bodyLength={}",
                message.getTo(), message.getSubject(), message.getHtml().length());
        return EmailSendResult.ok();
    }
}
