package com.adinsight.anomaly.port;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EmailMessage {
    String to;
    String subject;
    String html;
}
