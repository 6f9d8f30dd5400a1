package com.adinsight.anomaly.port;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EmailSendResult {

    boolean success;
    String error;

    public static EmailSendResult ok() {
        return new EmailSendResult(true, null);
    }

    public static EmailSendResult failed(String error) {
        return new EmailSendResult(false, error);
    }
}
