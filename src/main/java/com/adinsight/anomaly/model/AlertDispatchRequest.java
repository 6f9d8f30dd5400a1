package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AlertDispatchRequest {

    String userId;
    String userEmail;

    // Optional greeting name
    String userName;

    List<Anomaly> anomalies;

    /**
     * @throws IllegalArgumentException when the user, address or anomaly list is missing
     */
    public void validate() {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("Alert dispatch requires a userId");
        }
        if (userEmail == null || !userEmail.contains("@")) {
            throw new IllegalArgumentException("Alert dispatch for user " + userId + " has an invalid email: " + userEmail);
        }
        if (anomalies == null) {
            throw new IllegalArgumentException("Alert dispatch for user " + userId + " has no anomaly list");
        }
    }
}
