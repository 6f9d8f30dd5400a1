package com.adinsight.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRecipient {

    private String userId;
    private String email;
    private String name;

    // Applied to campaigns without an industry of their own
    private Industry industry;
}
