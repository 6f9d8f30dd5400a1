package com.adinsight.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Campaign {

    private String id;
    private String name;

    // Optional; the caller's industry is used when absent
    private Industry industry;
}
