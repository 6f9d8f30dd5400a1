package com.adinsight.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;

@Value
@AllArgsConstructor(staticName = "of")
public class MetricPoint {
    LocalDate date;
    double value;
}
