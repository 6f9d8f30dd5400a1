package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Signals that sharpen root-cause analysis for one anomaly.
 */
@Value
@Builder
public class AnalysisContext {

    LocalDate currentDate;
    Industry industry;
    TrendDirection historicalPattern;

    @Singular
    List<CampaignChange> recentChanges;

    boolean competitorActivity;
    boolean technicalIssues;

    /**
     * Rejects malformed context before it reaches the analyzer.
     *
     * @throws IllegalArgumentException when the date is missing or a change is incomplete
     */
    public void validate() {
        if (currentDate == null) {
            throw new IllegalArgumentException("Analysis context requires a current date");
        }
        for (CampaignChange change : recentChanges) {
            if (change == null) {
                throw new IllegalArgumentException("Recent changes must not contain null entries");
            }
            if (change.getType() == null || change.getChangedAt() == null) {
                throw new IllegalArgumentException("Campaign change requires a type and a change date: " + change);
            }
            if (change.getDescription() == null || change.getDescription().isBlank()) {
                throw new IllegalArgumentException("Campaign change of type " + change.getType() + " has no description");
            }
            if (change.getChangedAt().isAfter(currentDate)) {
                throw new IllegalArgumentException("Campaign change dated " + change.getChangedAt()
                        + " is after the analysis date " + currentDate);
            }
        }
    }
}
