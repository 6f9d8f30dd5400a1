package com.adinsight.anomaly.engine.calendar;

import com.adinsight.anomaly.model.ExpectedChangeKey;
import lombok.Value;

/**
 * Expected change ranges for spend, conversions and CTR.
 */
@Value
public class ExpectedChange {

    public static final ExpectedChange NONE = new ExpectedChange(ChangeRange.ZERO, ChangeRange.ZERO, ChangeRange.ZERO);

    ChangeRange spend;
    ChangeRange conversion;
    ChangeRange ctr;

    public static ExpectedChange of(ChangeRange spend, ChangeRange conversion, ChangeRange ctr) {
        return new ExpectedChange(spend, conversion, ctr);
    }

    public ChangeRange get(ExpectedChangeKey key) {
        return switch (key) {
            case SPEND -> spend;
            case CONVERSION -> conversion;
            case CTR -> ctr;
        };
    }

    public ExpectedChange scale(double weight) {
        if (weight == 1.0) {
            return this;
        }
        return new ExpectedChange(spend.scale(weight), conversion.scale(weight), ctr.scale(weight));
    }

    public ExpectedChange union(ExpectedChange other) {
        return new ExpectedChange(spend.union(other.spend), conversion.union(other.conversion), ctr.union(other.ctr));
    }
}
