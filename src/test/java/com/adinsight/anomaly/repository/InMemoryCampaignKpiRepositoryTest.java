package com.adinsight.anomaly.repository;

import com.adinsight.anomaly.model.Campaign;
import com.adinsight.anomaly.model.DateRange;
import com.adinsight.anomaly.model.KpiSnapshot;
import com.adinsight.anomaly.model.MetricName;
import com.adinsight.anomaly.model.MetricPoint;
import com.adinsight.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCampaignKpiRepositoryTest {

    private static final LocalDate TODAY = TestDataFactory.TODAY;

    private InMemoryCampaignKpiRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryCampaignKpiRepository();
    }

    @Test
    void activeCampaigns_returnsOnlyTheUsersCampaigns() {
        Campaign c1 = TestDataFactory.createCampaign("c1");
        Campaign c2 = TestDataFactory.createCampaign("c2");
        repository.saveCampaign("user-1", c1);
        repository.saveCampaign("user-1", c1);
        repository.saveCampaign("user-2", c2);

        assertThat(repository.activeCampaigns("user-1")).containsExactly(c1);
        assertThat(repository.activeCampaigns("nobody")).isEmpty();
        assertThat(repository.findById("c2")).contains(c2);
        assertThat(repository.findById("missing")).isEmpty();
    }

    @Test
    void seriesFor_returnsInclusiveRangeInDateOrder() {
        for (int i = 5; i >= 0; i--) {
            repository.saveSnapshot(TestDataFactory.createSnapshot("c1", TODAY.minusDays(i), 100 + i, 10));
        }

        List<MetricPoint> points = repository.seriesFor("c1", MetricName.SPEND,
                new DateRange(TODAY.minusDays(3), TODAY.minusDays(1)));

        assertThat(points).extracting(MetricPoint::getDate)
                .containsExactly(TODAY.minusDays(3), TODAY.minusDays(2), TODAY.minusDays(1));
        assertThat(points).extracting(MetricPoint::getValue).containsExactly(103.0, 102.0, 101.0);
    }

    @Test
    void seriesFor_derivesRatioMetrics() {
        repository.saveSnapshot(TestDataFactory.createSnapshot("c1", TODAY, 500, 5));

        List<MetricPoint> cpa = repository.seriesFor("c1", MetricName.CPA, new DateRange(TODAY, TODAY));

        assertThat(cpa).extracting(MetricPoint::getValue).containsExactly(100.0);
    }

    @Test
    void latestTwo_returnsPreviousThenLatest() {
        KpiSnapshot older = TestDataFactory.createSnapshot("c1", TODAY.minusDays(2), 90, 9);
        KpiSnapshot previous = TestDataFactory.createSnapshot("c1", TODAY.minusDays(1), 100, 10);
        KpiSnapshot latest = TestDataFactory.createSnapshot("c1", TODAY, 150, 12);
        repository.saveSnapshot(latest);
        repository.saveSnapshot(older);
        repository.saveSnapshot(previous);

        assertThat(repository.latestTwo("c1")).containsExactly(previous, latest);
    }

    @Test
    void saveSnapshot_sameDate_replacesEarlierSnapshot() {
        repository.saveSnapshot(TestDataFactory.createSnapshot("c1", TODAY, 100, 10));
        KpiSnapshot corrected = TestDataFactory.createSnapshot("c1", TODAY, 120, 10);
        repository.saveSnapshot(corrected);

        assertThat(repository.latestTwo("c1")).containsExactly(corrected);
    }

    @Test
    void unknownCampaign_returnsEmptyData() {
        assertThat(repository.latestTwo("missing")).isEmpty();
        assertThat(repository.seriesFor("missing", MetricName.CTR, new DateRange(TODAY, TODAY))).isEmpty();
    }
}
