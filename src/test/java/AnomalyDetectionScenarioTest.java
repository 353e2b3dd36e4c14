import com.xizhooou.anomaly.AnomalyTrackerRegistry;
import com.xizhooou.anomaly.alert.AlertConfig;
import com.xizhooou.anomaly.alert.AnomalyTracker;
import com.xizhooou.anomaly.config.AnomalyDetectionConfig;
import com.xizhooou.anomaly.config.CountMetricConfig;
import com.xizhooou.anomaly.dimension.DimensionKey;
import com.xizhooou.anomaly.dimension.FieldValue;
import com.xizhooou.anomaly.window.BucketTimeUnit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wakelock-acquire count metric sliced by the first attribution uid, five minute buckets.
 */
class AnomalyDetectionScenarioTest {

    private static final long METRIC_ID = 123456;
    private static final long ALERT_ID = 1;
    private static final long REFRACTORY_SECS = 10;
    private static final long NS_PER_SEC = 1_000_000_000L;

    private static final long BUCKET_START_NS = 10_000_000_000L;
    private static final long BUCKET_SIZE_NS = BucketTimeUnit.FIVE_MINUTES.toBucketSizeNs();

    private static final DimensionKey KEY_1 = DimensionKey.of(new FieldValue("attribution_uid", 111));
    private static final DimensionKey KEY_2 = DimensionKey.of(new FieldValue("attribution_uid", 222));

    private static AnomalyTrackerRegistry newRegistry(int numBuckets, int threshold) {
        AnomalyDetectionConfig config = new AnomalyDetectionConfig(
                List.of(new CountMetricConfig(METRIC_ID, BucketTimeUnit.FIVE_MINUTES)),
                List.of(new AlertConfig(ALERT_ID, METRIC_ID, numBuckets, REFRACTORY_SECS, threshold)));
        return new AnomalyTrackerRegistry(config, BUCKET_START_NS);
    }

    private static long refractoryEnd(long eventTimeNs) {
        return REFRACTORY_SECS + eventTimeNs / NS_PER_SEC + 1;
    }

    @Test
    void slicedCountMetric_singleBucket() {
        AnomalyTrackerRegistry registry = newRegistry(1, 3);
        assertEquals(1, registry.getAllTrackers().size());
        AnomalyTracker tracker = registry.getTrackersForMetric(METRIC_ID).get(0);

        // (event time, key) pairs as produced by the metric matcher
        long[][] warmUp = {{2, 111}, {2, 222}, {3, 111}, {3, 222}, {4, 111}, {4, 222}};
        for (long[] e : warmUp) {
            DimensionKey key = e[1] == 111 ? KEY_1 : KEY_2;
            assertTrue(registry.onMatchedEvent(METRIC_ID, key, BUCKET_START_NS + e[0]).isEmpty());
            assertEquals(0, tracker.getRefractoryPeriodEndsSec(key));
        }

        // sum reaches 4 > 3
        assertEquals(List.of(ALERT_ID), registry.onMatchedEvent(METRIC_ID, KEY_1, BUCKET_START_NS + 5));
        assertEquals(refractoryEnd(BUCKET_START_NS), tracker.getRefractoryPeriodEndsSec(KEY_1));
        assertEquals(21, tracker.getRefractoryPeriodEndsSec(KEY_1));

        registry.onMatchedEvent(METRIC_ID, KEY_1, BUCKET_START_NS + 100);
        assertEquals(refractoryEnd(BUCKET_START_NS), tracker.getRefractoryPeriodEndsSec(KEY_1));

        // last nanosecond of bucket 0, refractory period already over
        long lastNsOfBucket0 = BUCKET_START_NS + BUCKET_SIZE_NS - 1;
        assertEquals(List.of(ALERT_ID), registry.onMatchedEvent(METRIC_ID, KEY_1, lastNsOfBucket0));
        assertEquals(refractoryEnd(lastNsOfBucket0), tracker.getRefractoryPeriodEndsSec(KEY_1));

        // bucket 1 evicts bucket 0
        registry.onMatchedEvent(METRIC_ID, KEY_1, BUCKET_START_NS + BUCKET_SIZE_NS + 1);
        assertEquals(refractoryEnd(lastNsOfBucket0), tracker.getRefractoryPeriodEndsSec(KEY_1));
        assertEquals(1, tracker.getSumOverWindow(KEY_1));

        for (long offset = 1; offset <= 3; offset++) {
            assertTrue(registry.onMatchedEvent(METRIC_ID, KEY_2, BUCKET_START_NS + BUCKET_SIZE_NS + offset).isEmpty());
            assertEquals(0, tracker.getRefractoryPeriodEndsSec(KEY_2));
        }
        long fireTime = BUCKET_START_NS + BUCKET_SIZE_NS + 4;
        assertEquals(List.of(ALERT_ID), registry.onMatchedEvent(METRIC_ID, KEY_2, fireTime));
        assertEquals(refractoryEnd(fireTime), tracker.getRefractoryPeriodEndsSec(KEY_2));
    }

    @Test
    void slicedCountMetric_multipleBuckets() {
        AnomalyTrackerRegistry registry = newRegistry(3, 3);
        AnomalyTracker tracker = registry.getTracker(ALERT_ID).orElseThrow();

        registry.onMatchedEvent(METRIC_ID, KEY_1, BUCKET_START_NS + 2);
        assertEquals(0, tracker.getRefractoryPeriodEndsSec(KEY_1));
        registry.onMatchedEvent(METRIC_ID, KEY_1, BUCKET_START_NS + 3);
        assertEquals(0, tracker.getRefractoryPeriodEndsSec(KEY_1));
        // sum is exactly 3
        registry.onMatchedEvent(METRIC_ID, KEY_1, BUCKET_START_NS + 4);
        assertEquals(0, tracker.getRefractoryPeriodEndsSec(KEY_1));

        long firstFire = BUCKET_START_NS + BUCKET_SIZE_NS + 1;
        assertEquals(List.of(ALERT_ID), registry.onMatchedEvent(METRIC_ID, KEY_1, firstFire));
        assertEquals(refractoryEnd(firstFire), tracker.getRefractoryPeriodEndsSec(KEY_1));

        registry.onMatchedEvent(METRIC_ID, KEY_1, BUCKET_START_NS + BUCKET_SIZE_NS + 2);
        assertEquals(refractoryEnd(firstFire), tracker.getRefractoryPeriodEndsSec(KEY_1));

        // bucket 3: window [1, 3] holds 2 + 1
        registry.onMatchedEvent(METRIC_ID, KEY_1, BUCKET_START_NS + 3 * BUCKET_SIZE_NS + 1);
        assertEquals(refractoryEnd(firstFire), tracker.getRefractoryPeriodEndsSec(KEY_1));
        assertEquals(3, tracker.getSumOverWindow(KEY_1));

        long secondFire = BUCKET_START_NS + 3 * BUCKET_SIZE_NS + 2;
        assertEquals(List.of(ALERT_ID), registry.onMatchedEvent(METRIC_ID, KEY_1, secondFire));
        assertEquals(refractoryEnd(secondFire), tracker.getRefractoryPeriodEndsSec(KEY_1));
    }
}
