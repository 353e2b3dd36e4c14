package com.xizhooou.anomaly;

import com.xizhooou.anomaly.alert.AlertConfig;
import com.xizhooou.anomaly.alert.AlertSink;
import com.xizhooou.anomaly.alert.AnomalyTracker;
import com.xizhooou.anomaly.config.AnomalyDetectionConfig;
import com.xizhooou.anomaly.config.CountMetricConfig;
import com.xizhooou.anomaly.dimension.DimensionKey;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Routes matched count-metric events to the trackers of the alerts defined on that metric.
 * Trackers of one metric are updated one after another, in configuration order.
 */
@Slf4j
public class AnomalyTrackerRegistry {

    private final Map<Long, AnomalyTracker> trackersByAlert = new LinkedHashMap<>();
    private final Map<Long, List<AnomalyTracker>> trackersByMetric = new HashMap<>();

    public AnomalyTrackerRegistry(AnomalyDetectionConfig config, long baseBucketStartNs, List<AlertSink> sinks) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(sinks, "sinks");

        Map<Long, CountMetricConfig> metrics = new HashMap<>();
        for (CountMetricConfig metric : config.countMetrics()) {
            if (metrics.putIfAbsent(metric.id(), metric) != null) {
                throw new InvalidAlertConfigException("duplicate count metric id " + metric.id());
            }
        }

        for (AlertConfig alert : config.alerts()) {
            alert.validate();
            CountMetricConfig metric = metrics.get(alert.metricId());
            if (metric == null) {
                throw new InvalidAlertConfigException(
                        "alert " + alert.id() + " refers to unknown metric " + alert.metricId());
            }
            if (trackersByAlert.containsKey(alert.id())) {
                throw new InvalidAlertConfigException("duplicate alert id " + alert.id());
            }

            AnomalyTrackerBuilder builder = AnomalyTrackerBuilder.newBuilder()
                    .alertConfig(alert)
                    .bucket(metric.bucket())
                    .baseBucketStartNs(baseBucketStartNs);
            sinks.forEach(builder::subscribe);
            AnomalyTracker tracker = builder.build();

            trackersByAlert.put(alert.id(), tracker);
            trackersByMetric.computeIfAbsent(alert.metricId(), k -> new ArrayList<>()).add(tracker);
        }
        log.info("anomaly registry ready: {} metrics, {} alerts", metrics.size(), trackersByAlert.size());
    }

    public AnomalyTrackerRegistry(AnomalyDetectionConfig config, long baseBucketStartNs) {
        this(config, baseBucketStartNs, List.of());
    }

    /**
     * Feeds one matched event to every tracker attached to {@code metricId}.
     *
     * @return ids of the alerts that fired for this event, empty if none
     */
    public List<Long> onMatchedEvent(long metricId, DimensionKey key, long eventTimeNs) {
        List<AnomalyTracker> trackers = trackersByMetric.get(metricId);
        if (trackers == null) {
            log.debug("no alert attached to metric {}", metricId);
            return List.of();
        }
        List<Long> fired = null;
        for (AnomalyTracker tracker : trackers) {
            if (tracker.evaluate(key, eventTimeNs)) {
                if (fired == null) {
                    fired = new ArrayList<>(1);
                }
                fired.add(tracker.getAlertId());
            }
        }
        return fired == null ? List.of() : fired;
    }

    public Optional<AnomalyTracker> getTracker(long alertId) {
        return Optional.ofNullable(trackersByAlert.get(alertId));
    }

    public List<AnomalyTracker> getTrackersForMetric(long metricId) {
        return Collections.unmodifiableList(trackersByMetric.getOrDefault(metricId, List.of()));
    }

    public Collection<AnomalyTracker> getAllTrackers() {
        return Collections.unmodifiableCollection(trackersByAlert.values());
    }

    /**
     * Compacts every tracker against {@code nowNs}.
     *
     * @return total number of dimension keys removed
     */
    public int compact(long nowNs) {
        int removed = 0;
        for (AnomalyTracker tracker : trackersByAlert.values()) {
            removed += tracker.compact(nowNs);
        }
        return removed;
    }
}
