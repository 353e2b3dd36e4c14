package com.xizhooou.anomaly.alert;

import com.xizhooou.anomaly.InvalidAlertConfigException;
import com.xizhooou.anomaly.dimension.DimensionKey;
import com.xizhooou.anomaly.window.SlidingWindowAggregator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 单个 alert 的异常检测
 * 每个匹配事件都会进入滑动窗口；窗口和严格大于阈值且该维度不在冷却期时报警，
 * 冷却期截止秒 = eventTimeNs / 1e9 + refractoryPeriodSecs + 1
 * <p>
 * Refractory expiry is only ever compared against the timestamps of incoming events; no timer
 * runs. All state-touching methods share the tracker's monitor.
 */
@Slf4j
public class AnomalyTracker {

    private static final long NS_PER_SEC = TimeUnit.SECONDS.toNanos(1);

    @Getter
    private final long alertId;
    @Getter
    private final long metricId;
    @Getter
    private final double threshold;
    @Getter
    private final long refractoryPeriodSecs;

    private final SlidingWindowAggregator aggregator;

    // dimension -> 冷却期截止秒，缺省即 0
    private final Map<DimensionKey, Long> refractoryEndsSec = new HashMap<>();

    private final List<AlertSink> sinks = new CopyOnWriteArrayList<>();

    private final AtomicLong anomaliesDeclared = new AtomicLong(0);
    private final AtomicLong suppressedEvaluations = new AtomicLong(0);

    public AnomalyTracker(AlertConfig config, long baseBucketStartNs, long bucketSizeNs) {
        Objects.requireNonNull(config, "config").validate();
        if (bucketSizeNs <= 0) {
            throw new InvalidAlertConfigException("alert " + config.id() + ": bucketSizeNs must be > 0");
        }
        this.alertId = config.id();
        this.metricId = config.metricId();
        this.threshold = config.triggerIfSumGt();
        this.refractoryPeriodSecs = config.refractoryPeriodSecs();
        this.aggregator = new SlidingWindowAggregator(baseBucketStartNs, bucketSizeNs, config.numBuckets());
    }

    public void addSubscription(AlertSink sink) {
        sinks.add(Objects.requireNonNull(sink, "sink"));
    }

    /**
     * Counts one matched event and decides whether the alert fires for {@code key}.
     *
     * @return true if an alert was declared for this event
     */
    public synchronized boolean evaluate(DimensionKey key, long eventTimeNs) {
        Objects.requireNonNull(key, "key");
        // 冷却期内历史照常累加
        long sum = aggregator.addEvent(key, eventTimeNs);

        if (isInRefractoryPeriod(key, eventTimeNs)) {
            suppressedEvaluations.incrementAndGet();
            log.debug("alert {} suppressed for {} until {}s", alertId, key, refractoryEndsSec.get(key));
            return false;
        }
        if (sum <= threshold) {
            return false;
        }
        declareAnomaly(key, eventTimeNs, sum);
        return true;
    }

    private boolean isInRefractoryPeriod(DimensionKey key, long eventTimeNs) {
        long endsSec = refractoryEndsSec.getOrDefault(key, 0L);
        return endsSec > 0 && eventTimeNs / NS_PER_SEC < endsSec;
    }

    private void declareAnomaly(DimensionKey key, long eventTimeNs, long sum) {
        long endsSec = eventTimeNs / NS_PER_SEC + refractoryPeriodSecs + 1;
        refractoryEndsSec.merge(key, endsSec, Long::max);
        anomaliesDeclared.incrementAndGet();
        log.info("alert {} fired for {} (sum={} > {}), refractory until {}s",
                alertId, key, sum, threshold, refractoryEndsSec.get(key));

        AnomalyAlert alert = new AnomalyAlert(alertId, metricId, key, eventTimeNs, sum, threshold);
        for (AlertSink sink : sinks) {
            try {
                sink.onAlert(alert);
            } catch (RuntimeException e) {
                log.warn("alert sink {} failed for alert {}", sink.getClass().getSimpleName(), alertId, e);
            }
        }
    }

    /**
     * @return the second at which the refractory period of {@code key} ends, 0 if it never fired
     */
    public synchronized long getRefractoryPeriodEndsSec(DimensionKey key) {
        return refractoryEndsSec.getOrDefault(key, 0L);
    }

    public synchronized long getSumOverWindow(DimensionKey key) {
        return aggregator.getSumOverWindow(key);
    }

    public synchronized long getBucketValue(DimensionKey key, long bucketIndex) {
        return aggregator.getBucketValue(key, bucketIndex);
    }

    public synchronized int trackedKeyCount() {
        return aggregator.trackedKeyCount();
    }

    public int getNumBuckets() {
        return aggregator.getNumBuckets();
    }

    public long getBucketSizeNs() {
        return aggregator.getBucketSizeNs();
    }

    public long getAnomaliesDeclared() {
        return anomaliesDeclared.get();
    }

    public long getSuppressedEvaluations() {
        return suppressedEvaluations.get();
    }

    public long getDroppedEvents() {
        return aggregator.getDroppedEvents();
    }

    /**
     * Forgets keys whose window is empty as of {@code nowNs} and whose refractory period has
     * ended by then.
     *
     * @return number of keys whose bucket history was removed
     */
    public synchronized int compact(long nowNs) {
        int removed = aggregator.pruneInactiveKeys(nowNs);
        long nowSec = nowNs / NS_PER_SEC;
        refractoryEndsSec.entrySet().removeIf(e -> e.getValue() <= nowSec && !aggregator.hasState(e.getKey()));
        if (removed > 0) {
            log.debug("alert {} compacted {} idle keys", alertId, removed);
        }
        return removed;
    }

    /**
     * Drops all bucket history. Refractory periods survive.
     */
    public synchronized void resetStorage() {
        aggregator.resetStorage();
    }
}
