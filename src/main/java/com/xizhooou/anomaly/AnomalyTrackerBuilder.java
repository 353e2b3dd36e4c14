package com.xizhooou.anomaly;

import com.xizhooou.anomaly.alert.AlertConfig;
import com.xizhooou.anomaly.alert.AlertSink;
import com.xizhooou.anomaly.alert.AnomalyTracker;
import com.xizhooou.anomaly.window.BucketTimeUnit;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Slf4j
public class AnomalyTrackerBuilder {

    private long alertId;
    private Long metricId;

    // 窗口大小（桶数）
    private int numBuckets = 1;
    // 冷却时间
    private long refractoryPeriodSecs = 60;
    // 报警阈值，严格大于才报警
    private double triggerIfSumGt;

    // 桶大小
    private long bucketSizeNs = BucketTimeUnit.FIVE_MINUTES.toBucketSizeNs();
    // 第 0 个桶的起始时间
    private long baseBucketStartNs;

    private final List<AlertSink> sinks = new ArrayList<>();

    private AnomalyTrackerBuilder() {}

    public static AnomalyTrackerBuilder newBuilder() { return new AnomalyTrackerBuilder(); }

    public AnomalyTrackerBuilder alertId(long id) {
        this.alertId = id;
        return this;
    }

    public AnomalyTrackerBuilder metricId(long id) {
        this.metricId = id;
        return this;
    }

    public AnomalyTrackerBuilder numBuckets(int n) {
        this.numBuckets = n;
        return this;
    }

    public AnomalyTrackerBuilder refractoryPeriodSecs(long s) {
        this.refractoryPeriodSecs = s;
        return this;
    }

    public AnomalyTrackerBuilder triggerIfSumGt(double threshold) {
        this.triggerIfSumGt = threshold;
        return this;
    }

    public AnomalyTrackerBuilder bucket(BucketTimeUnit unit) {
        this.bucketSizeNs = Objects.requireNonNull(unit, "bucket").toBucketSizeNs();
        return this;
    }

    public AnomalyTrackerBuilder bucketSizeNs(long ns) {
        this.bucketSizeNs = ns;
        return this;
    }

    public AnomalyTrackerBuilder baseBucketStartNs(long ns) {
        this.baseBucketStartNs = ns;
        return this;
    }

    public AnomalyTrackerBuilder alertConfig(AlertConfig config) {
        Objects.requireNonNull(config, "alertConfig");
        this.alertId = config.id();
        this.metricId = config.metricId();
        this.numBuckets = config.numBuckets();
        this.refractoryPeriodSecs = config.refractoryPeriodSecs();
        this.triggerIfSumGt = config.triggerIfSumGt();
        return this;
    }

    public AnomalyTrackerBuilder subscribe(AlertSink sink) {
        this.sinks.add(Objects.requireNonNull(sink, "sink"));
        return this;
    }

    public AnomalyTracker build() {
        AlertConfig config = new AlertConfig(alertId, metricId, numBuckets, refractoryPeriodSecs, triggerIfSumGt);
        validate(config);

        AnomalyTracker tracker = new AnomalyTracker(config, baseBucketStartNs, bucketSizeNs);
        sinks.forEach(tracker::addSubscription);

        log.info("created anomaly tracker alert={} metric={} buckets={}x{}ns threshold={} refractory={}s",
                alertId, metricId, numBuckets, bucketSizeNs, triggerIfSumGt, refractoryPeriodSecs);
        return tracker;
    }

    private void validate(AlertConfig config) {
        if (bucketSizeNs <= 0) {
            throw new InvalidAlertConfigException("alert " + alertId + ": bucketSizeNs must be > 0");
        }
        config.validate();
    }
}
