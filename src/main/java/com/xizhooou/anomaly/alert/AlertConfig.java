package com.xizhooou.anomaly.alert;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.xizhooou.anomaly.InvalidAlertConfigException;

/**
 * @param id                   alert id
 * @param metricId             提供计数的 count metric
 * @param numBuckets           窗口宽度（桶数）
 * @param refractoryPeriodSecs 报警后的冷却秒数
 * @param triggerIfSumGt       窗口和严格大于该值时报警
 */
public record AlertConfig(@JsonProperty("id") long id,
                          @JsonProperty("metric_id") Long metricId,
                          @JsonProperty("num_buckets") int numBuckets,
                          @JsonProperty("refractory_period_secs") long refractoryPeriodSecs,
                          @JsonProperty("trigger_if_sum_gt") double triggerIfSumGt) {

    // uint32 上限，保证 eventTimeNs / 1e9 + period + 1 不溢出
    public static final long MAX_REFRACTORY_PERIOD_SECS = 0xFFFFFFFFL;

    public void validate() {
        if (metricId == null) {
            throw new InvalidAlertConfigException("alert " + id + ": metric_id is required");
        }
        if (numBuckets <= 0) {
            throw new InvalidAlertConfigException("alert " + id + ": num_buckets must be > 0, got " + numBuckets);
        }
        if (refractoryPeriodSecs <= 0 || refractoryPeriodSecs > MAX_REFRACTORY_PERIOD_SECS) {
            throw new InvalidAlertConfigException("alert " + id + ": refractory_period_secs must be in (0, "
                    + MAX_REFRACTORY_PERIOD_SECS + "], got " + refractoryPeriodSecs);
        }
        if (Double.isNaN(triggerIfSumGt)) {
            throw new InvalidAlertConfigException("alert " + id + ": trigger_if_sum_gt must be a number");
        }
    }
}
