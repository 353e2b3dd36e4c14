package com.xizhooou.anomaly.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.xizhooou.anomaly.window.BucketTimeUnit;

/**
 * @param id     metric id, referenced by {@code metric_id} of alerts
 * @param bucket 桶大小，缺省 FIVE_MINUTES
 */
public record CountMetricConfig(@JsonProperty("id") long id,
                                @JsonProperty("bucket") BucketTimeUnit bucket) {
    public CountMetricConfig {
        bucket = (bucket == null) ? BucketTimeUnit.FIVE_MINUTES : bucket;
    }
}
