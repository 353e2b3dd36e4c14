package com.xizhooou.anomaly.window;

import java.util.concurrent.TimeUnit;

/**
 * 指标桶大小对照表
 */
public enum BucketTimeUnit {
    ONE_MINUTE(TimeUnit.MINUTES.toMillis(1)),
    FIVE_MINUTES(TimeUnit.MINUTES.toMillis(5)),
    TEN_MINUTES(TimeUnit.MINUTES.toMillis(10)),
    THIRTY_MINUTES(TimeUnit.MINUTES.toMillis(30)),
    ONE_HOUR(TimeUnit.HOURS.toMillis(1)),
    THREE_HOURS(TimeUnit.HOURS.toMillis(3)),
    SIX_HOURS(TimeUnit.HOURS.toMillis(6)),
    TWELVE_HOURS(TimeUnit.HOURS.toMillis(12)),
    ONE_DAY(TimeUnit.DAYS.toMillis(1)),
    ONE_WEEK(TimeUnit.DAYS.toMillis(7));

    private final long bucketSizeMillis;

    BucketTimeUnit(long bucketSizeMillis) {
        this.bucketSizeMillis = bucketSizeMillis;
    }

    public long toBucketSizeMillis() {
        return bucketSizeMillis;
    }

    public long toBucketSizeNs() {
        return TimeUnit.MILLISECONDS.toNanos(bucketSizeMillis);
    }
}
