package com.xizhooou.anomaly.window;

import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 单个维度的分桶计数
 * - counts: bucketIndex -> count，只保留窗口 [watermark - numBuckets + 1, watermark] 内的桶
 * - sum: 保留桶的计数之和
 * - watermark: 见过的最大 bucketIndex
 * <p>
 * Not thread-safe; the owning aggregator serializes access.
 */
public class BucketStore {
    private final int numBuckets;
    private final NavigableMap<Long, Long> counts = new TreeMap<>();
    private long sum;
    private long watermark;

    BucketStore(int numBuckets, long firstBucketIndex) {
        this.numBuckets = numBuckets;
        this.watermark = firstBucketIndex;
        counts.put(firstBucketIndex, 1L);
        this.sum = 1;
    }

    /**
     * Counts one event in {@code bucketIndex}.
     *
     * @return false if the event is older than the retained window and was dropped
     */
    boolean add(long bucketIndex) {
        if (bucketIndex < watermark) {
            if (bucketIndex < windowFloor(watermark)) {
                return false;
            }
            increment(bucketIndex);
            return true;
        }
        evictBefore(windowFloor(bucketIndex));
        watermark = bucketIndex;
        increment(bucketIndex);
        return true;
    }

    /**
     * True once every retained bucket has left the window ending at {@code currentBucketIndex}.
     */
    boolean isExpiredAt(long currentBucketIndex) {
        return watermark < windowFloor(currentBucketIndex);
    }

    private void increment(long bucketIndex) {
        counts.merge(bucketIndex, 1L, Long::sum);
        sum++;
    }

    private void evictBefore(long floor) {
        NavigableMap<Long, Long> expired = counts.headMap(floor, false);
        for (long c : expired.values()) {
            sum -= c;
        }
        expired.clear();
    }

    private long windowFloor(long lastIndex) {
        return lastIndex - numBuckets + 1;
    }

    public long getSum() {
        return sum;
    }

    public long getWatermark() {
        return watermark;
    }

    public long getCount(long bucketIndex) {
        return counts.getOrDefault(bucketIndex, 0L);
    }
}
