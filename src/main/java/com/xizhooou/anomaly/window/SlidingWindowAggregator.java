package com.xizhooou.anomaly.window;

import com.xizhooou.anomaly.dimension.DimensionKey;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 按维度维护最近 numBuckets 个桶的计数和
 * bucketIndex = floor((eventTimeNs - baseBucketStartNs) / bucketSizeNs)，
 * 恰好落在桶边界的事件属于以该边界开始的桶
 * <p>
 * Not thread-safe; {@code AnomalyTracker} guards it.
 */
@Slf4j
public class SlidingWindowAggregator {

    @Getter
    private final long baseBucketStartNs;
    @Getter
    private final long bucketSizeNs;
    @Getter
    private final int numBuckets;

    private final Map<DimensionKey, BucketStore> stores = new HashMap<>();

    // 窗口外迟到事件数
    private final AtomicLong droppedEvents = new AtomicLong(0);

    public SlidingWindowAggregator(long baseBucketStartNs, long bucketSizeNs, int numBuckets) {
        if (bucketSizeNs <= 0) {
            throw new IllegalArgumentException("bucketSizeNs must be > 0");
        }
        if (numBuckets <= 0) {
            throw new IllegalArgumentException("numBuckets must be > 0");
        }
        this.baseBucketStartNs = baseBucketStartNs;
        this.bucketSizeNs = bucketSizeNs;
        this.numBuckets = numBuckets;
    }

    /**
     * @throws ArithmeticException if {@code eventTimeNs - baseBucketStartNs} does not fit in a long
     */
    public long bucketIndexOf(long eventTimeNs) {
        return Math.floorDiv(Math.subtractExact(eventTimeNs, baseBucketStartNs), bucketSizeNs);
    }

    /**
     * Counts one matched event for {@code key}.
     *
     * @return the windowed sum for {@code key} after the update; unchanged when the event is
     * older than the retained window, or too far from the base bucket to index, and therefore dropped
     */
    public long addEvent(DimensionKey key, long eventTimeNs) {
        Objects.requireNonNull(key, "key");
        long bucketIndex;
        try {
            bucketIndex = bucketIndexOf(eventTimeNs);
        } catch (ArithmeticException e) {
            // 时间戳与 base 相差超出 long 范围，无法分桶
            droppedEvents.incrementAndGet();
            log.warn("dropped event key={} at {}ns: outside the bucketable range of base {}ns",
                    key, eventTimeNs, baseBucketStartNs);
            return getSumOverWindow(key);
        }

        BucketStore store = stores.get(key);
        if (store == null) {
            store = new BucketStore(numBuckets, bucketIndex);
            stores.put(key, store);
            return store.getSum();
        }

        if (!store.add(bucketIndex)) {
            droppedEvents.incrementAndGet();
            log.debug("dropped late event key={} bucket={} watermark={}", key, bucketIndex, store.getWatermark());
        }
        return store.getSum();
    }

    public long getSumOverWindow(DimensionKey key) {
        BucketStore store = stores.get(key);
        return store == null ? 0 : store.getSum();
    }

    public long getBucketValue(DimensionKey key, long bucketIndex) {
        BucketStore store = stores.get(key);
        return store == null ? 0 : store.getCount(bucketIndex);
    }

    public boolean hasState(DimensionKey key) {
        return stores.containsKey(key);
    }

    public int trackedKeyCount() {
        return stores.size();
    }

    public long getDroppedEvents() {
        return droppedEvents.get();
    }

    /**
     * Drops the keys whose retained buckets have all left the window ending at the bucket of
     * {@code nowNs}.
     *
     * @return number of keys removed
     * @throws ArithmeticException if {@code nowNs} cannot be mapped to a bucket index
     */
    public int pruneInactiveKeys(long nowNs) {
        long currentBucketIndex = bucketIndexOf(nowNs);
        int removed = 0;
        Iterator<BucketStore> it = stores.values().iterator();
        while (it.hasNext()) {
            BucketStore store = it.next();
            if (store.isExpiredAt(currentBucketIndex)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public void resetStorage() {
        stores.clear();
    }
}
