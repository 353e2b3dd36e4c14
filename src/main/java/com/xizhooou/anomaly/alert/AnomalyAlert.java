package com.xizhooou.anomaly.alert;

import com.xizhooou.anomaly.dimension.DimensionKey;

/**
 * A declared anomaly, handed to every {@link AlertSink} subscribed to the tracker.
 */
public record AnomalyAlert(long alertId,
                           long metricId,
                           DimensionKey dimensionKey,
                           long firedAtNs,
                           long windowedSum,
                           double threshold) {
}
