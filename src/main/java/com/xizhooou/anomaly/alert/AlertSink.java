package com.xizhooou.anomaly.alert;

/**
 * Receives fired alerts. Called from inside the tracker's exclusive section, so
 * implementations should hand slow work off to another thread.
 */
@FunctionalInterface
public interface AlertSink {

    void onAlert(AnomalyAlert alert);
}
