package com.xizhooou.anomaly.alert;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingAlertSink implements AlertSink {

    @Override
    public void onAlert(AnomalyAlert alert) {
        log.warn("anomaly alert={} metric={} key={} sum={} threshold={} firedAtNs={}",
                alert.alertId(), alert.metricId(), alert.dimensionKey(),
                alert.windowedSum(), alert.threshold(), alert.firedAtNs());
    }
}
