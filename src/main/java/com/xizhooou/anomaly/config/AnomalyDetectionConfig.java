package com.xizhooou.anomaly.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.xizhooou.anomaly.alert.AlertConfig;

import java.util.List;

public record AnomalyDetectionConfig(@JsonProperty("count_metrics") List<CountMetricConfig> countMetrics,
                                     @JsonProperty("alerts") List<AlertConfig> alerts) {
    public AnomalyDetectionConfig {
        countMetrics = (countMetrics == null) ? List.of() : List.copyOf(countMetrics);
        alerts = (alerts == null) ? List.of() : List.copyOf(alerts);
    }
}
