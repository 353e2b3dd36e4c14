package com.xizhooou.anomaly.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xizhooou.anomaly.InvalidAlertConfigException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@link AnomalyDetectionConfig} documents such as
 * <pre>
 * {
 *   "count_metrics": [{"id": 123456, "bucket": "FIVE_MINUTES"}],
 *   "alerts": [{"id": 1, "metric_id": 123456, "num_buckets": 1,
 *               "refractory_period_secs": 10, "trigger_if_sum_gt": 3}]
 * }
 * </pre>
 */
public final class AnomalyConfigLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private AnomalyConfigLoader() {
    }

    public static AnomalyDetectionConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        try {
            return MAPPER.readValue(in, AnomalyDetectionConfig.class);
        } catch (IOException e) {
            throw new InvalidAlertConfigException("cannot parse anomaly config: " + e.getMessage(), e);
        }
    }

    public static AnomalyDetectionConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new InvalidAlertConfigException("cannot read anomaly config " + path, e);
        }
    }

    public static AnomalyDetectionConfig loadResource(String resource) {
        InputStream in = AnomalyConfigLoader.class.getResourceAsStream(resource);
        if (in == null) {
            throw new InvalidAlertConfigException("anomaly config resource not found: " + resource);
        }
        try (in) {
            return load(in);
        } catch (IOException e) {
            throw new InvalidAlertConfigException("cannot close anomaly config resource " + resource, e);
        }
    }
}
