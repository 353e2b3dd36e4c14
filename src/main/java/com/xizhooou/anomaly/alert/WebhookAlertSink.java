package com.xizhooou.anomaly.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 通过机器人 webhook 发送文本告警 ({"msgtype":"text","text":{"content":...}})
 * 发送在单独的 daemon 线程上异步进行，不阻塞事件处理
 */
@Slf4j
public class WebhookAlertSink implements AlertSink {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final ExecutorService SENDER = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "anomaly-alert-sender");
        t.setDaemon(true);
        return t;
    });

    private final HttpClient client = HttpClient.newHttpClient();
    private final URI webhookUri;
    private final int maxMessageChars;

    public WebhookAlertSink(String webhookUrl, int maxMessageChars) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            throw new IllegalArgumentException("webhookUrl must not be blank");
        }
        this.webhookUri = URI.create(webhookUrl.trim());
        this.maxMessageChars = Math.max(200, maxMessageChars);
    }

    public WebhookAlertSink(String webhookUrl) {
        this(webhookUrl, 1800);
    }

    @Override
    public void onAlert(AnomalyAlert alert) {
        publishAsync(alert);
    }

    /**
     * @return completes once the webhook answered or the attempt failed; never completes exceptionally
     */
    public CompletableFuture<Void> publishAsync(AnomalyAlert alert) {
        return CompletableFuture.runAsync(() -> send(alert), SENDER)
                .exceptionally(ex -> {
                    log.warn("failed to publish alert {} to {}", alert.alertId(), webhookUri, ex);
                    return null;
                });
    }

    private void send(AnomalyAlert alert) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(webhookUri)
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(buildPayload(alert), StandardCharsets.UTF_8))
                .build();
        try {
            HttpResponse<Void> resp = client.send(req, HttpResponse.BodyHandlers.discarding());
            if (resp.statusCode() >= 300) {
                log.warn("webhook {} answered {} for alert {}", webhookUri, resp.statusCode(), alert.alertId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while publishing alert " + alert.alertId(), e);
        } catch (IOException e) {
            throw new IllegalStateException("webhook call failed for alert " + alert.alertId(), e);
        }
    }

    String buildPayload(AnomalyAlert alert) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("msgtype", "text");
        root.putObject("text").put("content", buildMessage(alert));
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize alert " + alert.alertId(), e);
        }
    }

    private String buildMessage(AnomalyAlert alert) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("【异常告警】\n");
        sb.append("alert=").append(alert.alertId())
                .append(", metric=").append(alert.metricId()).append('\n');
        sb.append("dimension=").append(alert.dimensionKey()).append('\n');
        sb.append("sum=").append(alert.windowedSum())
                .append(", threshold=").append(alert.threshold()).append('\n');
        sb.append("firedAtNs=").append(alert.firedAtNs()).append('\n');

        String text = sb.toString();
        if (text.length() > maxMessageChars) {
            text = text.substring(0, maxMessageChars) + "\n...truncated...";
        }
        return text;
    }
}
