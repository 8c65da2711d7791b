package com.matcast.server.controller;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.matcast.server.dto.HubMetricsSnapshot;
import com.matcast.server.service.HubMetrics;
import com.matcast.server.socket.BrokerStatus;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.exporter.common.TextFormat;

/**
 * Hub health and metrics for load balancers and scrapers.
 *
 * Endpoints:
 *   GET /api/health   JSON: status, hub snapshot, JVM
 *   GET /api/metrics  Prometheus scrape of the registry (same as /actuator/prometheus)
 *
 * Both read in-memory counters only. No database or Redis calls.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    private static final Instant BOOT_TIME = Instant.now();
    private static final MediaType PROMETHEUS_TEXT = MediaType.parseMediaType(TextFormat.CONTENT_TYPE_004);

    private final HubMetrics metrics;
    private final PrometheusMeterRegistry prometheus;

    @Value("${spring.application.name:matcast}")
    private String appName;

    @Value("${INSTANCE_ID:single}")
    private String instanceId;

    public HealthController(HubMetrics metrics, PrometheusMeterRegistry prometheus) {
        this.metrics = metrics;
        this.prometheus = prometheus;
    }

    /**
     * Reports {@code DEGRADED} while the broker is not connected; local
     * fan-out keeps working in that case.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        HubMetricsSnapshot hub = metrics.snapshot();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", BrokerStatus.CONNECTED.name().equals(hub.brokerStatus()) ? "UP" : "DEGRADED");
        response.put("application", appName);
        response.put("instance", instanceId);
        response.put("timestamp", Instant.now().toString());

        Duration uptime = Duration.between(BOOT_TIME, Instant.now());
        response.put("uptime", formatDuration(uptime));
        response.put("uptimeSeconds", uptime.getSeconds());

        response.put("hub", hub);

        Runtime rt = Runtime.getRuntime();
        Map<String, Object> jvm = new LinkedHashMap<>();
        jvm.put("maxMemoryMB", rt.maxMemory() / (1024 * 1024));
        jvm.put("usedMemoryMB", (rt.totalMemory() - rt.freeMemory()) / (1024 * 1024));
        jvm.put("availableProcessors", rt.availableProcessors());
        jvm.put("jvmUptime", ManagementFactory.getRuntimeMXBean().getUptime());
        response.put("jvm", jvm);

        return ResponseEntity.ok(response);
    }

    @GetMapping("/metrics")
    public ResponseEntity<String> metrics() {
        return ResponseEntity.ok()
                .contentType(PROMETHEUS_TEXT)
                .body(prometheus.scrape());
    }

    private String formatDuration(Duration d) {
        return String.format("%dh %dm %ds", d.toHours(), d.toMinutesPart(), d.toSecondsPart());
    }
}
