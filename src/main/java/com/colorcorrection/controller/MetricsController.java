package com.colorcorrection.controller;

import com.colorcorrection.config.AppMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * REST endpoint for application metrics summary.
 * Provides a single endpoint with all key metrics.
 *
 * GET /api/metrics/summary
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final AppMetrics appMetrics;

    /**
     * Get all metrics in a single response.
     */
    @GetMapping("/summary")
    public Map<String, Object> getMetricsSummary() {
        Map<String, Object> response = new LinkedHashMap<>();

        response.put("timestamp", Instant.now().toString());
        response.put("batches", getBatchMetrics());
        response.put("items", getItemMetrics());
        response.put("timing", getTimingMetrics());

        return response;
    }

    @GetMapping("/batches")
    public Map<String, Object> getBatchMetrics() {
        Map<String, Object> batches = new LinkedHashMap<>();
        batches.put("submitted", (long) appMetrics.getBatchesSubmittedCounter().count());
        batches.put("rejected", (long) appMetrics.getBatchesRejectedCounter().count());
        return batches;
    }

    /**
     * Item counts across batches and apply-to-others runs.
     */
    @GetMapping("/items")
    public Map<String, Object> getItemMetrics() {
        Map<String, Object> items = new LinkedHashMap<>();

        double completed = appMetrics.getItemsCompletedCounter().count();
        double failed = appMetrics.getItemsFailedCounter().count();
        double total = completed + failed;

        items.put("completed", (long) completed);
        items.put("failed", (long) failed);
        items.put("timeouts", (long) appMetrics.getItemTimeoutsCounter().count());
        items.put("exported", (long) appMetrics.getImagesExportedCounter().count());

        if (total > 0) {
            items.put("successRate", String.format("%.2f%%", (completed / total) * 100));
        } else {
            items.put("successRate", "N/A");
        }

        return items;
    }

    @GetMapping("/timing")
    public Map<String, Object> getTimingMetrics() {
        Map<String, Object> timing = new LinkedHashMap<>();

        timing.put("itemProcessing", getTimerStats(appMetrics.getItemProcessingTimer()));
        timing.put("batchTotal", getTimerStats(appMetrics.getBatchTotalTimer()));
        timing.put("inference", getTimerStats(appMetrics.getInferenceTimer()));
        timing.put("export", getTimerStats(appMetrics.getExportTimer()));

        return timing;
    }

    /**
     * Extract stats from a Timer.
     */
    private Map<String, Object> getTimerStats(Timer timer) {
        Map<String, Object> stats = new LinkedHashMap<>();

        long count = timer.count();
        stats.put("count", count);

        if (count > 0) {
            stats.put("totalTimeMs", String.format("%.2f", timer.totalTime(TimeUnit.MILLISECONDS)));
            stats.put("avgTimeMs", String.format("%.2f", timer.mean(TimeUnit.MILLISECONDS)));
            stats.put("maxTimeMs", String.format("%.2f", timer.max(TimeUnit.MILLISECONDS)));
        } else {
            stats.put("totalTimeMs", "0.00");
            stats.put("avgTimeMs", "N/A");
            stats.put("maxTimeMs", "N/A");
        }

        return stats;
    }
}
