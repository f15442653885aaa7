package com.rolefit.matcher.rank;

import org.HdrHistogram.Histogram;

/**
 * Per-candidate scoring latency and outcome counts for one ranking run.
 */
public class RankingMetrics {

    private final Histogram latencyHistogram;
    private int scored;
    private int skipped;

    public RankingMetrics() {
        // 1 microsecond to 10 minutes, 3 significant digits
        this.latencyHistogram = new Histogram(1, 600_000_000L, 3);
    }

    public void recordLatency(long latencyMicros) {
        latencyHistogram.recordValue(Math.max(1L, Math.min(latencyMicros, latencyHistogram.getHighestTrackableValue())));
        scored++;
    }

    public void recordSkipped() {
        skipped++;
    }

    public int getScored() {
        return scored;
    }

    public int getSkipped() {
        return skipped;
    }

    // Latency metrics in milliseconds
    public double getAvgLatencyMs() {
        return scored > 0 ? latencyHistogram.getMean() / 1000.0 : 0.0;
    }

    public double getMaxLatencyMs() {
        return scored > 0 ? latencyHistogram.getMaxValue() / 1000.0 : 0.0;
    }

    public double getP50LatencyMs() {
        return scored > 0 ? latencyHistogram.getValueAtPercentile(50.0) / 1000.0 : 0.0;
    }

    public double getP95LatencyMs() {
        return scored > 0 ? latencyHistogram.getValueAtPercentile(95.0) / 1000.0 : 0.0;
    }

    @Override
    public String toString() {
        return String.format("RankingMetrics{scored=%d, skipped=%d, avgLatency=%.2fms, p95=%.2fms}",
            scored, skipped, getAvgLatencyMs(), getP95LatencyMs());
    }
}
