package com.gridcalc.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Engine and collaboration settings bound from application.properties.
 *
 * Example:
 *
 * gridcalc.range.max-cells=100000
 * gridcalc.pivot.auto-refresh=true
 * gridcalc.collaboration.heartbeat-timeout=30s
 * gridcalc.collaboration.sweep-interval-ms=15000
 * gridcalc.collaboration.max-pending-events=500
 * gridcalc.collaboration.websocket-base-url=ws://localhost:8080
 */
@Component
@ConfigurationProperties(prefix = "gridcalc")
public class GridCalcProperties {

    private Range range = new Range();
    private Pivot pivot = new Pivot();
    private Collaboration collaboration = new Collaboration();

    public Range getRange() {
        return range;
    }

    public void setRange(Range range) {
        this.range = range;
    }

    public Pivot getPivot() {
        return pivot;
    }

    public void setPivot(Pivot pivot) {
        this.pivot = pivot;
    }

    public Collaboration getCollaboration() {
        return collaboration;
    }

    public void setCollaboration(Collaboration collaboration) {
        this.collaboration = collaboration;
    }

    public static class Range {
        /**
         * Largest grid a single range read may return.
         */
        private long maxCells = 100_000;

        public long getMaxCells() {
            return maxCells;
        }

        public void setMaxCells(long maxCells) {
            this.maxCells = maxCells;
        }
    }

    public static class Pivot {
        /**
         * Refresh pivots automatically when an edit touches their source range.
         */
        private boolean autoRefresh = true;

        public boolean isAutoRefresh() {
            return autoRefresh;
        }

        public void setAutoRefresh(boolean autoRefresh) {
            this.autoRefresh = autoRefresh;
        }
    }

    public static class Collaboration {
        /**
         * Participants silent for longer than this are evicted.
         */
        private Duration heartbeatTimeout = Duration.ofSeconds(30);

        private long sweepIntervalMs = 15_000;

        /**
         * Per-participant event queue bound; the oldest event is dropped when full.
         */
        private int maxPendingEvents = 500;

        private String websocketBaseUrl = "ws://localhost:8080";

        public Duration getHeartbeatTimeout() {
            return heartbeatTimeout;
        }

        public void setHeartbeatTimeout(Duration heartbeatTimeout) {
            this.heartbeatTimeout = heartbeatTimeout;
        }

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
        }

        public int getMaxPendingEvents() {
            return maxPendingEvents;
        }

        public void setMaxPendingEvents(int maxPendingEvents) {
            this.maxPendingEvents = maxPendingEvents;
        }

        public String getWebsocketBaseUrl() {
            return websocketBaseUrl;
        }

        public void setWebsocketBaseUrl(String websocketBaseUrl) {
            this.websocketBaseUrl = websocketBaseUrl;
        }
    }
}
