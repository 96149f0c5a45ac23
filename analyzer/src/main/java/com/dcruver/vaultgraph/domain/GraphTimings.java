package com.dcruver.vaultgraph.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rough wall-clock durations of the analysis phases. Diagnostic only.
 */
@Value
@Builder
public class GraphTimings {
    @Builder.Default
    Duration loadEntries = Duration.ZERO;
    @Builder.Default
    Duration buildGraph = Duration.ZERO;
    @Builder.Default
    Duration hits = Duration.ZERO;
    @Builder.Default
    Duration labelPropagation = Duration.ZERO;
    @Builder.Default
    Duration recency = Duration.ZERO;
    @Builder.Default
    Duration total = Duration.ZERO;

    /**
     * Timings in milliseconds keyed for JSON output.
     * Any phase that took time at all reports at least 1 ms.
     */
    public Map<String, Long> toMillis() {
        Map<String, Long> millis = new LinkedHashMap<>();
        millis.put("loadEntriesMs", toMillis(loadEntries));
        millis.put("buildGraphMs", toMillis(buildGraph));
        millis.put("hitsMs", toMillis(hits));
        millis.put("labelPropMs", toMillis(labelPropagation));
        millis.put("recencyMs", toMillis(recency));
        millis.put("totalMs", toMillis(total));
        return millis;
    }

    static long toMillis(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return 0;
        }
        long ms = duration.toMillis();
        return ms == 0 ? 1 : ms;
    }
}
