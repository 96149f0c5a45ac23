package com.dcruver.vaultgraph.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphTimingsTest {

    @Test
    void anyElapsedTimeReportsAtLeastOneMillisecond() {
        assertEquals(1, GraphTimings.toMillis(Duration.ofNanos(1500)));
        assertEquals(0, GraphTimings.toMillis(Duration.ZERO));
        assertEquals(0, GraphTimings.toMillis(null));
        assertEquals(42, GraphTimings.toMillis(Duration.ofMillis(42)));
    }

    @Test
    void keysFollowPhaseOrder() {
        Map<String, Long> millis = GraphTimings.builder()
            .hits(Duration.ofMillis(3))
            .build()
            .toMillis();

        assertEquals(List.of("loadEntriesMs", "buildGraphMs", "hitsMs", "labelPropMs", "recencyMs", "totalMs"),
            List.copyOf(millis.keySet()));
        assertEquals(3L, millis.get("hitsMs"));
        assertEquals(0L, millis.get("totalMs"));
    }
}
