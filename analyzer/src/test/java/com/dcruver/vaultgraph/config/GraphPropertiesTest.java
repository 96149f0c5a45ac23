package com.dcruver.vaultgraph.config;

import com.dcruver.vaultgraph.domain.GraphOptions;
import com.dcruver.vaultgraph.domain.Toggle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GraphPropertiesTest {

    @Test
    void defaultsMatchOptionDefaults() {
        assertEquals(GraphOptions.defaults(), new GraphProperties().toOptions());
    }

    @Test
    void nestedSettingsReachTheOptions() {
        GraphProperties properties = new GraphProperties();
        properties.getHits().setMaxIterations(7);
        properties.getRecency().setHopOffsetDays(3);
        properties.getCommunity().setTopTags(2);
        properties.setRecencyCascade(true);
        properties.setIncludeSingletonCommunities(false);

        GraphOptions options = properties.toOptions();

        assertEquals(7, options.getHitsMaxIterations());
        assertEquals(3, options.getRecencyHopOffsetDays());
        assertEquals(2, options.getTopTagsLimit());
        assertEquals(Toggle.ENABLED, options.getRecencyCascade());
        assertFalse(options.isIncludeSingletonCommunities());
    }
}
