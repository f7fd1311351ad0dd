package me.golemcore.virality.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoreCeilingTest {

    @Test
    void scale_roundsToNearestPoint() {
        assertEquals(78, ScoreCeiling.PERCENT.scale(0.783));
        assertEquals(250, ScoreCeiling.EXTENDED.scale(0.5));
        assertEquals(100, ScoreCeiling.PERCENT.scale(1.0));
    }

    @Test
    void scale_clampsOutOfRangeInput() {
        assertEquals(0, ScoreCeiling.PERCENT.scale(-0.3));
        assertEquals(500, ScoreCeiling.EXTENDED.scale(1.7));
        assertEquals(0, ScoreCeiling.EXTENDED.scale(Double.NaN));
    }

    @Test
    void normalize_mapsBackToUnitRange() {
        assertEquals(0.5, ScoreCeiling.EXTENDED.normalize(250), 1e-12);
        assertEquals(1.0, ScoreCeiling.PERCENT.normalize(140), 1e-12);
        assertEquals(0.0, ScoreCeiling.PERCENT.normalize(-5), 1e-12);
    }
}
