package com.example.roofpanel.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoofFacetTest {

    private static RoofFacet facet(double pitch, double azimuth) {
        return RoofFacet.builder().id("roof_0").pitchDegrees(pitch).azimuthDegrees(azimuth).build();
    }

    @Test
    void orientationLabel_eastOfNorth() {
        RoofFacet south = facet(30, 180);
        assertEquals(CompassDirection.SOUTH, south.getOrientation());
        assertEquals("South (180° E of N)", south.getOrientationLabel());
    }

    @Test
    void orientationLabel_westOfNorth() {
        assertEquals("West (90° W of N)", facet(25, 270).getOrientationLabel());
        assertEquals("Northwest (45° W of N)", facet(25, 315).getOrientationLabel());
    }

    @Test
    void horizontalFacetHasNoOrientation() {
        RoofFacet flat = facet(3, 180);
        assertTrue(flat.isHorizontal());
        assertNull(flat.getOrientation());
        assertEquals("Horizontal", flat.getOrientationLabel());
    }

    @Test
    void compassSectors() {
        assertEquals(CompassDirection.NORTH, CompassDirection.fromAzimuth(350));
        assertEquals(CompassDirection.NORTH, CompassDirection.fromAzimuth(22));
        assertEquals(CompassDirection.NORTHEAST, CompassDirection.fromAzimuth(23));
        assertEquals(CompassDirection.EAST, CompassDirection.fromAzimuth(-270));
    }

    @Test
    void layoutDirection() {
        assertEquals(LayoutDirection.HORIZONTAL, facet(30, 180).getLayoutDirection());
        assertEquals(LayoutDirection.HORIZONTAL, facet(30, 0).getLayoutDirection());
        assertEquals(LayoutDirection.VERTICAL, facet(30, 90).getLayoutDirection());
        assertEquals(LayoutDirection.VERTICAL, facet(30, 45).getLayoutDirection());
        // 수평 지붕은 방위각 구간으로 판단
        assertEquals(LayoutDirection.VERTICAL, facet(0, 100).getLayoutDirection());
        assertEquals(LayoutDirection.HORIZONTAL, facet(0, 20).getLayoutDirection());
    }

    @Test
    void medianSunshine() {
        List<Double> quantiles = new ArrayList<>(Collections.nCopies(11, 800.0));
        quantiles.set(5, 1200.0);
        RoofFacet facet = facet(30, 180).toBuilder().sunshineQuantiles(quantiles).build();

        assertEquals(1200.0, facet.getMedianSunshineHours());
        assertNull(facet(30, 180).getMedianSunshineHours());
    }

    @Test
    void builderDefaults() {
        RoofFacet facet = facet(30, 180);
        assertEquals(0.5, facet.getSuitability(), 1e-9);
        assertFalse(facet.hasValidPolygon());
        assertTrue(facet.getCorners().isEmpty());
    }
}
