package com.example.roofpanel.util;

import com.example.roofpanel.model.PixelBoundingBox;
import com.example.roofpanel.model.PixelPoint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeometryUtilsTest {

    private final List<PixelPoint> square = GeometryUtils.rectangleToPolygon(0, 0, 10, 10);

    @Test
    void pointInPolygon_insideAndOutside() {
        assertTrue(GeometryUtils.pointInPolygon(5, 5, square));
        assertFalse(GeometryUtils.pointInPolygon(15, 5, square));
        assertFalse(GeometryUtils.pointInPolygon(-1, 5, square));
    }

    @Test
    void pointInPolygon_topLeftEdgesInsideBottomRightOutside() {
        assertTrue(GeometryUtils.pointInPolygon(PixelPoint.of(0, 0), square));
        assertTrue(GeometryUtils.pointInPolygon(PixelPoint.of(5, 0), square));
        assertFalse(GeometryUtils.pointInPolygon(PixelPoint.of(10, 5), square));
        assertFalse(GeometryUtils.pointInPolygon(PixelPoint.of(5, 10), square));
    }

    @Test
    void polygonBounds_minMax() {
        PixelBoundingBox bounds = GeometryUtils.polygonBounds(
                List.of(PixelPoint.of(1, 2), PixelPoint.of(5, 7), PixelPoint.of(3, 0)));

        assertEquals(new PixelBoundingBox(1, 0, 5, 7), bounds);
        assertEquals(4, bounds.getWidth());
        assertEquals(7, bounds.getHeight());
    }

    @Test
    void polygonBounds_ofRectangleIsTheRectangle() {
        int[][] rectangles = {{0, 0, 1, 1}, {2, 3, 4, 5}, {100, 100, 200, 100}, {7, 0, 38, 21}};
        for (int[] r : rectangles) {
            PixelBoundingBox bounds = GeometryUtils.polygonBounds(
                    GeometryUtils.rectangleToPolygon(r[0], r[1], r[2], r[3]));

            assertEquals(new PixelBoundingBox(r[0], r[1], r[0] + r[2], r[1] + r[3]), bounds);
        }
    }

    @Test
    void polygonBounds_emptyPolygonRejected() {
        assertThrows(IllegalArgumentException.class, () -> GeometryUtils.polygonBounds(List.of()));
    }

    @Test
    void rectangleToPolygon_clockwiseFromTopLeft() {
        assertEquals(List.of(PixelPoint.of(2, 3), PixelPoint.of(6, 3), PixelPoint.of(6, 8), PixelPoint.of(2, 8)),
                GeometryUtils.rectangleToPolygon(2, 3, 4, 5));
    }

    @Test
    void allCornersInside() {
        assertTrue(GeometryUtils.allCornersInside(GeometryUtils.rectangleToPolygon(2, 2, 3, 3), square));
        // 오른쪽 변에 닿으면 밖으로 본다
        assertFalse(GeometryUtils.allCornersInside(GeometryUtils.rectangleToPolygon(5, 2, 5, 3), square));
    }

    @Test
    void cornersOverlap() {
        assertTrue(GeometryUtils.cornersOverlap(square, GeometryUtils.rectangleToPolygon(5, 5, 10, 10)));
        assertTrue(GeometryUtils.cornersOverlap(GeometryUtils.rectangleToPolygon(2, 2, 2, 2), square));
        assertFalse(GeometryUtils.cornersOverlap(square, GeometryUtils.rectangleToPolygon(20, 20, 5, 5)));
        assertFalse(GeometryUtils.cornersOverlap(square, List.of()));
    }
}
