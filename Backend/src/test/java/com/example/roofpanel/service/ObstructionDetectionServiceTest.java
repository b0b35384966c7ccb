package com.example.roofpanel.service;

import com.example.roofpanel.config.RoofAnalysisProperties;
import com.example.roofpanel.model.ElevationRaster;
import com.example.roofpanel.model.Obstruction;
import com.example.roofpanel.model.ObstructionType;
import com.example.roofpanel.model.PixelPoint;
import com.example.roofpanel.model.RealWorldScale;
import com.example.roofpanel.model.RoofFacet;
import com.example.roofpanel.util.GeometryUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ObstructionDetectionServiceTest {

    private static final int SIZE = 100;

    private ObstructionDetectionService service;
    private RealWorldScale scale;
    private RoofFacet facet;

    @BeforeEach
    void setUp() {
        service = new ObstructionDetectionService(new SlopeValidationService(), new RoofAnalysisProperties());
        scale = RealWorldScale.builder()
                .metersPerPixelX(0.1)
                .metersPerPixelY(0.1)
                .pixelWidth(SIZE)
                .pixelHeight(SIZE)
                .widthMeters(10)
                .heightMeters(10)
                .build();
        facet = RoofFacet.builder()
                .id("roof_0")
                .pitchDegrees(0)
                .azimuthDegrees(180)
                .pixelPolygon(GeometryUtils.rectangleToPolygon(0, 0, SIZE - 1, SIZE - 1))
                .build();
    }

    private static ElevationRaster rasterWithChimney() {
        float[] values = new float[SIZE * SIZE];
        Arrays.fill(values, 10f);
        // 1m x 1m, 높이 2m 굴뚝
        for (int y = 40; y < 50; y++) {
            for (int x = 40; x < 50; x++) {
                values[y * SIZE + x] = 12f;
            }
        }
        return ElevationRaster.of(SIZE, SIZE, values);
    }

    @Test
    void flatRoofHasNoObstructions() {
        float[] values = new float[SIZE * SIZE];
        Arrays.fill(values, 10f);

        List<Obstruction> detected = service.detect(facet, ElevationRaster.of(SIZE, SIZE, values), scale, List.of());

        assertTrue(detected.isEmpty());
    }

    @Test
    void chimneyIsDetected() {
        List<Obstruction> detected = service.detect(facet, rasterWithChimney(), scale, List.of());

        assertFalse(detected.isEmpty());
        for (Obstruction o : detected) {
            assertEquals("roof_0", o.getFacetId());
            assertTrue(o.getId().startsWith("dsm_obstruction_roof_0_"));
            assertEquals(ObstructionType.SLOPE_VARIANCE, o.getType());
            assertEquals(5, o.getWidth());
            assertTrue(o.getX() >= 35 && o.getX() <= 49, "굴뚝 주변이어야 함: " + o.getX());
            assertTrue(o.getY() >= 35 && o.getY() <= 49, "굴뚝 주변이어야 함: " + o.getY());
            assertNotNull(o.getLocalDeviation());
        }
    }

    @Test
    void overlappingCellsAreDeduplicated() {
        List<Obstruction> detected = service.detect(facet, rasterWithChimney(), scale, List.of());

        for (int i = 0; i < detected.size(); i++) {
            for (int j = i + 1; j < detected.size(); j++) {
                Obstruction a = detected.get(i);
                Obstruction b = detected.get(j);
                boolean near = Math.abs(a.getX() - b.getX()) < a.getWidth()
                        && Math.abs(a.getY() - b.getY()) < a.getHeight();
                assertFalse(near, a.getId() + " / " + b.getId());
            }
        }
    }

    @Test
    void existingObstructionsOfSameFacetSuppressDuplicates() {
        ElevationRaster raster = rasterWithChimney();
        List<Obstruction> first = service.detect(facet, raster, scale, List.of());

        assertTrue(service.detect(facet, raster, scale, first).isEmpty());
    }

    @Test
    void obstructionsOfOtherFacetsAreIgnored() {
        ElevationRaster raster = rasterWithChimney();
        Obstruction other = Obstruction.builder()
                .id("other")
                .facetId("roof_9")
                .x(40)
                .y(40)
                .width(10)
                .height(10)
                .type(ObstructionType.SLOPE_VARIANCE)
                .polygon(GeometryUtils.rectangleToPolygon(40, 40, 10, 10))
                .build();

        List<Obstruction> withOther = service.detect(facet, raster, scale, List.of(other));

        assertEquals(service.detect(facet, raster, scale, List.of()).size(), withOther.size());
    }

    @Test
    void withoutRasterOrPolygonNothingIsDetected() {
        assertTrue(service.detect(facet, null, scale, List.of()).isEmpty());

        RoofFacet noPolygon = facet.toBuilder().pixelPolygon(List.of(PixelPoint.of(0, 0))).build();
        assertTrue(service.detect(noPolygon, rasterWithChimney(), scale, List.of()).isEmpty());
    }
}
