package com.example.roofpanel.service;

import com.example.roofpanel.config.RoofAnalysisProperties;
import com.example.roofpanel.model.ElevationRaster;
import com.example.roofpanel.model.GridStrategy;
import com.example.roofpanel.model.LayoutDirection;
import com.example.roofpanel.model.LayoutResult;
import com.example.roofpanel.model.Obstruction;
import com.example.roofpanel.model.ObstructionType;
import com.example.roofpanel.model.Panel;
import com.example.roofpanel.model.PanelOrientation;
import com.example.roofpanel.model.PixelPoint;
import com.example.roofpanel.model.RealWorldScale;
import com.example.roofpanel.model.RoofFacet;
import com.example.roofpanel.model.StartCorner;
import com.example.roofpanel.util.GeometryUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PanelLayoutServiceTest {

    private RoofAnalysisProperties properties;
    private PanelLayoutService service;

    // 20m x 15m, 픽셀당 0.05m
    private final RealWorldScale scale = RealWorldScale.builder()
            .metersPerPixelX(0.05)
            .metersPerPixelY(0.05)
            .pixelWidth(400)
            .pixelHeight(300)
            .widthMeters(20)
            .heightMeters(15)
            .build();

    @BeforeEach
    void setUp() {
        properties = new RoofAnalysisProperties();
        service = new PanelLayoutService(new SlopeValidationService(), properties);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    /**
     * 10m x 5m 평지붕 (200 x 100 px)
     */
    private static RoofFacet flatRoof(String id) {
        return RoofFacet.builder()
                .id(id)
                .pitchDegrees(0)
                .azimuthDegrees(180)
                .pixelPolygon(GeometryUtils.rectangleToPolygon(100, 100, 200, 100))
                .build();
    }

    @Test
    void flatRectangleFitsTwentyPanels() {
        LayoutResult result = service.optimize(List.of(flatRoof("roof_0")), List.of(), scale, null);

        // 가로 배치 38x21px: 5열 x 4행, 세로 배치 21x38px: 9열 x 2행
        assertEquals(20, result.getPanels().size());
        assertEquals(20, result.getMetadata().getPanelCount());
        assertEquals(PanelOrientation.LANDSCAPE, result.getMetadata().getFacetSummaries().get(0).getOrientation());
        assertEquals(GridStrategy.STANDARD, result.getMetadata().getFacetSummaries().get(0).getStrategy());
        assertEquals(StartCorner.TOP_LEFT, result.getMetadata().getFacetSummaries().get(0).getStartCorner());
        assertEquals(39.9, result.getMetadata().getTotalArea(), 1e-6);
        assertEquals(7.98, result.getMetadata().getPotentialKw(), 1e-6);
        assertEquals(1.045, result.getMetadata().getPanelWidth(), 1e-9);
        assertEquals(1.879, result.getMetadata().getPanelHeight(), 1e-9);
        assertTrue(result.getObstructions().isEmpty());
    }

    @Test
    void panelsStayInsideFacetAndDoNotOverlap() {
        RoofFacet facet = flatRoof("roof_0");
        List<Panel> panels = service.optimize(List.of(facet), List.of(), scale, null).getPanels();

        for (Panel panel : panels) {
            assertTrue(GeometryUtils.allCornersInside(panel.getPolygon(), facet.getPixelPolygon()), panel.getId());
            assertEquals("roof_0", panel.getFacetId());
            assertNull(panel.getAvgSlopeDegrees());
        }
        for (int i = 0; i < panels.size(); i++) {
            for (int j = i + 1; j < panels.size(); j++) {
                Panel a = panels.get(i);
                Panel b = panels.get(j);
                boolean intersects = a.getX() < b.getX() + b.getWidth() && b.getX() < a.getX() + a.getWidth()
                        && a.getY() < b.getY() + b.getHeight() && b.getY() < a.getY() + a.getHeight();
                assertFalse(intersects, a.getId() + " / " + b.getId());
            }
        }
    }

    @Test
    void panelIdsAreSequentialPerFacet() {
        List<Panel> panels = service.optimize(List.of(flatRoof("roof_0")), List.of(), scale, null).getPanels();

        assertEquals("panel_roof_0_0", panels.get(0).getId());
        assertEquals("panel_roof_0_19", panels.get(19).getId());
    }

    @Test
    void obstructionBlocksPanels() {
        RoofFacet facet = flatRoof("roof_0");
        Obstruction chimney = Obstruction.builder()
                .id("chimney")
                .facetId("roof_0")
                .x(100)
                .y(100)
                .width(40)
                .height(40)
                .type(ObstructionType.SLOPE_VARIANCE)
                .polygon(GeometryUtils.rectangleToPolygon(100, 100, 40, 40))
                .build();

        LayoutResult result = service.optimize(List.of(facet), List.of(chimney), scale, null);

        assertTrue(result.getPanels().size() < 20);
        assertFalse(result.getPanels().isEmpty());
        for (Panel panel : result.getPanels()) {
            assertFalse(GeometryUtils.cornersOverlap(panel.getPolygon(), chimney.getPolygon()), panel.getId());
        }
        assertTrue(result.getObstructions().contains(chimney));
    }

    @Test
    void obstructionOfAnotherFacetIsIgnored() {
        Obstruction elsewhere = Obstruction.builder()
                .id("elsewhere")
                .facetId("roof_9")
                .x(100)
                .y(100)
                .width(40)
                .height(40)
                .type(ObstructionType.SLOPE_VARIANCE)
                .polygon(GeometryUtils.rectangleToPolygon(100, 100, 40, 40))
                .build();

        LayoutResult result = service.optimize(List.of(flatRoof("roof_0")), List.of(elsewhere), scale, null);

        assertEquals(20, result.getPanels().size());
    }

    @Test
    void malformedFacetIsSkipped() {
        RoofFacet broken = RoofFacet.builder()
                .id("broken")
                .pitchDegrees(30)
                .azimuthDegrees(180)
                .pixelPolygon(List.of(PixelPoint.of(0, 0), PixelPoint.of(10, 10)))
                .build();

        LayoutResult result = service.optimize(List.of(broken, flatRoof("roof_0")), List.of(), scale, null);

        assertEquals(List.of("broken"), result.getMetadata().getSkippedFacetIds());
        assertEquals(20, result.getPanels().size());
    }

    @Test
    void unexpectedFailureIsReportedPerFacet() {
        RoofFacet corrupt = RoofFacet.builder()
                .id("corrupt")
                .pitchDegrees(30)
                .azimuthDegrees(180)
                .pixelPolygon(Arrays.asList(PixelPoint.of(0, 0), null, PixelPoint.of(10, 10)))
                .build();

        LayoutResult result = service.optimize(List.of(corrupt, flatRoof("roof_0")), List.of(), scale, null);

        assertEquals(1, result.getMetadata().getFailures().size());
        assertEquals("corrupt", result.getMetadata().getFailures().get(0).getFacetId());
        assertTrue(result.getMetadata().getFailures().get(0).getMessage().startsWith("면 corrupt 처리 실패"));
        assertEquals(20, result.getPanels().size());
    }

    @Test
    void slopeMismatchBecomesObstructions() {
        // 45° 로 기운 DSM 위의 평지붕
        float[] values = new float[400 * 300];
        for (int y = 0; y < 300; y++) {
            for (int x = 0; x < 400; x++) {
                values[y * 400 + x] = (float) (y * 0.05);
            }
        }
        ElevationRaster raster = ElevationRaster.of(400, 300, values);

        LayoutResult result = service.optimize(List.of(flatRoof("roof_0")), List.of(), scale, raster);

        assertTrue(result.getPanels().isEmpty());
        assertFalse(result.getObstructions().isEmpty());
        for (Obstruction o : result.getObstructions()) {
            assertTrue(o.getId().startsWith("slope_obstruction_roof_0_"), o.getId());
            assertEquals(ObstructionType.SLOPE_VARIANCE, o.getType());
        }
    }

    @Test
    void flatRasterGivesMeasuredPanels() {
        float[] values = new float[400 * 300];
        Arrays.fill(values, 5f);

        LayoutResult result = service.optimize(List.of(flatRoof("roof_0")), List.of(),
                scale, ElevationRaster.of(400, 300, values));

        assertEquals(20, result.getPanels().size());
        assertEquals(0, result.getPanels().get(0).getAvgSlopeDegrees(), 1e-9);
    }

    @Test
    void rejectedCellsRecordedWhenEnabled() {
        properties.getPanel().setRecordRejectedCells(true);

        LayoutResult result = service.optimize(List.of(flatRoof("roof_0")), List.of(), scale, null);

        assertEquals(20, result.getPanels().size());
        assertTrue(result.getObstructions().stream().anyMatch(o -> o.getType() == ObstructionType.SEGMENT_BOUNDARY));
    }

    @Test
    void sequentialAndParallelGiveSameLayout() {
        RoofAnalysisProperties sequentialProperties = new RoofAnalysisProperties();
        sequentialProperties.getPanel().setCandidateThreads(1);
        PanelLayoutService sequential = new PanelLayoutService(new SlopeValidationService(), sequentialProperties);

        List<RoofFacet> facets = new ArrayList<>();
        facets.add(flatRoof("roof_0"));
        facets.add(RoofFacet.builder()
                .id("roof_1")
                .pitchDegrees(30)
                .azimuthDegrees(95)
                .pixelPolygon(List.of(PixelPoint.of(20, 20), PixelPoint.of(180, 40),
                        PixelPoint.of(150, 250), PixelPoint.of(30, 200)))
                .build());

        List<String> parallelIds = service.optimize(facets, List.of(), scale, null).getPanels().stream()
                .map(p -> p.getId() + "@" + p.getX() + "," + p.getY())
                .collect(Collectors.toList());
        List<String> sequentialIds = sequential.optimize(facets, List.of(), scale, null).getPanels().stream()
                .map(p -> p.getId() + "@" + p.getX() + "," + p.getY())
                .collect(Collectors.toList());

        assertEquals(sequentialIds, parallelIds);
        sequential.shutdown();
    }

    @Test
    void panelFootprintForeshortensSlopeDirection() {
        assertArrayEquals(new int[]{10, 38},
                service.panelFootprint(PanelOrientation.PORTRAIT, LayoutDirection.VERTICAL, 60, scale));
        assertArrayEquals(new int[]{21, 19},
                service.panelFootprint(PanelOrientation.PORTRAIT, LayoutDirection.HORIZONTAL, 60, scale));
        assertArrayEquals(new int[]{38, 21},
                service.panelFootprint(PanelOrientation.LANDSCAPE, LayoutDirection.HORIZONTAL, 0, scale));
    }

    @Test
    void twentyCandidatesInFixedOrder() {
        List<PanelLayoutService.CandidateSpec> specs = PanelLayoutService.enumerateCandidates();

        assertEquals(20, specs.size());
        assertEquals(PanelOrientation.PORTRAIT, specs.get(0).orientation);
        assertEquals(GridStrategy.STANDARD, specs.get(0).strategy);
        assertEquals(StartCorner.TOP_LEFT, specs.get(0).startCorner);
        assertEquals(GridStrategy.STAGGERED, specs.get(1).strategy);
        assertEquals(PanelOrientation.LANDSCAPE, specs.get(10).orientation);
    }
}
