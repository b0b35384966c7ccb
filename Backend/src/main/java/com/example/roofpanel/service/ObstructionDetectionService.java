package com.example.roofpanel.service;

import com.example.roofpanel.config.RoofAnalysisProperties;
import com.example.roofpanel.model.ElevationRaster;
import com.example.roofpanel.model.Obstruction;
import com.example.roofpanel.model.ObstructionType;
import com.example.roofpanel.model.PixelBoundingBox;
import com.example.roofpanel.model.RealWorldScale;
import com.example.roofpanel.model.RoofFacet;
import com.example.roofpanel.model.SlopeCheckResult;
import com.example.roofpanel.util.GeometryUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 패널 배치보다 촘촘한 격자(기본 0.5m, 25% 겹침)로 면을 훑어
 * 경사가 지붕과 맞지 않는 셀을 장애물로 기록한다.
 */
@Service
public class ObstructionDetectionService {

    private static final Logger logger = LoggerFactory.getLogger(ObstructionDetectionService.class);

    private final SlopeValidationService slopeValidationService;
    private final RoofAnalysisProperties properties;

    public ObstructionDetectionService(SlopeValidationService slopeValidationService,
                                       RoofAnalysisProperties properties) {
        this.slopeValidationService = slopeValidationService;
        this.properties = properties;
    }

    /**
     * 한 면에서 새로 찾은 장애물 목록 (기존 장애물은 포함하지 않음)
     */
    public List<Obstruction> detect(RoofFacet facet, ElevationRaster raster, RealWorldScale scale,
                                    List<Obstruction> existingObstructions) {
        List<Obstruction> detected = new ArrayList<>();
        if (raster == null || !facet.hasValidPolygon()) {
            return detected;
        }

        RoofAnalysisProperties.ObstructionScan config = properties.getObstruction();
        RoofAnalysisProperties.Slope slope = properties.getSlope();

        int cellWidth = Math.max(1, (int) Math.round(config.getCellSize() / scale.getMetersPerPixelX()));
        int cellHeight = Math.max(1, (int) Math.round(config.getCellSize() / scale.getMetersPerPixelY()));
        int strideX = Math.max(1, (int) Math.round(cellWidth * (1 - config.getOverlap())));
        int strideY = Math.max(1, (int) Math.round(cellHeight * (1 - config.getOverlap())));

        List<Obstruction> sameFacet = new ArrayList<>();
        for (Obstruction o : existingObstructions) {
            if (facet.getId().equals(o.getFacetId())) {
                sameFacet.add(o);
            }
        }

        PixelBoundingBox bounds = GeometryUtils.polygonBounds(facet.getPixelPolygon())
                .clampTo(raster.getWidth(), raster.getHeight());
        double baselineSlope = Math.tan(Math.toRadians(facet.getPitchDegrees()));

        int scanned = 0;
        for (int y = bounds.getMinY(); y <= bounds.getMaxY(); y += strideY) {
            for (int x = bounds.getMinX(); x <= bounds.getMaxX(); x += strideX) {
                double centerX = x + cellWidth / 2.0;
                double centerY = y + cellHeight / 2.0;
                if (!GeometryUtils.pointInPolygon(centerX, centerY, facet.getPixelPolygon())) {
                    continue;
                }
                scanned++;

                SlopeCheckResult check = slopeValidationService.checkBlockSlope(
                        raster, x, y, cellWidth, cellHeight, scale, baselineSlope,
                        slope.getObstructionMaxLocalDeviation(), slope.getMaxGlobalDeviation());
                if (check.isValid()) {
                    continue;
                }

                // 겹치는 stride 로 같은 장애물을 여러 번 잡지 않도록
                if (isNearExisting(x, y, cellWidth, cellHeight, sameFacet)) {
                    continue;
                }

                Obstruction obstruction = Obstruction.builder()
                        .id("dsm_obstruction_" + facet.getId() + "_" + detected.size())
                        .facetId(facet.getId())
                        .x(x)
                        .y(y)
                        .width(cellWidth)
                        .height(cellHeight)
                        .type(ObstructionType.fromSlopeStatus(check.getStatus()))
                        .reason("DSM 경사 불일치")
                        .polygon(GeometryUtils.rectangleToPolygon(x, y, cellWidth, cellHeight))
                        .avgSlopeDegrees(check.getAvgAngle())
                        .localDeviation(check.getLocalDeviation())
                        .globalDeviation(check.getGlobalDeviation())
                        .build();
                detected.add(obstruction);
                sameFacet.add(obstruction);
            }
        }

        logger.debug("면 {} 장애물 탐지: 셀 {}개 검사, 장애물 {}개 (셀 {}x{}px)",
                facet.getId(), scanned, detected.size(), cellWidth, cellHeight);
        return detected;
    }

    private static boolean isNearExisting(int x, int y, int cellWidth, int cellHeight, List<Obstruction> obstructions) {
        for (Obstruction o : obstructions) {
            if (Math.abs(o.getX() - x) < cellWidth && Math.abs(o.getY() - y) < cellHeight) {
                return true;
            }
        }
        return false;
    }
}
