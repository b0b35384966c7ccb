package com.example.roofpanel.service;

import com.example.roofpanel.config.RoofAnalysisProperties;
import com.example.roofpanel.exception.RoofAnalysisException;
import com.example.roofpanel.model.BuildingBounds;
import com.example.roofpanel.model.GeoBoundingBox;
import com.example.roofpanel.model.GroupingResult;
import com.example.roofpanel.model.LayoutResult;
import com.example.roofpanel.model.Obstruction;
import com.example.roofpanel.model.RealWorldScale;
import com.example.roofpanel.model.RoofAnalysisRequest;
import com.example.roofpanel.model.RoofAnalysisResult;
import com.example.roofpanel.model.RoofFacet;
import com.example.roofpanel.util.CoordinateMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 지붕 분석 전체 흐름
 * 축척 → 적합도 → 그룹화/필터 → 픽셀 투영 → 장애물 탐지 → 패널 배치
 */
@Service
public class RoofAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(RoofAnalysisService.class);

    private final FacetSuitabilityService suitabilityService;
    private final FacetGroupingService groupingService;
    private final FacetProjectionService projectionService;
    private final ObstructionDetectionService obstructionDetectionService;
    private final PanelLayoutService panelLayoutService;
    private final RoofAnalysisProperties properties;

    public RoofAnalysisService(FacetSuitabilityService suitabilityService,
                               FacetGroupingService groupingService,
                               FacetProjectionService projectionService,
                               ObstructionDetectionService obstructionDetectionService,
                               PanelLayoutService panelLayoutService,
                               RoofAnalysisProperties properties) {
        this.suitabilityService = suitabilityService;
        this.groupingService = groupingService;
        this.projectionService = projectionService;
        this.obstructionDetectionService = obstructionDetectionService;
        this.panelLayoutService = panelLayoutService;
        this.properties = properties;
    }

    public RoofAnalysisResult analyze(RoofAnalysisRequest request) {
        if (request == null || request.getFacets() == null) {
            throw new RoofAnalysisException("지붕 면 목록이 없음");
        }

        int width = request.getImageWidth();
        int height = request.getImageHeight();
        if ((width <= 0 || height <= 0) && request.getRaster() != null) {
            width = request.getRaster().getWidth();
            height = request.getRaster().getHeight();
        }
        if (width <= 0 || height <= 0) {
            throw new RoofAnalysisException("이미지 크기를 알 수 없음 (래스터도 없음)");
        }

        logger.info("지붕 분석 시작: 면 {}개, 이미지 {}x{}", request.getFacets().size(), width, height);

        // 1. 축척
        BuildingBounds bounds = groupingService.buildingBounds(request.getFacets());
        GeoBoundingBox imageBounds = request.getBuildingBoundingBox();
        if ((imageBounds == null || !imageBounds.isComplete()) && bounds != null) {
            logger.warn("건물 경계 박스가 없어 면 좌표 범위로 대신함");
            imageBounds = bounds.toBoundingBox();
        }
        RealWorldScale scale = CoordinateMapper.computeRealWorldScale(width, height, imageBounds);

        // 2. 적합도
        List<RoofFacet> facets = suitabilityService.scoreAll(request.getFacets(), request.getMaxSunshineHoursPerYear());

        // 3. 그룹화, 크기 필터
        GroupingResult grouping = groupingService.groupAndFilter(facets);

        // 4. 픽셀 다각형
        List<RoofFacet> projected = projectionService.project(grouping.getFacets(), imageBounds, width, height);

        // 5. DSM 장애물
        List<Obstruction> obstructions = new ArrayList<>();
        if (request.getExistingObstructions() != null) {
            obstructions.addAll(request.getExistingObstructions());
        }
        if (properties.getObstruction().isEnabled() && request.getRaster() != null) {
            int found = 0;
            for (RoofFacet facet : projected) {
                try {
                    List<Obstruction> detected = obstructionDetectionService.detect(
                            facet, request.getRaster(), scale, obstructions);
                    obstructions.addAll(detected);
                    found += detected.size();
                } catch (RuntimeException e) {
                    logger.error("면 {} 장애물 탐지 실패", facet.getId(), e);
                }
            }
            logger.info("DSM 장애물 {}개 탐지", found);
        } else {
            logger.debug("장애물 탐지 생략 (비활성화 또는 래스터 없음)");
        }

        // 6. 패널 배치
        LayoutResult layout = panelLayoutService.optimize(projected, obstructions, scale, request.getRaster());

        logger.info("지붕 분석 완료: 면 {}개, 패널 {}개", projected.size(), layout.getMetadata().getPanelCount());

        return new RoofAnalysisResult(projected, grouping.getGroups(), grouping.getStatistics(), scale, bounds, layout);
    }
}
