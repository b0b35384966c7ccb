package com.example.roofpanel.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 상위 단계(건물 조회, 지붕 분할, DSM 디코딩)에서 넘어온 분석 입력
 */
@Data
@Builder
public class RoofAnalysisRequest {
    private List<RoofFacet> facets;

    // null 이면 경사 검사와 장애물 탐지를 건너뜀
    private ElevationRaster raster;

    private GeoBoundingBox buildingBoundingBox;

    // 0 이면 래스터 크기 사용
    private int imageWidth;
    private int imageHeight;

    @Builder.Default
    private List<Obstruction> existingObstructions = new ArrayList<>();

    private Double maxSunshineHoursPerYear;
}
