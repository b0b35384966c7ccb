package com.example.roofpanel.service;

import com.example.roofpanel.config.RoofAnalysisProperties;
import com.example.roofpanel.model.RoofFacet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 면별 태양광 적합도 점수 (0~1)
 * 일조시간 60%, 방위(남향 기준) 30%, 경사(35° 기준) 10%
 */
@Service
public class FacetSuitabilityService {

    private static final Logger logger = LoggerFactory.getLogger(FacetSuitabilityService.class);

    static final double SUNSHINE_WEIGHT = 0.6;
    static final double AZIMUTH_WEIGHT = 0.3;
    static final double PITCH_WEIGHT = 0.1;
    static final double OPTIMAL_PITCH = 35.0;
    static final double UNKNOWN_SUNSHINE_SCORE = 0.5;

    private final RoofAnalysisProperties properties;

    public FacetSuitabilityService(RoofAnalysisProperties properties) {
        this.properties = properties;
    }

    /**
     * 적합도를 채운 새 목록 반환. 비활성화면 입력 그대로
     */
    public List<RoofFacet> scoreAll(List<RoofFacet> facets, Double maxSunshineHoursPerYear) {
        if (!properties.getSuitability().isEnabled()) {
            return facets;
        }
        List<RoofFacet> scored = facets.stream()
                .map(f -> f.toBuilder().suitability(score(f, maxSunshineHoursPerYear)).build())
                .collect(Collectors.toList());
        logger.debug("적합도 계산 완료: 면 {}개", scored.size());
        return scored;
    }

    public double score(RoofFacet facet, Double maxSunshineHoursPerYear) {
        double azimuthScore = (Math.cos(Math.toRadians(facet.getAzimuthDegrees() - 180)) + 1) / 2;

        double sunshineScore = UNKNOWN_SUNSHINE_SCORE;
        Double median = facet.getMedianSunshineHours();
        if (median != null && maxSunshineHoursPerYear != null && maxSunshineHoursPerYear > 0) {
            sunshineScore = median / maxSunshineHoursPerYear;
        }

        double pitchScore = 1 - Math.min(1, Math.abs(facet.getPitchDegrees() - OPTIMAL_PITCH) / 45);

        double score = SUNSHINE_WEIGHT * sunshineScore + AZIMUTH_WEIGHT * azimuthScore + PITCH_WEIGHT * pitchScore;
        return Math.max(0, Math.min(1, score));
    }
}
