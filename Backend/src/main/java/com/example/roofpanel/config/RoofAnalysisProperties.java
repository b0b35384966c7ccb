package com.example.roofpanel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 지붕 분석 설정값 (application.properties 의 roof.analysis.*)
 * 경사 편차 한계값은 모두 여기서 관리한다.
 */
@Data
@ConfigurationProperties(prefix = "roof.analysis")
public class RoofAnalysisProperties {

    private Grouping grouping = new Grouping();
    private Slope slope = new Slope();
    private ObstructionScan obstruction = new ObstructionScan();
    private PanelSpec panel = new PanelSpec();
    private Suitability suitability = new Suitability();

    @Data
    public static class Grouping {
        private boolean enabled = true;
        private double maxAzimuthDiff = 5.0;  // 도
        private double maxPitchDiff = 12.0;   // 도
        private double minDimension = 1.5;    // 미터, 경계 박스 짧은 변
        private double minArea = 11.0;        // m²
        private GroupOutline outline = GroupOutline.CORNER_UNION;
    }

    @Data
    public static class Slope {
        // 평면 근사 경사와 지붕 경사의 허용 차이 (도)
        private double maxGlobalDeviation = 14.0;
        // 패널 배치 시 국소 경사 허용 차이 (도)
        private double layoutMaxLocalDeviation = 15.0;
        // 장애물 탐지 시 국소 경사 허용 차이 (도)
        private double obstructionMaxLocalDeviation = 19.0;
    }

    @Data
    public static class ObstructionScan {
        private boolean enabled = true;
        private double cellSize = 0.5; // 미터
        private double overlap = 0.25; // 셀 간 겹침 비율
    }

    @Data
    public static class PanelSpec {
        private double width = 1.045;  // 미터
        private double height = 1.879; // 미터
        private double spacing = 0.0;
        private double efficiency = 0.20;
        private double irradiance = 1000.0; // W/m²
        // 면 밖/장애물 겹침으로 버린 셀도 장애물로 기록할지 여부
        private boolean recordRejectedCells = false;
        // 후보 배치 계산 스레드 수 (1 이하이면 순차 계산)
        private int candidateThreads = 4;
    }

    @Data
    public static class Suitability {
        private boolean enabled = true;
    }

    /**
     * 그룹 합성 다각형 생성 방식
     */
    public enum GroupOutline {
        CORNER_UNION, // 구성 면 꼭짓점의 중복 제거 (진짜 합집합 아님)
        CONVEX_HULL
    }
}
