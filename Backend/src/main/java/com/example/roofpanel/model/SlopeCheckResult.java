package com.example.roofpanel.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SlopeCheckResult {
    boolean valid;
    SlopeStatus status;
    double localDeviation;  // 도
    double globalDeviation; // 도
    double avgSlope;        // tan(경사각)
    double baselineAngle;   // 도
    double avgAngle;        // 도
    int sampleCount;

    /**
     * 샘플이 부족해 검사를 건너뛴 결과 (항상 통과)
     */
    public static SlopeCheckResult insufficientData(double baselineSlope, int sampleCount) {
        double baselineAngle = Math.toDegrees(Math.atan(baselineSlope));
        return SlopeCheckResult.builder()
                .valid(true)
                .status(SlopeStatus.INSUFFICIENT_DATA)
                .avgSlope(baselineSlope)
                .baselineAngle(baselineAngle)
                .avgAngle(baselineAngle)
                .sampleCount(sampleCount)
                .build();
    }

    public boolean isMeasured() {
        return status != SlopeStatus.INSUFFICIENT_DATA;
    }
}
