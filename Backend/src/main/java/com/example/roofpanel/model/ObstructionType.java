package com.example.roofpanel.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ObstructionType {
    SLOPE_VARIANCE("slope_variance"),
    GLOBAL_MISMATCH("global_mismatch"),
    SEGMENT_BOUNDARY("segment_boundary"),
    OBSTRUCTION_OVERLAP("obstruction_overlap");

    private final String code;

    ObstructionType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 경사 검사 실패 유형을 장애물 분류로 변환
     */
    public static ObstructionType fromSlopeStatus(SlopeStatus status) {
        return status == SlopeStatus.GLOBAL_MISMATCH ? GLOBAL_MISMATCH : SLOPE_VARIANCE;
    }
}
