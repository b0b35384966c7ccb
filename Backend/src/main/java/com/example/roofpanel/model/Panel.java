package com.example.roofpanel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 배치가 확정된 태양광 패널 (생성 후 변경 불가)
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Panel {
    @JsonProperty("id")
    String id;

    @JsonProperty("facetId")
    String facetId;

    @JsonProperty("x")
    int x;

    @JsonProperty("y")
    int y;

    @JsonProperty("width")
    int width; // 픽셀

    @JsonProperty("height")
    int height; // 픽셀

    @JsonProperty("realWidth")
    double realWidth; // 미터

    @JsonProperty("realHeight")
    double realHeight; // 미터

    @JsonProperty("pitch")
    double pitch;

    @JsonProperty("azimuth")
    double azimuth;

    @JsonProperty("row")
    int row;

    @JsonProperty("col")
    int col;

    @JsonProperty("polygon")
    List<PixelPoint> polygon;

    // 고도 데이터가 있을 때만 채워짐
    @JsonProperty("avgSlope")
    Double avgSlopeDegrees;

    @JsonProperty("localDeviation")
    Double localDeviation;

    @JsonProperty("globalDeviation")
    Double globalDeviation;

    public double getRealArea() {
        return realWidth * realHeight;
    }
}
