package com.example.roofpanel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 패널을 놓을 수 없는 영역 (생성 후 변경 불가)
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Obstruction {
    @JsonProperty("id")
    String id;

    @JsonProperty("facetId")
    String facetId;

    @JsonProperty("x")
    int x;

    @JsonProperty("y")
    int y;

    @JsonProperty("width")
    int width;

    @JsonProperty("height")
    int height;

    @JsonProperty("type")
    ObstructionType type;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("polygon")
    List<PixelPoint> polygon;

    @JsonProperty("avgSlope")
    Double avgSlopeDegrees;

    @JsonProperty("localDeviation")
    Double localDeviation;

    @JsonProperty("globalDeviation")
    Double globalDeviation;
}
