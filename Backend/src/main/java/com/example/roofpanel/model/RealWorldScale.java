package com.example.roofpanel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * 이미지 픽셀과 실제 거리(미터) 사이의 축척
 */
@Value
@Builder
public class RealWorldScale {
    @JsonProperty("metersPerPixelX")
    double metersPerPixelX;

    @JsonProperty("metersPerPixelY")
    double metersPerPixelY;

    @JsonProperty("pixelWidth")
    int pixelWidth;

    @JsonProperty("pixelHeight")
    int pixelHeight;

    @JsonProperty("width")
    double widthMeters;

    @JsonProperty("height")
    double heightMeters;

    // 건물 경계가 없어 기본값을 쓴 경우 (정밀도 낮음)
    @JsonProperty("fallback")
    boolean fallback;
}
