package com.example.roofpanel.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class PixelBoundingBox {
    @JsonProperty("minX")
    int minX;

    @JsonProperty("minY")
    int minY;

    @JsonProperty("maxX")
    int maxX;

    @JsonProperty("maxY")
    int maxY;

    @JsonIgnore
    public int getWidth() {
        return maxX - minX;
    }

    @JsonIgnore
    public int getHeight() {
        return maxY - minY;
    }

    /**
     * 이미지 범위 [0, width-1] x [0, height-1] 로 제한
     */
    public PixelBoundingBox clampTo(int pixelWidth, int pixelHeight) {
        return new PixelBoundingBox(
                Math.max(0, minX),
                Math.max(0, minY),
                Math.min(pixelWidth - 1, maxX),
                Math.min(pixelHeight - 1, maxY)
        );
    }
}
