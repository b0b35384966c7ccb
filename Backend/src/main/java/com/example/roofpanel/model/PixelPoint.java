package com.example.roofpanel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class PixelPoint {
    @JsonProperty("x")
    int x;

    @JsonProperty("y")
    int y;

    public static PixelPoint of(int x, int y) {
        return new PixelPoint(x, y);
    }
}
