package com.example.roofpanel.model;

import lombok.Value;

/**
 * 경계 박스의 실제 크기 (미터)
 */
@Value
public class BoxDimensions {
    double width;  // 동서
    double length; // 남북

    public double getMinDimension() {
        return Math.min(width, length);
    }

    public static BoxDimensions empty() {
        return new BoxDimensions(0, 0);
    }
}
