package com.example.roofpanel.model;

import lombok.Value;

/**
 * 픽셀 위치의 고도 샘플 (z 는 미터)
 */
@Value
public class ElevationSample {
    int x;
    int y;
    double z;
}
