package com.example.roofpanel.model;

import lombok.Getter;

/**
 * 건물 주변 DSM 고도 래스터 (행 우선 1차원 배열)
 */
@Getter
public class ElevationRaster {

    public static final float DEFAULT_NO_DATA = -9999f;

    private final int width;
    private final int height;
    private final float[] values;
    private final float noDataValue;
    private final double minValue;
    private final double maxValue;

    private ElevationRaster(int width, int height, float[] values, float noDataValue) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("래스터 크기가 잘못됨: " + width + "x" + height);
        }
        if (values == null || values.length < width * height) {
            throw new IllegalArgumentException("래스터 값 배열 길이가 부족함");
        }
        this.width = width;
        this.height = height;
        this.values = values;
        this.noDataValue = noDataValue;

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < width * height; i++) {
            float v = values[i];
            if (isValidValue(v)) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
        }
        // 유효값이 하나도 없으면 범위는 0
        this.minValue = Double.isInfinite(min) ? 0 : min;
        this.maxValue = Double.isInfinite(max) ? 0 : max;
    }

    public static ElevationRaster of(int width, int height, float[] values) {
        return new ElevationRaster(width, height, values, DEFAULT_NO_DATA);
    }

    public static ElevationRaster of(int width, int height, float[] values, float noDataValue) {
        return new ElevationRaster(width, height, values, noDataValue);
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    /**
     * 해당 픽셀 고도, 범위 밖이거나 no-data 이면 NaN
     */
    public double valueAt(int x, int y) {
        if (!contains(x, y)) {
            return Double.NaN;
        }
        float v = values[y * width + x];
        return isValidValue(v) ? v : Double.NaN;
    }

    public boolean isValidValue(float v) {
        return !Float.isNaN(v) && !Float.isInfinite(v) && v != noDataValue;
    }
}
