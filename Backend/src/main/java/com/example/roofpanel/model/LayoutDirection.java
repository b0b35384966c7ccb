package com.example.roofpanel.model;

/**
 * 패널 행 방향
 * HORIZONTAL: 동서 방향 행 (남/북향 지붕), VERTICAL: 남북 방향 행 (동/서향 지붕)
 */
public enum LayoutDirection {
    HORIZONTAL,
    VERTICAL;

    /**
     * 방향 정보가 없을 때 방위각 구간으로 판단
     */
    public static LayoutDirection fromAzimuth(double azimuthDegrees) {
        double normalized = ((azimuthDegrees % 360) + 360) % 360;
        if ((normalized >= 45 && normalized <= 135) || (normalized >= 225 && normalized <= 315)) {
            return VERTICAL;
        }
        return HORIZONTAL;
    }
}
