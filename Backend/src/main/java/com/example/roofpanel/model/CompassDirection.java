package com.example.roofpanel.model;

/**
 * 8방위 지붕 방향 (방위각 기준, 북=0°, 동=90°)
 */
public enum CompassDirection {
    NORTH("North", LayoutDirection.HORIZONTAL),
    NORTHEAST("Northeast", LayoutDirection.VERTICAL),
    EAST("East", LayoutDirection.VERTICAL),
    SOUTHEAST("Southeast", LayoutDirection.VERTICAL),
    SOUTH("South", LayoutDirection.HORIZONTAL),
    SOUTHWEST("Southwest", LayoutDirection.VERTICAL),
    WEST("West", LayoutDirection.VERTICAL),
    NORTHWEST("Northwest", LayoutDirection.VERTICAL);

    private final String label;
    private final LayoutDirection layoutDirection;

    CompassDirection(String label, LayoutDirection layoutDirection) {
        this.label = label;
        this.layoutDirection = layoutDirection;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 동/서 성분이 있으면 세로 배치, 남/북이면 가로 배치
     */
    public LayoutDirection getLayoutDirection() {
        return layoutDirection;
    }

    /**
     * 방위각을 45° 구간으로 나눠 방향 결정 (북쪽 구간은 337.5° ~ 22.5°)
     */
    public static CompassDirection fromAzimuth(double azimuthDegrees) {
        double normalized = ((azimuthDegrees % 360) + 360) % 360;
        int sector = (int) Math.floor((normalized + 22.5) / 45.0) % 8;
        return values()[sector];
    }
}
