package com.example.roofpanel.model;

/**
 * 격자 탐색 시작 위치
 */
public enum StartCorner {
    TOP_LEFT,
    TOP_RIGHT,
    BOTTOM_LEFT,
    BOTTOM_RIGHT,
    CENTER;

    public PixelPoint startPoint(PixelBoundingBox bounds) {
        switch (this) {
            case TOP_LEFT:
                return PixelPoint.of(bounds.getMinX(), bounds.getMinY());
            case TOP_RIGHT:
                return PixelPoint.of(bounds.getMaxX(), bounds.getMinY());
            case BOTTOM_LEFT:
                return PixelPoint.of(bounds.getMinX(), bounds.getMaxY());
            case BOTTOM_RIGHT:
                return PixelPoint.of(bounds.getMaxX(), bounds.getMaxY());
            default:
                return PixelPoint.of(
                        Math.floorDiv(bounds.getMinX() + bounds.getMaxX(), 2),
                        Math.floorDiv(bounds.getMinY() + bounds.getMaxY(), 2));
        }
    }

    /**
     * 열 진행 방향 (+1: 오른쪽, -1: 왼쪽)
     */
    public int columnIncrement() {
        return (this == TOP_RIGHT || this == BOTTOM_RIGHT) ? -1 : 1;
    }

    /**
     * 행 진행 방향 (+1: 아래, -1: 위)
     */
    public int rowIncrement() {
        return (this == BOTTOM_LEFT || this == BOTTOM_RIGHT) ? -1 : 1;
    }
}
