package com.example.roofpanel.util;

import com.example.roofpanel.model.PixelBoundingBox;
import com.example.roofpanel.model.PixelPoint;

import java.util.List;

/**
 * 이미지 좌표계 다각형 계산 유틸리티
 */
public class GeometryUtils {

    private GeometryUtils() {
    }

    /**
     * 점이 다각형 안에 있는지 확인 (ray casting)
     */
    public static boolean pointInPolygon(double x, double y, List<PixelPoint> polygon) {
        boolean inside = false;
        int n = polygon.size();

        for (int i = 0, j = n - 1; i < n; j = i++) {
            double xi = polygon.get(i).getX();
            double yi = polygon.get(i).getY();
            double xj = polygon.get(j).getX();
            double yj = polygon.get(j).getY();

            // 점에서 오른쪽으로 쏜 반직선이 변과 만나는지
            boolean intersect = ((yi > y) != (yj > y))
                    && (x < (xj - xi) * (y - yi) / (yj - yi) + xi);
            if (intersect) {
                inside = !inside;
            }
        }
        return inside;
    }

    public static boolean pointInPolygon(PixelPoint point, List<PixelPoint> polygon) {
        return pointInPolygon(point.getX(), point.getY(), polygon);
    }

    /**
     * 다각형 경계 박스 (최소값은 내림, 최대값은 올림)
     */
    public static PixelBoundingBox polygonBounds(List<PixelPoint> polygon) {
        if (polygon == null || polygon.isEmpty()) {
            throw new IllegalArgumentException("빈 다각형의 경계는 계산할 수 없음");
        }
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;

        for (PixelPoint p : polygon) {
            minX = Math.min(minX, p.getX());
            minY = Math.min(minY, p.getY());
            maxX = Math.max(maxX, p.getX());
            maxY = Math.max(maxY, p.getY());
        }

        return new PixelBoundingBox(
                (int) Math.floor(minX),
                (int) Math.floor(minY),
                (int) Math.ceil(maxX),
                (int) Math.ceil(maxY));
    }

    /**
     * 사각형을 꼭짓점 4개로 변환 (좌상, 우상, 우하, 좌하 순)
     */
    public static List<PixelPoint> rectangleToPolygon(int x, int y, int width, int height) {
        return List.of(
                PixelPoint.of(x, y),
                PixelPoint.of(x + width, y),
                PixelPoint.of(x + width, y + height),
                PixelPoint.of(x, y + height));
    }

    /**
     * 모든 꼭짓점이 바깥 다각형 안에 있는지
     */
    public static boolean allCornersInside(List<PixelPoint> inner, List<PixelPoint> outer) {
        for (PixelPoint corner : inner) {
            if (!pointInPolygon(corner, outer)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 두 다각형 중 한쪽의 꼭짓점이 다른 쪽 안에 들어가면 겹친 것으로 본다
     */
    public static boolean cornersOverlap(List<PixelPoint> a, List<PixelPoint> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return false;
        }
        for (PixelPoint corner : a) {
            if (pointInPolygon(corner, b)) {
                return true;
            }
        }
        for (PixelPoint corner : b) {
            if (pointInPolygon(corner, a)) {
                return true;
            }
        }
        return false;
    }
}
