package com.example.roofpanel.util;

import com.example.roofpanel.model.BoxDimensions;
import com.example.roofpanel.model.GeoBoundingBox;
import com.example.roofpanel.model.GeoPoint;
import com.example.roofpanel.model.PixelPoint;
import com.example.roofpanel.model.RealWorldScale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 위경도 ↔ 이미지 픽셀 변환과 실제 축척 계산
 * 구면 지구 근사 (반지름 6,371km)
 */
public class CoordinateMapper {

    private static final Logger logger = LoggerFactory.getLogger(CoordinateMapper.class);

    public static final double EARTH_RADIUS_M = 6371000;

    // 건물 경계가 없을 때 쓰는 기본 축척 (일반적인 항공사진 해상도 기준)
    static final double FALLBACK_SIZE_M = 50;
    static final int FALLBACK_PIXELS = 500;

    private CoordinateMapper() {
    }

    /**
     * 위경도를 픽셀 좌표로 변환 (y 는 아래로 증가)
     * 경계가 불완전하면 이미지 중심을 반환
     */
    public static PixelPoint geoToPixel(GeoPoint point, GeoBoundingBox bounds, int width, int height) {
        if (bounds == null || !bounds.isComplete()) {
            return PixelPoint.of(width / 2, height / 2);
        }

        double lngSpan = bounds.getNe().getLongitude() - bounds.getSw().getLongitude();
        double latSpan = bounds.getNe().getLatitude() - bounds.getSw().getLatitude();

        double x = (point.getLongitude() - bounds.getSw().getLongitude()) / lngSpan * width;
        double y = (bounds.getNe().getLatitude() - point.getLatitude()) / latSpan * height;

        return PixelPoint.of(
                clamp((int) Math.round(x), 0, width - 1),
                clamp((int) Math.round(y), 0, height - 1));
    }

    /**
     * 건물 경계 박스로부터 픽셀당 미터 계산
     * 경계가 없거나 잘못되면 50m x 50m / 500px 기본값 (fallback=true, 정밀도 낮음)
     */
    public static RealWorldScale computeRealWorldScale(int pixelWidth, int pixelHeight, GeoBoundingBox boundingBox) {
        if (pixelWidth <= 0 || pixelHeight <= 0) {
            logger.warn("픽셀 크기가 잘못됨 ({}x{}) → 기본 축척 사용", pixelWidth, pixelHeight);
            return fallbackScale();
        }
        if (boundingBox == null || !boundingBox.isComplete()) {
            logger.warn("건물 경계 박스 없음 → 기본 축척 사용");
            return fallbackScale(pixelWidth, pixelHeight);
        }

        BoxDimensions dims = boundingBoxDimensions(boundingBox);
        if (!(dims.getWidth() > 0) || !(dims.getLength() > 0)) {
            logger.warn("건물 경계 박스 크기가 0 이하 ({}m x {}m) → 기본 축척 사용",
                    dims.getWidth(), dims.getLength());
            return fallbackScale(pixelWidth, pixelHeight);
        }

        double metersPerPixelX = dims.getWidth() / pixelWidth;
        double metersPerPixelY = dims.getLength() / pixelHeight;

        logger.debug("실제 크기: {}m x {}m, 픽셀당 X={}m, Y={}m",
                String.format("%.2f", dims.getWidth()), String.format("%.2f", dims.getLength()),
                String.format("%.3f", metersPerPixelX), String.format("%.3f", metersPerPixelY));

        return RealWorldScale.builder()
                .metersPerPixelX(metersPerPixelX)
                .metersPerPixelY(metersPerPixelY)
                .pixelWidth(pixelWidth)
                .pixelHeight(pixelHeight)
                .widthMeters(dims.getWidth())
                .heightMeters(dims.getLength())
                .fallback(false)
                .build();
    }

    /**
     * 경계 박스의 동서 폭, 남북 길이 (미터)
     */
    public static BoxDimensions boundingBoxDimensions(GeoBoundingBox box) {
        if (box == null || !box.isComplete()) {
            return BoxDimensions.empty();
        }
        return boundingBoxDimensions(box.getMinLatitude(), box.getMaxLatitude(),
                box.getMinLongitude(), box.getMaxLongitude());
    }

    public static BoxDimensions boundingBoxDimensions(double minLat, double maxLat, double minLng, double maxLng) {
        double lat1 = Math.toRadians(minLat);
        double lat2 = Math.toRadians(maxLat);
        double dLng = Math.toRadians(maxLng - minLng);

        // 동서 폭은 평균 위도의 cos 로 보정
        double width = EARTH_RADIUS_M * Math.cos((lat1 + lat2) / 2) * Math.abs(dLng);
        double length = EARTH_RADIUS_M * Math.abs(lat2 - lat1);
        return new BoxDimensions(width, length);
    }

    static RealWorldScale fallbackScale() {
        return fallbackScale(FALLBACK_PIXELS, FALLBACK_PIXELS);
    }

    /**
     * 기본 축척 (픽셀당 0.1m) 에 실제 이미지 크기를 적용
     */
    static RealWorldScale fallbackScale(int pixelWidth, int pixelHeight) {
        double metersPerPixel = FALLBACK_SIZE_M / FALLBACK_PIXELS;
        return RealWorldScale.builder()
                .metersPerPixelX(metersPerPixel)
                .metersPerPixelY(metersPerPixel)
                .pixelWidth(pixelWidth)
                .pixelHeight(pixelHeight)
                .widthMeters(pixelWidth * metersPerPixel)
                .heightMeters(pixelHeight * metersPerPixel)
                .fallback(true)
                .build();
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
