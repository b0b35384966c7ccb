package com.example.roofpanel.util;

/**
 * 방위각(0~360°) 원형 계산
 */
public class AzimuthUtils {

    private AzimuthUtils() {
    }

    public static double normalize(double azimuthDegrees) {
        return ((azimuthDegrees % 360) + 360) % 360;
    }

    /**
     * 두 방위각의 원형 차이 (0~180°)
     */
    public static double circularDifference(double a, double b) {
        double diff = Math.abs(normalize(a) - normalize(b));
        return diff > 180 ? 360 - diff : diff;
    }

    /**
     * 가중 원형 평균. sin/cos 합을 atan2 로 되돌려 0°/360° 경계 문제를 피한다.
     */
    public static double circularMean(double[] azimuths, double[] weights) {
        if (azimuths.length != weights.length) {
            throw new IllegalArgumentException("방위각과 가중치 개수가 다름");
        }
        double sinSum = 0;
        double cosSum = 0;
        for (int i = 0; i < azimuths.length; i++) {
            double rad = Math.toRadians(azimuths[i]);
            sinSum += Math.sin(rad) * weights[i];
            cosSum += Math.cos(rad) * weights[i];
        }
        return normalize(Math.toDegrees(Math.atan2(sinSum, cosSum)));
    }
}
