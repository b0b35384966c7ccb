package com.example.roofpanel.service;

import com.example.roofpanel.model.ElevationRaster;
import com.example.roofpanel.model.ElevationSample;
import com.example.roofpanel.model.PlaneFit;
import com.example.roofpanel.model.RealWorldScale;
import com.example.roofpanel.model.SlopeCheckResult;
import com.example.roofpanel.model.SlopeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * DSM 고도값으로 블록의 경사가 지붕 경사와 맞는지 검사
 */
@Service
public class SlopeValidationService {

    private static final Logger logger = LoggerFactory.getLogger(SlopeValidationService.class);

    static final int SAMPLES_PER_AXIS = 3;
    static final int MIN_SAMPLES = 4;
    static final double SINGULAR_DETERMINANT = 1e-10;

    /**
     * 최소제곱 평면 근사. 픽셀 좌표는 미터로 변환해서 계산한다.
     * 행렬식이 0에 가까우면 고도 범위 / 수평 거리로 경사를 대신 구한다.
     */
    public PlaneFit fitPlane(List<ElevationSample> samples, RealWorldScale scale) {
        if (samples == null || samples.size() < MIN_SAMPLES) {
            throw new IllegalArgumentException("평면 근사에는 최소 " + MIN_SAMPLES + "개 샘플이 필요함");
        }

        int n = samples.size();
        double[] xs = new double[n];
        double[] ys = new double[n];
        double[] zs = new double[n];
        double cx = 0, cy = 0, cz = 0;

        for (int i = 0; i < n; i++) {
            ElevationSample s = samples.get(i);
            xs[i] = s.getX() * scale.getMetersPerPixelX();
            ys[i] = s.getY() * scale.getMetersPerPixelY();
            zs[i] = s.getZ();
            cx += xs[i];
            cy += ys[i];
            cz += zs[i];
        }
        cx /= n;
        cy /= n;
        cz /= n;

        // 중심 기준 공분산 합
        double xx = 0, xy = 0, xz = 0, yy = 0, yz = 0;
        for (int i = 0; i < n; i++) {
            double dx = xs[i] - cx;
            double dy = ys[i] - cy;
            double dz = zs[i] - cz;
            xx += dx * dx;
            xy += dx * dy;
            xz += dx * dz;
            yy += dy * dy;
            yz += dy * dz;
        }

        double det = xx * yy - xy * xy;
        if (Math.abs(det) < SINGULAR_DETERMINANT) {
            return new PlaneFit(0, 0, rangeSlope(xs, ys, zs), true);
        }

        // [xx xy; xy yy] [a b]^T = [xz yz]^T
        double a = (xz * yy - yz * xy) / det;
        double b = (yz * xx - xz * xy) / det;
        return new PlaneFit(a, b, Math.sqrt(a * a + b * b), false);
    }

    /**
     * 블록 경사 검사
     *
     * @param raster                DSM 래스터 (null 이면 항상 통과)
     * @param x                     블록 좌상단 x (픽셀)
     * @param y                     블록 좌상단 y (픽셀)
     * @param width                 블록 폭 (픽셀)
     * @param height                블록 높이 (픽셀)
     * @param scale                 픽셀당 미터
     * @param baselineSlope         지붕 경사 tan(pitch)
     * @param maxLocalDeviation     국소 경사 허용 차이 (도)
     * @param maxGlobalDeviation    평면 근사 경사 허용 차이 (도)
     */
    public SlopeCheckResult checkBlockSlope(ElevationRaster raster, int x, int y, int width, int height,
                                            RealWorldScale scale, double baselineSlope,
                                            double maxLocalDeviation, double maxGlobalDeviation) {
        if (raster == null || scale == null) {
            return SlopeCheckResult.insufficientData(baselineSlope, 0);
        }

        // 3x3 격자로 샘플링
        List<ElevationSample> samples = new ArrayList<>();
        double minHeight = Double.POSITIVE_INFINITY;
        double maxHeight = Double.NEGATIVE_INFINITY;

        for (int sy = 0; sy < SAMPLES_PER_AXIS; sy++) {
            for (int sx = 0; sx < SAMPLES_PER_AXIS; sx++) {
                int px = x + Math.floorDiv(sx * width, SAMPLES_PER_AXIS - 1);
                int py = y + Math.floorDiv(sy * height, SAMPLES_PER_AXIS - 1);

                double value = raster.valueAt(px, py);
                if (Double.isNaN(value)) {
                    continue;
                }
                samples.add(new ElevationSample(px, py, value));
                minHeight = Math.min(minHeight, value);
                maxHeight = Math.max(maxHeight, value);
            }
        }

        if (samples.size() < MIN_SAMPLES) {
            logger.trace("블록 ({}, {}) 유효 샘플 부족: {}개", x, y, samples.size());
            return SlopeCheckResult.insufficientData(baselineSlope, samples.size());
        }

        // 1) 국소 일관성: 최대-최소 고도차 / 대각선 길이
        double diagonal = Math.hypot(width * scale.getMetersPerPixelX(), height * scale.getMetersPerPixelY());
        double localVarianceSlope = diagonal > 0 ? (maxHeight - minHeight) / diagonal : 0;

        // 2) 전체 경사: 평면 근사
        PlaneFit plane = fitPlane(samples, scale);

        double baselineAngle = Math.toDegrees(Math.atan(baselineSlope));
        double localAngle = Math.toDegrees(Math.atan(localVarianceSlope));
        double avgAngle = plane.getSlopeDegrees();

        double localDeviation = Math.abs(localAngle - baselineAngle);
        double globalDeviation = Math.abs(avgAngle - baselineAngle);

        boolean localValid = localDeviation <= maxLocalDeviation;
        boolean globalValid = globalDeviation <= maxGlobalDeviation;

        SlopeStatus status;
        if (!localValid) {
            status = SlopeStatus.LOCAL_VARIANCE;
        } else if (!globalValid) {
            status = SlopeStatus.GLOBAL_MISMATCH;
        } else {
            status = SlopeStatus.VALID;
        }

        return SlopeCheckResult.builder()
                .valid(localValid && globalValid)
                .status(status)
                .localDeviation(localDeviation)
                .globalDeviation(globalDeviation)
                .avgSlope(plane.getSlope())
                .baselineAngle(baselineAngle)
                .avgAngle(avgAngle)
                .sampleCount(samples.size())
                .build();
    }

    /**
     * 평면을 풀 수 없을 때 쓰는 대체 경사 (고도 범위 / 수평 범위 대각선)
     */
    private static double rangeSlope(double[] xs, double[] ys, double[] zs) {
        double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        double minZ = Double.POSITIVE_INFINITY, maxZ = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < xs.length; i++) {
            minX = Math.min(minX, xs[i]);
            maxX = Math.max(maxX, xs[i]);
            minY = Math.min(minY, ys[i]);
            maxY = Math.max(maxY, ys[i]);
            minZ = Math.min(minZ, zs[i]);
            maxZ = Math.max(maxZ, zs[i]);
        }
        double extent = Math.hypot(maxX - minX, maxY - minY);
        return extent > 0 ? (maxZ - minZ) / extent : 0;
    }
}
