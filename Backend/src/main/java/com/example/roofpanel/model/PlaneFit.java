package com.example.roofpanel.model;

import lombok.Value;

/**
 * 최소제곱 평면 z = a*x + b*y + c 의 기울기 결과
 */
@Value
public class PlaneFit {
    double a;
    double b;
    double slope;       // tan(경사각)
    boolean degenerate; // 행렬식이 0에 가까워 대체 경사를 사용한 경우

    public double getSlopeDegrees() {
        return Math.toDegrees(Math.atan(slope));
    }
}
