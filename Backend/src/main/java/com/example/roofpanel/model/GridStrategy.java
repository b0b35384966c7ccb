package com.example.roofpanel.model;

public enum GridStrategy {
    STANDARD,
    STAGGERED // 홀수 행을 패널 폭의 절반만큼 이동
}
