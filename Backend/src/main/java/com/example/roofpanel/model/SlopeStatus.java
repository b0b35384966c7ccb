package com.example.roofpanel.model;

public enum SlopeStatus {
    VALID,
    LOCAL_VARIANCE,
    GLOBAL_MISMATCH,
    INSUFFICIENT_DATA
}
