package com.example.roofpanel.model;

public enum PanelOrientation {
    PORTRAIT,
    LANDSCAPE
}
