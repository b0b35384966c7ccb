package com.example.roofpanel.model;

import lombok.Value;

import java.util.List;

/**
 * 한 면에 대한 배치 후보 하나의 결과
 */
@Value
public class LayoutCandidate {
    PanelOrientation orientation;
    GridStrategy strategy;
    StartCorner startCorner;
    List<Panel> panels;
    List<Obstruction> obstructions;

    public int getPanelCount() {
        return panels.size();
    }

    public static LayoutCandidate empty() {
        return new LayoutCandidate(null, null, null, List.of(), List.of());
    }
}
