package com.example.roofpanel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * 면별로 선택된 배치 요약
 */
@Value
public class FacetLayoutSummary {
    @JsonProperty("facetId")
    String facetId;

    @JsonProperty("panelCount")
    int panelCount;

    @JsonProperty("orientation")
    PanelOrientation orientation;

    @JsonProperty("strategy")
    GridStrategy strategy;

    @JsonProperty("startPoint")
    StartCorner startCorner;

    @JsonProperty("layoutDirection")
    LayoutDirection layoutDirection;

    @JsonProperty("candidateCount")
    int candidateCount;
}
