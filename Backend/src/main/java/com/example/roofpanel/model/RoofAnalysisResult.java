package com.example.roofpanel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class RoofAnalysisResult {
    @JsonProperty("roofSegments")
    List<RoofFacet> facets;

    @JsonProperty("groups")
    List<FacetGroup> groups;

    @JsonProperty("grouping")
    GroupingStatistics groupingStatistics;

    @JsonProperty("dimensions")
    RealWorldScale scale;

    @JsonProperty("bounds")
    BuildingBounds bounds;

    @JsonProperty("layout")
    LayoutResult layout;
}
