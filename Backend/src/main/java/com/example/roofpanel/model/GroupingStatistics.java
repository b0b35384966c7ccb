package com.example.roofpanel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GroupingStatistics {
    @JsonProperty("originalFacetCount")
    int originalFacetCount;

    @JsonProperty("facetCount")
    int facetCount; // 필터 후 남은 면 (그룹 포함)

    @JsonProperty("groupCount")
    int groupCount;

    @JsonProperty("facetsInGroups")
    int facetsInGroups;

    @JsonProperty("filteredFacetCount")
    int filteredFacetCount;

    @JsonProperty("filteredGroupCount")
    int filteredGroupCount;

    @JsonProperty("minDimension")
    double minDimension;

    @JsonProperty("minArea")
    double minArea;

    @JsonProperty("maxAzimuthDiff")
    double maxAzimuthDiff;

    @JsonProperty("maxPitchDiff")
    double maxPitchDiff;
}
