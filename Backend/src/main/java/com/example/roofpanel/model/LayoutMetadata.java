package com.example.roofpanel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LayoutMetadata {
    @JsonProperty("panelCount")
    int panelCount;

    @JsonProperty("obstructionCount")
    int obstructionCount;

    @JsonProperty("totalArea")
    double totalArea; // m²

    @JsonProperty("potentialKw")
    double potentialKw;

    @JsonProperty("panelWidth")
    double panelWidth;

    @JsonProperty("panelHeight")
    double panelHeight;

    @JsonProperty("panelSpacing")
    double panelSpacing;

    @JsonProperty("facets")
    List<FacetLayoutSummary> facetSummaries;

    @JsonProperty("skippedFacetIds")
    List<String> skippedFacetIds;

    @JsonProperty("failures")
    List<FacetFailure> failures;
}
