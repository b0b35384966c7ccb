package com.example.roofpanel.model;

import lombok.Value;

import java.util.List;

@Value
public class GroupingResult {
    List<RoofFacet> facets;
    List<FacetGroup> groups;
    GroupingStatistics statistics;
}
