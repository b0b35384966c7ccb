package com.example.roofpanel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * 인접하고 방향/경사가 비슷한 면들의 묶음
 */
@Value
public class FacetGroup {
    @JsonProperty("id")
    int id;

    @JsonProperty("memberIds")
    List<String> memberIds;

    // 그룹을 대표하는 합성 면
    @JsonProperty("combinedFacet")
    RoofFacet combinedFacet;
}
