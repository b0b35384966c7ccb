package com.example.roofpanel.model;

import com.example.roofpanel.exception.FacetProcessingException;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class FacetFailure {
    @JsonProperty("facetId")
    String facetId;

    @JsonProperty("error")
    String message;

    public static FacetFailure from(FacetProcessingException failure) {
        return new FacetFailure(failure.getFacetId(), failure.getMessage());
    }
}
