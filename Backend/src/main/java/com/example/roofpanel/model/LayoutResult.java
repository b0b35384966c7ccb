package com.example.roofpanel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class LayoutResult {
    @JsonProperty("panels")
    List<Panel> panels;

    @JsonProperty("obstructions")
    List<Obstruction> obstructions;

    @JsonProperty("metadata")
    LayoutMetadata metadata;
}
