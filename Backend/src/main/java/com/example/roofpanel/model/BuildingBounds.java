package com.example.roofpanel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class BuildingBounds {
    @JsonProperty("north")
    double north;

    @JsonProperty("south")
    double south;

    @JsonProperty("east")
    double east;

    @JsonProperty("west")
    double west;

    public GeoBoundingBox toBoundingBox() {
        return new GeoBoundingBox(new GeoPoint(south, west), new GeoPoint(north, east));
    }
}
