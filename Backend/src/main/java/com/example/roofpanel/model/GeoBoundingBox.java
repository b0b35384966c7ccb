package com.example.roofpanel.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GeoBoundingBox {
    @JsonProperty("sw")
    private GeoPoint sw; // 남서쪽 모서리

    @JsonProperty("ne")
    private GeoPoint ne; // 북동쪽 모서리

    /**
     * 두 모서리가 모두 있는지 여부
     */
    @JsonIgnore
    public boolean isComplete() {
        return sw != null && ne != null;
    }

    @JsonIgnore
    public double getMinLatitude() {
        return Math.min(sw.getLatitude(), ne.getLatitude());
    }

    @JsonIgnore
    public double getMaxLatitude() {
        return Math.max(sw.getLatitude(), ne.getLatitude());
    }

    @JsonIgnore
    public double getMinLongitude() {
        return Math.min(sw.getLongitude(), ne.getLongitude());
    }

    @JsonIgnore
    public double getMaxLongitude() {
        return Math.max(sw.getLongitude(), ne.getLongitude());
    }

    /**
     * 박스 네 모서리 (남서, 남동, 북동, 북서 순)
     */
    @JsonIgnore
    public List<GeoPoint> toCorners() {
        return List.of(
                sw,
                new GeoPoint(sw.getLatitude(), ne.getLongitude()),
                ne,
                new GeoPoint(ne.getLatitude(), sw.getLongitude())
        );
    }
}
