package com.example.roofpanel.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 지붕 면 (단일 면 또는 여러 면을 합친 그룹)
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RoofFacet {

    /** 이 경사 이하이면 수평 지붕으로 본다 (도) */
    public static final double HORIZONTAL_PITCH_THRESHOLD = 5.0;

    @JsonProperty("id")
    private String id;

    @JsonProperty("pitch")
    private double pitchDegrees;

    @JsonProperty("azimuth")
    private double azimuthDegrees;

    @JsonProperty("area")
    private double areaM2;

    @JsonProperty("groundArea")
    private double groundAreaM2;

    @JsonProperty("center")
    private GeoPoint center;

    @JsonProperty("boundingBox")
    private GeoBoundingBox boundingBox;

    @JsonProperty("corners")
    @Builder.Default
    private List<GeoPoint> corners = new ArrayList<>();

    @JsonProperty("suitability")
    @Builder.Default
    private double suitability = 0.5;

    // 연간 일조시간 분위수 (0~10, 중앙값은 5번)
    @JsonProperty("sunshineQuantiles")
    @Builder.Default
    private List<Double> sunshineQuantiles = new ArrayList<>();

    // 그룹 정보 - 한 면은 최대 하나의 그룹에만 속한다
    @JsonProperty("groupId")
    private Integer groupId;

    @JsonProperty("isGroup")
    private boolean group;

    @JsonProperty("memberIds")
    @Builder.Default
    private List<String> memberIds = new ArrayList<>();

    // 이미지 좌표계 다각형
    @JsonProperty("pixelPolygon")
    @Builder.Default
    private List<PixelPoint> pixelPolygon = new ArrayList<>();

    @JsonProperty("isHorizontal")
    public boolean isHorizontal() {
        return pitchDegrees <= HORIZONTAL_PITCH_THRESHOLD;
    }

    /**
     * 방위각에서 얻은 8방위. 수평 지붕은 방향이 없으므로 null
     */
    @JsonProperty("orientation")
    public CompassDirection getOrientation() {
        return isHorizontal() ? null : CompassDirection.fromAzimuth(azimuthDegrees);
    }

    /**
     * 표시용 방향 문자열 (예: "South (180° E of N)")
     */
    @JsonProperty("orientationLabel")
    public String getOrientationLabel() {
        CompassDirection direction = getOrientation();
        if (direction == null) {
            return "Horizontal";
        }
        double normalized = ((azimuthDegrees % 360) + 360) % 360;
        String degreeInfo = normalized <= 180
                ? Math.round(normalized) + "° E of N"
                : Math.round(360 - normalized) + "° W of N";
        return direction.getLabel() + " (" + degreeInfo + ")";
    }

    @JsonIgnore
    public LayoutDirection getLayoutDirection() {
        CompassDirection direction = getOrientation();
        return direction != null ? direction.getLayoutDirection() : LayoutDirection.fromAzimuth(azimuthDegrees);
    }

    /**
     * 일조시간 중앙값, 없으면 null
     */
    @JsonIgnore
    public Double getMedianSunshineHours() {
        if (sunshineQuantiles == null || sunshineQuantiles.size() <= 5) {
            return null;
        }
        return sunshineQuantiles.get(5);
    }

    @JsonIgnore
    public boolean hasValidPolygon() {
        return pixelPolygon != null && pixelPolygon.size() >= 3;
    }
}
