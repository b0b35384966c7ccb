package com.example.roofpanel.service;

import com.example.roofpanel.config.RoofAnalysisProperties;
import com.example.roofpanel.model.GeoBoundingBox;
import com.example.roofpanel.model.GeoPoint;
import com.example.roofpanel.model.PixelPoint;
import com.example.roofpanel.model.RoofFacet;
import com.example.roofpanel.util.CoordinateMapper;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 면 꼭짓점(위경도)을 이미지 픽셀 다각형으로 변환
 */
@Service
public class FacetProjectionService {

    private static final Logger logger = LoggerFactory.getLogger(FacetProjectionService.class);

    private final RoofAnalysisProperties properties;
    private final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING), 0);

    public FacetProjectionService(RoofAnalysisProperties properties) {
        this.properties = properties;
    }

    /**
     * 픽셀 다각형이 없는 면만 변환해서 새 목록으로 반환
     */
    public List<RoofFacet> project(List<RoofFacet> facets, GeoBoundingBox imageBounds, int width, int height) {
        List<RoofFacet> projected = new ArrayList<>();
        for (RoofFacet facet : facets) {
            if (facet.hasValidPolygon()) {
                projected.add(facet);
                continue;
            }
            List<PixelPoint> polygon = toPixelPolygon(facet, imageBounds, width, height);
            projected.add(facet.toBuilder().pixelPolygon(polygon).build());
        }
        return projected;
    }

    public List<PixelPoint> toPixelPolygon(RoofFacet facet, GeoBoundingBox imageBounds, int width, int height) {
        List<GeoPoint> corners = facet.getCorners();
        if (corners == null || corners.isEmpty()) {
            // 꼭짓점이 없으면 경계 박스 네 모서리 사용
            GeoBoundingBox box = facet.getBoundingBox();
            if (box == null || !box.isComplete()) {
                logger.warn("면 {} - 꼭짓점과 경계 박스가 모두 없어 다각형 생성 불가", facet.getId());
                return new ArrayList<>();
            }
            corners = box.toCorners();
        }

        List<PixelPoint> points = new ArrayList<>();
        for (GeoPoint corner : corners) {
            points.add(CoordinateMapper.geoToPixel(corner, imageBounds, width, height));
        }

        if (facet.isGroup() && properties.getGrouping().getOutline() == RoofAnalysisProperties.GroupOutline.CONVEX_HULL) {
            return convexHull(points);
        }
        return points;
    }

    /**
     * 점 집합의 볼록 껍질 (닫는 점 제외). 면적이 없으면 입력 그대로 반환
     */
    List<PixelPoint> convexHull(List<PixelPoint> points) {
        Coordinate[] coords = new Coordinate[points.size()];
        for (int i = 0; i < points.size(); i++) {
            coords[i] = new Coordinate(points.get(i).getX(), points.get(i).getY());
        }
        Geometry hull = geometryFactory.createMultiPointFromCoords(coords).convexHull();
        if (!(hull instanceof Polygon)) {
            logger.debug("볼록 껍질이 다각형이 아님 ({}), 꼭짓점 그대로 사용", hull.getGeometryType());
            return points;
        }

        Coordinate[] ring = ((Polygon) hull).getExteriorRing().getCoordinates();
        List<PixelPoint> result = new ArrayList<>();
        for (int i = 0; i < ring.length - 1; i++) {
            result.add(PixelPoint.of((int) Math.round(ring[i].x), (int) Math.round(ring[i].y)));
        }
        return result;
    }
}
