package com.example.roofpanel.service;

import com.example.roofpanel.config.RoofAnalysisProperties;
import com.example.roofpanel.model.BoxDimensions;
import com.example.roofpanel.model.BuildingBounds;
import com.example.roofpanel.model.FacetGroup;
import com.example.roofpanel.model.GeoBoundingBox;
import com.example.roofpanel.model.GeoPoint;
import com.example.roofpanel.model.GroupingResult;
import com.example.roofpanel.model.GroupingStatistics;
import com.example.roofpanel.model.RoofFacet;
import com.example.roofpanel.util.AzimuthUtils;
import com.example.roofpanel.util.CoordinateMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 인접하고 방향/경사가 비슷한 지붕 면을 묶고, 너무 작은 면을 걸러낸다.
 * 작은 면도 묶이면 쓸 수 있으므로 크기 필터는 그룹화 뒤에 적용한다.
 */
@Service
public class FacetGroupingService {

    private static final Logger logger = LoggerFactory.getLogger(FacetGroupingService.class);

    // 위경도 비교 허용 오차 (도)
    static final double GEO_TOLERANCE = 0.0000001;

    private final RoofAnalysisProperties properties;

    public FacetGroupingService(RoofAnalysisProperties properties) {
        this.properties = properties;
    }

    /**
     * 그룹화 후 크기 필터 적용
     */
    public GroupingResult groupAndFilter(List<RoofFacet> facets) {
        RoofAnalysisProperties.Grouping config = properties.getGrouping();

        List<RoofFacet> candidates = new ArrayList<>();
        List<FacetGroup> groups = new ArrayList<>();
        int facetsInGroups = 0;

        if (config.isEnabled() && facets.size() > 1) {
            List<List<Integer>> components = findComponents(facets);

            for (List<Integer> component : components) {
                if (component.size() == 1) {
                    candidates.add(facets.get(component.get(0)).toBuilder().groupId(null).build());
                    continue;
                }
                int groupId = groups.size();
                List<RoofFacet> members = component.stream().map(facets::get).collect(Collectors.toList());
                RoofFacet combined = combine(members, groupId);
                groups.add(new FacetGroup(groupId, combined.getMemberIds(), combined));
                facetsInGroups += members.size();
            }
            // 그룹은 개별 면 뒤에 추가
            groups.forEach(g -> candidates.add(g.getCombinedFacet()));

            if (groups.isEmpty()) {
                logger.info("묶을 수 있는 면 없음 → 원래 면 그대로 사용");
            } else {
                logger.info("{}개 면으로 {}개 그룹 생성", facetsInGroups, groups.size());
            }
        } else {
            candidates.addAll(facets);
        }

        // 크기 필터
        List<RoofFacet> finalFacets = new ArrayList<>();
        int filteredFacetCount = 0;
        int filteredGroupCount = 0;

        for (RoofFacet facet : candidates) {
            BoxDimensions dims = CoordinateMapper.boundingBoxDimensions(facet.getBoundingBox());
            if (dims.getMinDimension() < config.getMinDimension() || facet.getAreaM2() < config.getMinArea()) {
                logger.debug("면 {} 제외: 짧은 변 {}m, 면적 {}m²", facet.getId(),
                        String.format("%.2f", dims.getMinDimension()), String.format("%.2f", facet.getAreaM2()));
                if (facet.isGroup()) {
                    filteredGroupCount++;
                    filteredFacetCount += facet.getMemberIds().size();
                } else {
                    filteredFacetCount++;
                }
                continue;
            }
            finalFacets.add(facet);
        }

        logger.info("지붕 면 {}개 처리 완료 (제외: 면 {}개, 그룹 {}개)",
                finalFacets.size(), filteredFacetCount, filteredGroupCount);

        GroupingStatistics statistics = GroupingStatistics.builder()
                .originalFacetCount(facets.size())
                .facetCount(finalFacets.size())
                .groupCount(groups.size())
                .facetsInGroups(facetsInGroups)
                .filteredFacetCount(filteredFacetCount)
                .filteredGroupCount(filteredGroupCount)
                .minDimension(config.getMinDimension())
                .minArea(config.getMinArea())
                .maxAzimuthDiff(config.getMaxAzimuthDiff())
                .maxPitchDiff(config.getMaxPitchDiff())
                .build();

        return new GroupingResult(finalFacets, groups, statistics);
    }

    /**
     * 호환(방향/경사) ∧ 인접 관계의 연결 요소. 재귀 대신 스택으로 탐색한다.
     */
    List<List<Integer>> findComponents(List<RoofFacet> facets) {
        int n = facets.size();

        // 인덱스 기반 인접 리스트
        List<List<Integer>> adjacency = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            adjacency.add(new ArrayList<>());
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                RoofFacet a = facets.get(i);
                RoofFacet b = facets.get(j);
                if (areCompatible(a, b) && areAdjacent(a, b)) {
                    adjacency.get(i).add(j);
                    adjacency.get(j).add(i);
                }
            }
        }

        boolean[] visited = new boolean[n];
        List<List<Integer>> components = new ArrayList<>();

        for (int seed = 0; seed < n; seed++) {
            if (visited[seed]) {
                continue;
            }
            List<Integer> component = new ArrayList<>();
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(seed);
            visited[seed] = true;

            while (!stack.isEmpty()) {
                int current = stack.pop();
                component.add(current);
                List<Integer> neighbours = adjacency.get(current);
                // 역순으로 넣어 낮은 인덱스부터 방문
                for (int k = neighbours.size() - 1; k >= 0; k--) {
                    int next = neighbours.get(k);
                    if (!visited[next]) {
                        visited[next] = true;
                        stack.push(next);
                    }
                }
            }
            components.add(component);
        }
        return components;
    }

    /**
     * 방위각 원형 차이와 경사 차이가 모두 기준 이내인지
     */
    public boolean areCompatible(RoofFacet a, RoofFacet b) {
        RoofAnalysisProperties.Grouping config = properties.getGrouping();
        double azimuthDiff = AzimuthUtils.circularDifference(a.getAzimuthDegrees(), b.getAzimuthDegrees());
        double pitchDiff = Math.abs(a.getPitchDegrees() - b.getPitchDegrees());
        return azimuthDiff <= config.getMaxAzimuthDiff() && pitchDiff <= config.getMaxPitchDiff();
    }

    /**
     * 경계 박스가 겹치거나 맞닿는지 (작은 허용 오차 포함)
     */
    public boolean areAdjacent(RoofFacet a, RoofFacet b) {
        GeoBoundingBox box1 = a.getBoundingBox();
        GeoBoundingBox box2 = b.getBoundingBox();
        if (box1 == null || box2 == null || !box1.isComplete() || !box2.isComplete()) {
            return false;
        }

        boolean overlapX = box1.getMinLongitude() - GEO_TOLERANCE <= box2.getMaxLongitude()
                && box2.getMinLongitude() - GEO_TOLERANCE <= box1.getMaxLongitude();
        boolean overlapY = box1.getMinLatitude() - GEO_TOLERANCE <= box2.getMaxLatitude()
                && box2.getMinLatitude() - GEO_TOLERANCE <= box1.getMaxLatitude();
        return overlapX && overlapY;
    }

    /**
     * 여러 면을 하나의 합성 면으로 합친다 (면적 가중 평균)
     */
    RoofFacet combine(List<RoofFacet> members, int groupId) {
        double totalArea = members.stream().mapToDouble(RoofFacet::getAreaM2).sum();
        boolean equalWeights = totalArea <= 0;

        double weightSum = 0;
        double pitchSum = 0;
        double suitabilitySum = 0;
        double groundArea = 0;
        double centerLatSum = 0;
        double centerLngSum = 0;
        int centerCount = 0;
        double[] azimuths = new double[members.size()];
        double[] weights = new double[members.size()];
        List<GeoPoint> allCorners = new ArrayList<>();
        List<GeoPoint> extentPoints = new ArrayList<>();
        List<String> memberIds = new ArrayList<>();

        for (int i = 0; i < members.size(); i++) {
            RoofFacet member = members.get(i);
            double weight = equalWeights ? 1.0 : member.getAreaM2();
            weightSum += weight;
            pitchSum += member.getPitchDegrees() * weight;
            suitabilitySum += member.getSuitability() * weight;
            groundArea += member.getGroundAreaM2();
            azimuths[i] = member.getAzimuthDegrees();
            weights[i] = weight;

            if (member.getCenter() != null) {
                centerLatSum += member.getCenter().getLatitude();
                centerLngSum += member.getCenter().getLongitude();
                centerCount++;
            }
            if (member.getCorners() != null) {
                allCorners.addAll(member.getCorners());
            }
            if (member.getBoundingBox() != null && member.getBoundingBox().isComplete()) {
                extentPoints.add(member.getBoundingBox().getSw());
                extentPoints.add(member.getBoundingBox().getNe());
            }
            memberIds.add(member.getId());
        }

        List<GeoPoint> corners = removeDuplicatePoints(allCorners);
        extentPoints.addAll(corners);
        GeoBoundingBox boundingBox = extentOf(extentPoints);

        double suitability = Math.max(0, Math.min(1, suitabilitySum / weightSum));

        return RoofFacet.builder()
                .id("group_" + groupId)
                .groupId(groupId)
                .group(true)
                .memberIds(memberIds)
                .pitchDegrees(pitchSum / weightSum)
                .azimuthDegrees(AzimuthUtils.circularMean(azimuths, weights))
                .areaM2(totalArea)
                .groundAreaM2(groundArea)
                .center(centerCount > 0 ? new GeoPoint(centerLatSum / centerCount, centerLngSum / centerCount) : null)
                .corners(corners)
                .boundingBox(boundingBox)
                .suitability(suitability)
                .build();
    }

    /**
     * 허용 오차 안에서 같은 점 제거 (첫 등장 순서 유지)
     */
    static List<GeoPoint> removeDuplicatePoints(List<GeoPoint> points) {
        List<GeoPoint> unique = new ArrayList<>();
        for (GeoPoint point : points) {
            boolean duplicate = false;
            for (GeoPoint existing : unique) {
                if (Math.abs(point.getLatitude() - existing.getLatitude()) < GEO_TOLERANCE
                        && Math.abs(point.getLongitude() - existing.getLongitude()) < GEO_TOLERANCE) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) {
                unique.add(point);
            }
        }
        return unique;
    }

    private static GeoBoundingBox extentOf(List<GeoPoint> corners) {
        if (corners.isEmpty()) {
            return null;
        }
        double minLat = 90, maxLat = -90, minLng = 180, maxLng = -180;
        for (GeoPoint corner : corners) {
            minLat = Math.min(minLat, corner.getLatitude());
            maxLat = Math.max(maxLat, corner.getLatitude());
            minLng = Math.min(minLng, corner.getLongitude());
            maxLng = Math.max(maxLng, corner.getLongitude());
        }
        return new GeoBoundingBox(new GeoPoint(minLat, minLng), new GeoPoint(maxLat, maxLng));
    }

    /**
     * 건물 전체 위경도 범위 (5% 여유 포함)
     * 면이 없거나 위경도 정보가 없으면 null
     */
    public BuildingBounds buildingBounds(List<RoofFacet> facets) {
        if (facets.isEmpty()) {
            return null;
        }
        double north = -90, south = 90, east = -180, west = 180;
        int pointCount = 0;

        for (RoofFacet facet : facets) {
            List<GeoPoint> points = new ArrayList<>();
            if (facet.getCorners() != null) {
                points.addAll(facet.getCorners());
            }
            GeoBoundingBox box = facet.getBoundingBox();
            if (box != null) {
                if (box.getNe() != null) {
                    points.add(box.getNe());
                }
                if (box.getSw() != null) {
                    points.add(box.getSw());
                }
            }
            if (facet.getCenter() != null) {
                points.add(facet.getCenter());
            }
            for (GeoPoint p : points) {
                if (p == null) {
                    continue;
                }
                pointCount++;
                north = Math.max(north, p.getLatitude());
                south = Math.min(south, p.getLatitude());
                east = Math.max(east, p.getLongitude());
                west = Math.min(west, p.getLongitude());
            }
        }

        // 위경도 정보가 하나도 없으면 범위를 만들 수 없음
        if (pointCount == 0) {
            return null;
        }

        double latBuffer = (north - south) * 0.05;
        double lngBuffer = (east - west) * 0.05;
        return new BuildingBounds(north + latBuffer, south - latBuffer, east + lngBuffer, west - lngBuffer);
    }
}
