package com.example.roofpanel.service;

import com.example.roofpanel.config.RoofAnalysisProperties;
import com.example.roofpanel.exception.FacetProcessingException;
import com.example.roofpanel.exception.FacetValidationException;
import com.example.roofpanel.model.ElevationRaster;
import com.example.roofpanel.model.FacetFailure;
import com.example.roofpanel.model.FacetLayoutSummary;
import com.example.roofpanel.model.GridStrategy;
import com.example.roofpanel.model.LayoutCandidate;
import com.example.roofpanel.model.LayoutDirection;
import com.example.roofpanel.model.LayoutMetadata;
import com.example.roofpanel.model.LayoutResult;
import com.example.roofpanel.model.Obstruction;
import com.example.roofpanel.model.ObstructionType;
import com.example.roofpanel.model.Panel;
import com.example.roofpanel.model.PanelOrientation;
import com.example.roofpanel.model.PixelBoundingBox;
import com.example.roofpanel.model.PixelPoint;
import com.example.roofpanel.model.RealWorldScale;
import com.example.roofpanel.model.RoofFacet;
import com.example.roofpanel.model.SlopeCheckResult;
import com.example.roofpanel.model.StartCorner;
import com.example.roofpanel.util.GeometryUtils;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 면마다 20가지 배치 후보(세로/가로 × 일반/엇갈림 × 시작점 5곳)를 계산하고
 * 패널이 가장 많은 후보를 고른다.
 */
@Service
public class PanelLayoutService {

    private static final Logger logger = LoggerFactory.getLogger(PanelLayoutService.class);

    static final int CANDIDATE_COUNT =
            PanelOrientation.values().length * GridStrategy.values().length * StartCorner.values().length;

    private final SlopeValidationService slopeValidationService;
    private final RoofAnalysisProperties properties;
    private final ExecutorService executorService;

    public PanelLayoutService(SlopeValidationService slopeValidationService, RoofAnalysisProperties properties) {
        this.slopeValidationService = slopeValidationService;
        this.properties = properties;
        int threads = properties.getPanel().getCandidateThreads();
        this.executorService = threads > 1 ? Executors.newFixedThreadPool(threads) : null;
    }

    /**
     * 배치 후보 하나의 조건
     */
    static final class CandidateSpec {
        final PanelOrientation orientation;
        final GridStrategy strategy;
        final StartCorner startCorner;

        CandidateSpec(PanelOrientation orientation, GridStrategy strategy, StartCorner startCorner) {
            this.orientation = orientation;
            this.strategy = strategy;
            this.startCorner = startCorner;
        }
    }

    /**
     * 전체 면에 대해 최적 배치 계산
     *
     * @param facets       분석할 면 (픽셀 다각형 포함)
     * @param obstructions 이미 알려진 장애물
     * @param scale        픽셀당 미터
     * @param raster       DSM (없으면 경사 검사 생략)
     */
    public LayoutResult optimize(List<RoofFacet> facets, List<Obstruction> obstructions,
                                 RealWorldScale scale, ElevationRaster raster) {
        logger.info("태양광 패널 최적 배치 계산 시작: 면 {}개, 기존 장애물 {}개",
                facets.size(), obstructions == null ? 0 : obstructions.size());

        List<Panel> panels = new ArrayList<>();
        List<Obstruction> allObstructions = new ArrayList<>();
        if (obstructions != null) {
            allObstructions.addAll(obstructions);
        }
        List<FacetLayoutSummary> summaries = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<FacetFailure> failures = new ArrayList<>();

        for (RoofFacet facet : facets) {
            try {
                List<Obstruction> facetObstructions = obstructionsOf(facet.getId(), allObstructions);
                LayoutCandidate best = optimizeFacet(facet, facetObstructions, scale, raster);

                panels.addAll(best.getPanels());
                allObstructions.addAll(best.getObstructions());
                summaries.add(new FacetLayoutSummary(facet.getId(), best.getPanelCount(), best.getOrientation(),
                        best.getStrategy(), best.getStartCorner(), facet.getLayoutDirection(), CANDIDATE_COUNT));

                logger.info("면 {} 최적 배치: 패널 {}개, {} / {} / {}", facet.getId(), best.getPanelCount(),
                        best.getOrientation(), best.getStrategy(), best.getStartCorner());
            } catch (FacetValidationException e) {
                logger.warn("면 건너뜀 - {}", e.getMessage());
                skipped.add(facet.getId());
            } catch (RuntimeException e) {
                FacetProcessingException failure = new FacetProcessingException(facet.getId(), e);
                logger.error(failure.getMessage(), e);
                failures.add(FacetFailure.from(failure));
            }
        }

        RoofAnalysisProperties.PanelSpec spec = properties.getPanel();
        double totalArea = panels.stream().mapToDouble(Panel::getRealArea).sum();
        double potentialKw = totalArea * spec.getEfficiency() * spec.getIrradiance() / 1000;

        logger.info("배치 완료: 패널 {}개, 장애물 {}개, 면적 {}m², 예상 출력 {}kW",
                panels.size(), allObstructions.size(),
                String.format("%.2f", totalArea), String.format("%.2f", potentialKw));

        LayoutMetadata metadata = LayoutMetadata.builder()
                .panelCount(panels.size())
                .obstructionCount(allObstructions.size())
                .totalArea(round2(totalArea))
                .potentialKw(round2(potentialKw))
                .panelWidth(spec.getWidth())
                .panelHeight(spec.getHeight())
                .panelSpacing(spec.getSpacing())
                .facetSummaries(summaries)
                .skippedFacetIds(skipped)
                .failures(failures)
                .build();

        return new LayoutResult(panels, allObstructions, metadata);
    }

    /**
     * 한 면의 20개 후보 중 패널이 가장 많은 배치 (동점이면 먼저 나온 후보)
     */
    public LayoutCandidate optimizeFacet(RoofFacet facet, List<Obstruction> obstructions,
                                         RealWorldScale scale, ElevationRaster raster) {
        if (!facet.hasValidPolygon()) {
            throw new FacetValidationException(facet.getId(), "유효한 다각형이 없음 (꼭짓점 3개 미만)");
        }

        PixelBoundingBox bounds = GeometryUtils.polygonBounds(facet.getPixelPolygon())
                .clampTo(scale.getPixelWidth(), scale.getPixelHeight());
        LayoutDirection direction = facet.getLayoutDirection();

        logger.debug("면 {} - 경사 {}°, 방위각 {}°, 방향 {}, 배치 {}", facet.getId(),
                facet.getPitchDegrees(), facet.getAzimuthDegrees(), facet.getOrientationLabel(), direction);

        List<CandidateSpec> specs = enumerateCandidates();
        List<LayoutCandidate> results = evaluate(specs, facet, obstructions, bounds, direction, scale, raster);

        LayoutCandidate best = LayoutCandidate.empty();
        for (LayoutCandidate candidate : results) {
            if (candidate.getPanelCount() > best.getPanelCount() || best.getOrientation() == null) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * 세로 → 가로, 시작점마다 일반 → 엇갈림 순서
     */
    static List<CandidateSpec> enumerateCandidates() {
        List<CandidateSpec> specs = new ArrayList<>();
        for (PanelOrientation orientation : PanelOrientation.values()) {
            for (StartCorner corner : StartCorner.values()) {
                specs.add(new CandidateSpec(orientation, GridStrategy.STANDARD, corner));
                specs.add(new CandidateSpec(orientation, GridStrategy.STAGGERED, corner));
            }
        }
        return specs;
    }

    private List<LayoutCandidate> evaluate(List<CandidateSpec> specs, RoofFacet facet, List<Obstruction> obstructions,
                                           PixelBoundingBox bounds, LayoutDirection direction,
                                           RealWorldScale scale, ElevationRaster raster) {
        if (executorService == null) {
            return specs.stream()
                    .map(candidate -> generateGrid(facet, obstructions, candidate, bounds, direction, scale, raster))
                    .collect(Collectors.toList());
        }

        // 후보끼리는 입력만 읽으므로 병렬 계산, 결과는 후보 순서대로 모은다
        List<CompletableFuture<LayoutCandidate>> futures = new ArrayList<>();
        for (CandidateSpec candidate : specs) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> generateGrid(facet, obstructions, candidate, bounds, direction, scale, raster),
                    executorService));
        }

        List<LayoutCandidate> results = new ArrayList<>();
        for (CompletableFuture<LayoutCandidate> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw e;
            }
        }
        return results;
    }

    /**
     * 패널 픽셀 크기 [폭, 높이]. 경사 방향 길이는 cos(pitch) 만큼 줄여 투영한다.
     */
    int[] panelFootprint(PanelOrientation orientation, LayoutDirection direction, double pitchDegrees,
                         RealWorldScale scale) {
        RoofAnalysisProperties.PanelSpec spec = properties.getPanel();
        double width = orientation == PanelOrientation.LANDSCAPE ? spec.getHeight() : spec.getWidth();
        double height = orientation == PanelOrientation.LANDSCAPE ? spec.getWidth() : spec.getHeight();
        double cosine = Math.cos(Math.toRadians(pitchDegrees));

        double widthPx;
        double heightPx;
        if (direction == LayoutDirection.HORIZONTAL) {
            // 남/북향: 높이 방향이 경사
            widthPx = (width + spec.getSpacing()) / scale.getMetersPerPixelX();
            heightPx = (height * cosine + spec.getSpacing()) / scale.getMetersPerPixelY();
        } else {
            // 동/서향: 폭 방향이 경사
            widthPx = (width * cosine + spec.getSpacing()) / scale.getMetersPerPixelX();
            heightPx = (height + spec.getSpacing()) / scale.getMetersPerPixelY();
        }
        return new int[]{Math.max(1, (int) Math.round(widthPx)), Math.max(1, (int) Math.round(heightPx))};
    }

    /**
     * 후보 하나의 격자 채우기
     */
    LayoutCandidate generateGrid(RoofFacet facet, List<Obstruction> obstructions, CandidateSpec candidate,
                                 PixelBoundingBox bounds, LayoutDirection direction,
                                 RealWorldScale scale, ElevationRaster raster) {
        int[] footprint = panelFootprint(candidate.orientation, direction, facet.getPitchDegrees(), scale);
        int panelWidth = footprint[0];
        int panelHeight = footprint[1];

        RoofAnalysisProperties.Slope slope = properties.getSlope();
        boolean recordRejected = properties.getPanel().isRecordRejectedCells();
        double baselineSlope = Math.tan(Math.toRadians(facet.getPitchDegrees()));

        PixelPoint start = candidate.startCorner.startPoint(bounds);
        int rowIncrement = candidate.startCorner.rowIncrement();
        int colIncrement = candidate.startCorner.columnIncrement();

        int maxRows = (int) Math.ceil((double) bounds.getHeight() / panelHeight) + 1;
        int maxCols = (int) Math.ceil((double) bounds.getWidth() / panelWidth) + 1;

        List<Panel> panels = new ArrayList<>();
        List<Obstruction> newObstructions = new ArrayList<>();

        for (int row = 0; row < maxRows; row++) {
            int staggerOffset = (candidate.strategy == GridStrategy.STAGGERED && row % 2 == 1)
                    ? (panelWidth / 2) * colIncrement : 0;

            for (int col = 0; col < maxCols; col++) {
                int x = start.getX() + colIncrement * col * panelWidth + staggerOffset;
                int y = start.getY() + rowIncrement * row * panelHeight;

                // 이미지 밖
                if (x < 0 || y < 0 || x + panelWidth > scale.getPixelWidth() || y + panelHeight > scale.getPixelHeight()) {
                    continue;
                }

                List<PixelPoint> polygon = GeometryUtils.rectangleToPolygon(x, y, panelWidth, panelHeight);

                if (!GeometryUtils.allCornersInside(polygon, facet.getPixelPolygon())) {
                    if (recordRejected) {
                        newObstructions.add(rejectedCell(facet, "boundary_obstruction_", newObstructions.size(),
                                x, y, panelWidth, panelHeight, polygon, ObstructionType.SEGMENT_BOUNDARY,
                                "면 경계 밖"));
                    }
                    continue;
                }

                if (overlapsAny(polygon, obstructions)) {
                    if (recordRejected) {
                        newObstructions.add(rejectedCell(facet, "overlap_obstruction_", newObstructions.size(),
                                x, y, panelWidth, panelHeight, polygon, ObstructionType.OBSTRUCTION_OVERLAP,
                                "기존 장애물과 겹침"));
                    }
                    continue;
                }

                SlopeCheckResult check = slopeValidationService.checkBlockSlope(
                        raster, x, y, panelWidth, panelHeight, scale, baselineSlope,
                        slope.getLayoutMaxLocalDeviation(), slope.getMaxGlobalDeviation());

                if (!check.isValid()) {
                    newObstructions.add(Obstruction.builder()
                            .id("slope_obstruction_" + facet.getId() + "_" + newObstructions.size())
                            .facetId(facet.getId())
                            .x(x)
                            .y(y)
                            .width(panelWidth)
                            .height(panelHeight)
                            .type(ObstructionType.fromSlopeStatus(check.getStatus()))
                            .reason("경사 불일치")
                            .polygon(polygon)
                            .avgSlopeDegrees(check.getAvgAngle())
                            .localDeviation(check.getLocalDeviation())
                            .globalDeviation(check.getGlobalDeviation())
                            .build());
                    continue;
                }

                boolean measured = check.isMeasured();
                panels.add(Panel.builder()
                        .id("panel_" + facet.getId() + "_" + panels.size())
                        .facetId(facet.getId())
                        .x(x)
                        .y(y)
                        .width(panelWidth)
                        .height(panelHeight)
                        .realWidth(panelWidth * scale.getMetersPerPixelX())
                        .realHeight(panelHeight * scale.getMetersPerPixelY())
                        .pitch(facet.getPitchDegrees())
                        .azimuth(facet.getAzimuthDegrees())
                        .row(row)
                        .col(col)
                        .polygon(polygon)
                        .avgSlopeDegrees(measured ? check.getAvgAngle() : null)
                        .localDeviation(measured ? check.getLocalDeviation() : null)
                        .globalDeviation(measured ? check.getGlobalDeviation() : null)
                        .build());
            }
        }

        logger.trace("면 {} 후보 {}/{}/{}: {}행 x {}열, 패널 {}개", facet.getId(), candidate.orientation,
                candidate.strategy, candidate.startCorner, maxRows, maxCols, panels.size());

        return new LayoutCandidate(candidate.orientation, candidate.strategy, candidate.startCorner,
                panels, newObstructions);
    }

    private static boolean overlapsAny(List<PixelPoint> polygon, List<Obstruction> obstructions) {
        for (Obstruction obstruction : obstructions) {
            if (GeometryUtils.cornersOverlap(polygon, obstruction.getPolygon())) {
                return true;
            }
        }
        return false;
    }

    private static Obstruction rejectedCell(RoofFacet facet, String prefix, int index, int x, int y,
                                            int width, int height, List<PixelPoint> polygon,
                                            ObstructionType type, String reason) {
        return Obstruction.builder()
                .id(prefix + facet.getId() + "_" + index)
                .facetId(facet.getId())
                .x(x)
                .y(y)
                .width(width)
                .height(height)
                .type(type)
                .reason(reason)
                .polygon(polygon)
                .build();
    }

    private static List<Obstruction> obstructionsOf(String facetId, List<Obstruction> obstructions) {
        return obstructions.stream()
                .filter(o -> facetId.equals(o.getFacetId()))
                .collect(Collectors.toList());
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }

    /**
     * 셧다운 처리
     */
    @PreDestroy
    public void shutdown() {
        if (executorService == null) {
            return;
        }
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
