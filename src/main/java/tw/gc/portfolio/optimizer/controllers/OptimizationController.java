package tw.gc.portfolio.optimizer.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tw.gc.portfolio.optimizer.model.AssetPriceHistory;
import tw.gc.portfolio.optimizer.model.OptimizationOutcome;
import tw.gc.portfolio.optimizer.model.OptimizationRequest;
import tw.gc.portfolio.optimizer.model.PortfolioRecommendation;
import tw.gc.portfolio.optimizer.model.PortfolioWeights;
import tw.gc.portfolio.optimizer.model.RiskMetrics;
import tw.gc.portfolio.optimizer.services.PortfolioOptimizationService;
import tw.gc.portfolio.optimizer.services.RecommendationService;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/portfolio")
@RequiredArgsConstructor
@Slf4j
public class OptimizationController {

    private final PortfolioOptimizationService optimizationService;
    private final RecommendationService recommendationService;

    @PostMapping("/optimize")
    public OptimizationOutcome optimize(@RequestBody OptimizationRequest request) {
        log.info("Optimization requested: method={}, assets={}", request.method().getCode(), request.assets().size());
        return optimizationService.optimize(request);
    }

    @PostMapping("/risk-metrics")
    public RiskMetrics riskMetrics(@RequestBody RiskMetricsRequest request) {
        OptimizationRequest history = OptimizationRequest.builder()
                .assets(request.assets())
                .benchmarkReturns(request.benchmarkReturns())
                .build();
        return optimizationService.riskMetrics(history, request.weights());
    }

    @PostMapping("/recommendations")
    public PortfolioRecommendation recommendations(@RequestBody OptimizationRequest request) {
        OptimizationOutcome outcome = optimizationService.optimize(request);
        RiskMetrics metrics = outcome.isDegraded()
                ? RiskMetrics.empty()
                : optimizationService.riskMetrics(request, outcome.result().weights());
        return recommendationService.recommend(outcome.result(), metrics);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleInvalidInput(IllegalArgumentException e) {
        log.warn("Rejected portfolio request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
            "status", "error",
            "message", String.valueOf(e.getMessage())
        ));
    }

    /**
     * Weights to evaluate together with the price histories they apply to.
     */
    public record RiskMetricsRequest(
            List<AssetPriceHistory> assets,
            PortfolioWeights weights,
            List<Double> benchmarkReturns
    ) {
        public RiskMetricsRequest {
            weights = weights != null ? weights : PortfolioWeights.empty();
        }
    }
}
