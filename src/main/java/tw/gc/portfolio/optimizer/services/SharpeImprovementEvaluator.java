package tw.gc.portfolio.optimizer.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.portfolio.optimizer.config.OptimizerConfig;
import tw.gc.portfolio.optimizer.model.SharpeImprovement;

/**
 * Compares an optimized Sharpe ratio against a baseline and checks the configured improvement target.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SharpeImprovementEvaluator {

    private final OptimizerConfig config;

    public SharpeImprovement evaluate(double optimizedSharpe, double baselineSharpe) {
        return evaluate(optimizedSharpe, baselineSharpe, config.sharpeImprovementTarget());
    }

    public SharpeImprovement evaluate(double optimizedSharpe, double baselineSharpe, double targetImprovement) {
        if (!(baselineSharpe > 0.0) || !Double.isFinite(optimizedSharpe)) {
            log.warn("Cannot measure Sharpe improvement: baseline={}, optimized={}", baselineSharpe, optimizedSharpe);
            return new SharpeImprovement(baselineSharpe, optimizedSharpe, 0.0, targetImprovement, false);
        }

        double ratio = (optimizedSharpe - baselineSharpe) / baselineSharpe;
        boolean achieved = ratio >= targetImprovement;
        if (achieved) {
            log.info("Sharpe improvement target reached: {} -> {} ({}%)",
                    String.format("%.3f", baselineSharpe), String.format("%.3f", optimizedSharpe),
                    String.format("%.1f", ratio * 100));
        } else {
            log.warn("Sharpe improvement below target: {}% < {}%",
                    String.format("%.1f", ratio * 100), String.format("%.1f", targetImprovement * 100));
        }
        return new SharpeImprovement(baselineSharpe, optimizedSharpe, ratio, targetImprovement, achieved);
    }
}
