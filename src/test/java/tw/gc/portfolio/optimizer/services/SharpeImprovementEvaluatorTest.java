package tw.gc.portfolio.optimizer.services;

import org.junit.jupiter.api.Test;
import tw.gc.portfolio.optimizer.config.OptimizerConfig;
import tw.gc.portfolio.optimizer.model.SharpeImprovement;

import static org.assertj.core.api.Assertions.*;

class SharpeImprovementEvaluatorTest {

    private final SharpeImprovementEvaluator evaluator = new SharpeImprovementEvaluator(OptimizerConfig.defaults());

    @Test
    void evaluate_reachesDefaultTarget() {
        SharpeImprovement improvement = evaluator.evaluate(0.65, 0.5);

        assertThat(improvement.improvementRatio()).isCloseTo(0.30, within(1e-12));
        assertThat(improvement.targetImprovement()).isEqualTo(0.20);
        assertThat(improvement.targetAchieved()).isTrue();
    }

    @Test
    void evaluate_missesTarget() {
        SharpeImprovement improvement = evaluator.evaluate(0.55, 0.5);

        assertThat(improvement.improvementRatio()).isCloseTo(0.10, within(1e-12));
        assertThat(improvement.targetAchieved()).isFalse();
    }

    @Test
    void evaluate_treatsExactTargetAsAchieved() {
        assertThat(evaluator.evaluate(1.5, 1.0, 0.5).targetAchieved()).isTrue();
    }

    @Test
    void evaluate_reportsDeterioration() {
        SharpeImprovement improvement = evaluator.evaluate(0.4, 0.8);

        assertThat(improvement.improvementRatio()).isCloseTo(-0.5, within(1e-12));
        assertThat(improvement.targetAchieved()).isFalse();
    }

    @Test
    void evaluate_guardsNonPositiveBaseline() {
        SharpeImprovement zero = evaluator.evaluate(1.2, 0.0);
        SharpeImprovement negative = evaluator.evaluate(1.2, -0.3);

        assertThat(zero.improvementRatio()).isZero();
        assertThat(zero.targetAchieved()).isFalse();
        assertThat(negative.improvementRatio()).isZero();
        assertThat(negative.targetAchieved()).isFalse();
    }
}
