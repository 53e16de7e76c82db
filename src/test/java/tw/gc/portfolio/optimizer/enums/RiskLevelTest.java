package tw.gc.portfolio.optimizer.enums;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class RiskLevelTest {

    @ParameterizedTest
    @CsvSource({
            "0.0, LOW",
            "0.10, LOW",
            "0.10000001, MEDIUM",
            "0.20, MEDIUM",
            "0.2000001, HIGH",
            "0.30, HIGH",
            "0.30000001, VERY_HIGH",
            "1.5, VERY_HIGH"
    })
    void fromVolatility_usesInclusiveUpperBounds(double volatility, RiskLevel expected) {
        assertThat(RiskLevel.fromVolatility(volatility)).isEqualTo(expected);
    }
}
