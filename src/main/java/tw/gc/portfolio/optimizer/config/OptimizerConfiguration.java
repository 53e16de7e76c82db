package tw.gc.portfolio.optimizer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class OptimizerConfiguration {

    @Bean
    public OptimizerConfig optimizerConfig(OptimizerProperties properties) {
        OptimizerConfig config = OptimizerConfig.from(properties);
        log.info("Optimizer config: maxIterations={}, tolerance={}, riskFreeRate={}, bounds=[{}, {}], boundRepair={}",
                config.maxIterations(), config.tolerance(), config.riskFreeRate(),
                config.minPositionWeight(), config.maxPositionWeight(), config.boundRepair());
        return config;
    }
}
