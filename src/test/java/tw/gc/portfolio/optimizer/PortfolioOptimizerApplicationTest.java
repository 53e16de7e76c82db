package tw.gc.portfolio.optimizer;

import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mockStatic;

class PortfolioOptimizerApplicationTest {

    @Test
    void main_shouldInvokeSpringApplicationRun() {
        try (MockedStatic<SpringApplication> springApplication = mockStatic(SpringApplication.class)) {
            springApplication.when(() -> SpringApplication.run(eq(PortfolioOptimizerApplication.class), any(String[].class)))
                    .thenReturn(null);

            PortfolioOptimizerApplication.main(new String[]{"--test"});

            springApplication.verify(() -> SpringApplication.run(eq(PortfolioOptimizerApplication.class), any(String[].class)));
        }
    }
}
