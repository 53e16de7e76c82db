package tw.gc.portfolio.optimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PortfolioOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioOptimizerApplication.class, args);
    }
}
