package com.storefront.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI storefrontAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Storefront Anomaly Analysis API")
                        .version("1.0.0")
                        .description(
                                "Hourly anomaly analysis for dimensional business metrics.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Submit the hourly metric-dimension count table via `POST /api/v1/analysis/runs`\n" +
                                "2. Each metric and each dimension value is forecast from its own history " +
                                "(trend + daily cycle + weekly cycle, residual-based interval)\n" +
                                "3. Hours outside the interval are flagged and the deviation is attributed to dimension values\n" +
                                "4. Anomalous hours are clustered into groups (max gap 3h, direction-consistent per metric)\n" +
                                "5. Each group is classified into a scenario\n\n" +
                                "**Scenarios:**\n" +
                                "- `A`: several metrics explained by the same dimension value\n" +
                                "- `B`: several metrics explained by different dimension values\n" +
                                "- `C`: several metrics with no comparable dimensional explanation\n" +
                                "- `D`: single metric or single hour")
                        .contact(new Contact().name("Storefront Analytics Team")));
    }
}
