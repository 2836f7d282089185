package com.funnel.insights.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI funnelInsightsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Funnel Insights API")
                        .version("1.0.0")
                        .description(
                                "Ecommerce funnel (view_item -> add_to_cart -> purchase) conversion analysis.\n\n" +
                                "**Analysis Pipeline:**\n" +
                                "1. Receive funnel records via `POST /api/v1/funnel/analyze` (or generate mock data)\n" +
                                "2. Summarize older history into weekly aggregates when the input is large\n" +
                                "3. Compute baseline step-conversion rates across all records\n" +
                                "4. Break down conversion per dimension value (channel, device, browser, ...)\n" +
                                "5. Flag values deviating from baseline by >= 20%: **MEDIUM** (>=20%), **HIGH** (>=35%), **CRITICAL** (>=50%)\n" +
                                "6. Reuse a cached analysis for an identical fingerprint within 24h\n" +
                                "7. Return the full result plus a size-optimized payload for storage")
                        .contact(new Contact().name("Funnel Analytics Team")));
    }
}
