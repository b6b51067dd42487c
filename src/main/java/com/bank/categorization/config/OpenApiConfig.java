package com.bank.categorization.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI categorizationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Transaction Categorization API")
                        .version("1.0.0")
                        .description(
                                "Multi-tenant categorization of bank transactions with correction-driven learning.\n\n" +
                                "**Routing Pipeline:**\n" +
                                "1. Receive a batch via `POST /tenants/{tenantId}/decisions/route`\n" +
                                "2. Normalize payee and description into a signature and keywords\n" +
                                "3. Match against the tenant's learned rules\n" +
                                "4. Ask the inference service for a category (hard timeout)\n" +
                                "5. Boost confidence when the best rule agrees with inference\n" +
                                "6. **AUTO_APPLIED** at or above the tenant threshold, otherwise **REVIEW_REQUIRED**\n\n" +
                                "**Learning:**\n" +
                                "- Corrections are recorded once per decision\n" +
                                "- Three agreeing corrections for one signature create a learned rule\n" +
                                "- Every correction is turned into a negative reward for the learning back ends")
                        .contact(new Contact().name("Categorization Team")));
    }
}
