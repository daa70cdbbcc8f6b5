package com.tradeadvisor.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import io.swagger.v3.oas.models.media.IntegerSchema;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    public static final String USER_ID_HEADER = "X-User-Id";

    @Bean
    public OpenAPI tradeAdvisorOpenApi() {
        HeaderParameter userHeader = new HeaderParameter();
        userHeader.setName(USER_ID_HEADER);
        userHeader.setRequired(true);
        userHeader.setDescription("Opaque identifier of the calling user");
        userHeader.setSchema(new IntegerSchema().format("int64"));
        return new OpenAPI()
                .info(new Info()
                        .title("Trade Advisor API")
                        .description("Risk-validated trade recommendations and a simulated portfolio ledger")
                        .version("1.0"))
                .components(new Components().addParameters("userId", userHeader));
    }
}
