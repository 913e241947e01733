package com.amot.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import io.swagger.v3.oas.models.media.StringSchema;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    public static final String ACTING_USER_HEADER = "X-User-Id";

    @Bean
    public OpenAPI amotOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Amot Ledger API")
                        .description("Shared bills, splits and settlement of who owes whom.")
                        .version("v1")
                )
                // header used by every mutation to identify the acting participant
                .components(new Components()
                        .addParameters(ACTING_USER_HEADER,
                                new HeaderParameter()
                                        .name(ACTING_USER_HEADER)
                                        .description("Identifier of the acting participant")
                                        .schema(new StringSchema())
                        )
                );
    }
}
