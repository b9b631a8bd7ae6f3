package com.sommerph.zkinbox.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI zkInboxOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("zk-Inbox Submission API")
                        .version("1.0.0")
                        .description("Intake for anonymous reports: membership proof, epoch nullifier and encrypted payload."));
    }

    @Bean
    public GroupedOpenApi submissionGroup() {
        return GroupedOpenApi.builder()
                .group("submissions")
                .pathsToMatch("/api/submissions", "/api/submissions/**")
                .build();
    }

}
