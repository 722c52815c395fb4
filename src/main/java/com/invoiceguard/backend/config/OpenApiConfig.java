package com.invoiceguard.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI invoiceGuardOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("InvoiceGuard API")
                        .description("Tampering-risk pre-screening for invoice images and PDFs. "
                                + "Scores are heuristic and are not a legal determination.")
                        .version("v1")
                        .contact(new Contact()
                                .name("InvoiceGuard")
                                .email("support@invoiceguard.dev")
                        )
                        .license(new License().name("Internal use"))
                );
    }
}
