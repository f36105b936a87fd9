package com.fintech.escrow.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI escrowSettlementOpenAPI(@Value("${server.port:8080}") int port,
                                           LedgerProperties ledgerProperties) {
        return new OpenAPI()
                .info(new Info()
                        .title("Escrow Settlement Service API")
                        .description("Escrow records mirrored from the settlement contract on "
                                + ledgerProperties.getConnectionName()
                                + ". Amounts are in wei; funding returns 202 while verification is pending.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("FinTech Team")
                                .email("fintech@example.com")))
                .servers(List.of(new Server()
                        .url("http://localhost:" + port)
                        .description("Local node (" + ledgerProperties.getMode() + " ledger)")));
    }
}
