package com.ecp.governance.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI governanceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("ECP Governance API")
                        .version("1.0.0")
                        .description(
                                "Mandatory decision ingress, tamper-evident ledger and ethical consensus scoring.\n\n" +
                                "**Decision Pipeline:**\n" +
                                "1. Submit a decision via `POST /api/v1/decisions` with its full causal context\n" +
                                "2. The context is validated; any missing field rejects the decision before a write\n" +
                                "3. The event is appended to the hash-chained ledger\n" +
                                "4. If agency is present, the acting agent's self-classification is recorded\n" +
                                "5. Independent classifiers submit classifications for the event\n" +
                                "6. Pairwise divergence is scored; high divergence or any `unethical` verdict opens an escalation\n" +
                                "7. A human ruling closes the escalation and may set a precedent\n\n" +
                                "**Violation Severities:**\n" +
                                "- `BLOCKING`: recorded and escalated for human review\n" +
                                "- `WARNING`: recorded\n" +
                                "- `AUDIT`: recorded for later audit\n\n" +
                                "Integrity of the ledger is only reported by explicit checks " +
                                "(`GET /api/v1/ledger/verify`, `POST /api/v1/consistency/check`).")
                        .contact(new Contact().name("Governance Core Team")));
    }
}
