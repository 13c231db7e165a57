package quest.gekko.churnguard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    // warehouse fact dumps can be large
    private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    @Bean
    public WebClient warehouseWebClient(final WebClient.Builder builder, final ChurnGuardProperties.Warehouse warehouse) {
        WebClient.Builder configured = builder
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                        .build());
        if (warehouse.baseUrl() != null && !warehouse.baseUrl().isBlank()) {
            configured.baseUrl(warehouse.baseUrl());
        }
        if (warehouse.apiKey() != null && !warehouse.apiKey().isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + warehouse.apiKey());
        }
        return configured.build();
    }
}
