package com.example.renderflow_backend.config;

import com.example.renderflow_backend.engine.ProviderClients;
import com.example.renderflow_backend.util.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

@Configuration
@EnableConfigurationProperties({EngineProperties.class, RenderBackendProperties.class, StorageProperties.class,
        PipelineProperties.class})
public class EngineClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(EngineClientConfig.class);

    @Bean("renderBackendWebClient")
    public WebClient renderBackendWebClient(RenderBackendProperties props) {
        return build(props.getBaseUrl(), Duration.ofSeconds(props.getTimeoutSeconds()));
    }

    @Bean("probeWebClient")
    public WebClient probeWebClient(RenderBackendProperties props) {
        return build(props.getBaseUrl(), Duration.ofSeconds(props.getProbeTimeoutSeconds()));
    }

    @Bean("storageWebClient")
    public WebClient storageWebClient(StorageProperties props) {
        return build(props.getBaseUrl(), Duration.ofSeconds(props.getTimeoutSeconds()));
    }

    // no base url: artifacts live anywhere
    @Bean("artifactWebClient")
    public WebClient artifactWebClient(PipelineProperties props) {
        return build(null, props.getValidation().getRequestTimeout());
    }

    @Bean
    public ProviderClients providerClients(EngineProperties props) {
        Map<Provider, ProviderClients.Client> clients = new EnumMap<>(Provider.class);
        Duration edgeTimeout = Duration.ofSeconds(Math.max(1, props.getEdgeTimeoutSeconds()));
        clients.put(Provider.EDGE, new ProviderClients.Client(build(props.getEdgeBaseUrl(), edgeTimeout), edgeTimeout));
        props.getProviders().forEach((key, endpoint) -> {
            Provider provider = resolve(key);
            if (provider == null || endpoint.getBaseUrl() == null || endpoint.getBaseUrl().isBlank()) {
                LOGGER.warn("Ignoring provider endpoint key={}", key);
                return;
            }
            Duration timeout = Duration.ofSeconds(Math.max(1, endpoint.getTimeoutSeconds()));
            clients.put(provider, new ProviderClients.Client(build(endpoint.getBaseUrl(), timeout), timeout));
        });
        LOGGER.info("Provider clients configured providers={}", clients.keySet());
        return new ProviderClients(clients);
    }

    private static Provider resolve(String key) {
        for (Provider provider : Provider.values()) {
            if (provider.key().equals(key.toLowerCase(Locale.ROOT))) {
                return provider;
            }
        }
        return null;
    }

    private static WebClient build(String baseUrl, Duration timeout) {
        int toSec = (int) Math.max(1, timeout.getSeconds());

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
                .build();

        HttpClient http = HttpClient.create()
                .responseTimeout(timeout)
                .option(io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS, 15_000)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new io.netty.handler.timeout.ReadTimeoutHandler(toSec))
                        .addHandlerLast(new io.netty.handler.timeout.WriteTimeoutHandler(toSec))
                );

        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies);
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }
}
