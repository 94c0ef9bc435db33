package com.example.renderflow_backend.engine;

import com.example.renderflow_backend.exception.PipelineException;
import com.example.renderflow_backend.util.Provider;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * WebClients per remote engine family, built from {@code engines.providers} and {@code engines.edge-base-url}.
 */
public class ProviderClients {
    public record Client(WebClient webClient, Duration timeout) {}

    private final Map<Provider, Client> clients;

    public ProviderClients(Map<Provider, Client> clients) {
        this.clients = clients.isEmpty() ? Map.of() : new EnumMap<>(clients);
    }

    public Client get(Provider provider) {
        Client client = clients.get(provider);
        if (client == null) {
            throw PipelineException.configuration("No endpoint configured for provider " + provider.key());
        }
        return client;
    }

    public boolean has(Provider provider) {
        return clients.containsKey(provider);
    }
}
