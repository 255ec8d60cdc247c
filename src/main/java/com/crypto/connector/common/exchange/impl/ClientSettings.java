package com.crypto.connector.common.exchange.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Shared, read-only plumbing handed to every client the factory builds.
 */
public class ClientSettings {
    public final WebClient.Builder webClientBuilder;
    public final Duration timeout;
    public final ObjectMapper mapper;
    public final Clock clock;

    public ClientSettings(WebClient.Builder webClientBuilder, Duration timeout, ObjectMapper mapper, Clock clock) {
        this.webClientBuilder = webClientBuilder;
        this.timeout = timeout;
        this.mapper = mapper;
        this.clock = clock;
    }
}
