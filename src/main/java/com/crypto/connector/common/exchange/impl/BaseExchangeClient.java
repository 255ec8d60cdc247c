package com.crypto.connector.common.exchange.impl;

import com.crypto.connector.common.auth.AuthType;
import com.crypto.connector.common.auth.RequestSigner;
import com.crypto.connector.common.auth.SignableRequest;
import com.crypto.connector.common.auth.SignedRequest;
import com.crypto.connector.common.capability.CapabilityResolver;
import com.crypto.connector.common.exchange.ExchangeClient;
import com.crypto.connector.common.model.Capabilities;
import com.crypto.connector.common.model.CredentialValidationException;
import com.crypto.connector.common.model.ExchangeApiException;
import com.crypto.connector.common.model.ExchangeConnectionConfig;
import com.crypto.connector.common.model.ExchangeConnectivityException;
import com.crypto.connector.common.model.ExchangeException;
import com.crypto.connector.common.util.LogSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.TimeoutException;

@Slf4j
public abstract class BaseExchangeClient implements ExchangeClient {
    private static final String USER_AGENT = "exchange-connector";

    protected final String name;
    protected final ExchangeConnectionConfig config;
    protected final String baseUrl;
    protected final RequestSigner signer;
    protected final WebClient webClient;
    protected final Duration timeout;
    protected final ObjectMapper mapper;
    protected final ClientSettings settings;

    private final String origin;
    private final String host;
    private final String basePath;

    protected BaseExchangeClient(String name, ExchangeConnectionConfig config, String baseUrl, RequestSigner signer,
                                 ClientSettings settings) {
        this.name = name;
        this.config = config;
        this.baseUrl = baseUrl;
        this.signer = signer;
        this.settings = settings;
        this.timeout = settings.timeout;
        this.mapper = settings.mapper;
        if (StringUtils.isBlank(baseUrl)) {
            throw new CredentialValidationException("Missing baseUrl for exchange: " + name);
        }
        URI uri = URI.create(StringUtils.removeEnd(baseUrl.trim(), "/"));
        this.host = uri.getHost();
        this.origin = uri.getScheme() + "://" + uri.getRawAuthority();
        this.basePath = uri.getRawPath() == null ? "" : uri.getRawPath();
        this.webClient = settings.webClientBuilder.clone()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String baseUrl() {
        return baseUrl;
    }

    @Override
    public AuthType authType() {
        return signer.authType();
    }

    @Override
    public Capabilities capabilities() {
        return CapabilityResolver.resolve(config.provider, config.apiFamily, config.env);
    }

    @Override
    public boolean testConnection() {
        try {
            probe();
            return true;
        } catch (Exception e) {
            LOG.warn("{} connection test failed: {}", name, LogSanitizer.sanitize(e.getMessage()));
            return false;
        }
    }

    /**
     * Read-only call used by {@link #testConnection()}.
     */
    protected void probe() {
        getBalance();
    }

    protected JsonNode get(String path, String query, boolean signed) {
        return send(HttpMethod.GET, path, query, "", MediaType.APPLICATION_JSON, signed);
    }

    protected JsonNode send(HttpMethod method, String path, String query, String body, MediaType contentType,
                            boolean signed) {
        String fullPath = basePath + path;
        SignableRequest request = new SignableRequest(method.name(), host, fullPath, query, body);
        SignedRequest signedRequest = signed ? signer.sign(request) : SignedRequest.unsigned(request);
        URI target = URI.create(origin + fullPath + (signedRequest.query.isEmpty() ? "" : "?" + signedRequest.query));

        WebClient.RequestBodySpec spec = webClient.method(method)
                .uri(target)
                .header(HttpHeaders.USER_AGENT, USER_AGENT)
                .accept(MediaType.APPLICATION_JSON);
        signedRequest.headers.forEach((header, value) -> spec.header(header, value));
        WebClient.RequestHeadersSpec<?> ready = signedRequest.body.isEmpty()
                ? spec
                : spec.contentType(contentType).bodyValue(signedRequest.body);

        RawResponse response;
        try {
            response = ready.exchangeToMono(resp -> resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(text -> new RawResponse(resp.statusCode().value(), text)))
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw connectivityError(method, path, e);
        }
        if (response == null) {
            throw new ExchangeConnectivityException(name + " returned no response for " + method.name() + " " + path, null);
        }
        if (response.status >= 400) {
            LOG.warn("{} {} {} failed: HTTP {} {}", name, method.name(), path, response.status,
                    LogSanitizer.sanitize(StringUtils.abbreviate(response.body, 500)));
            throw apiError(response.status, parseQuietly(response.body), response.body);
        }
        JsonNode json = parse(response.status, response.body);
        checkPayload(json);
        return json;
    }

    /**
     * Maps an HTTP error response to the provider's code and message.
     */
    protected ExchangeApiException apiError(int status, JsonNode body, String rawBody) {
        String code = firstText(body, "code", "error", "error_response");
        String message = firstText(body, "msg", "message", "error_description", "reason");
        if (code == null && message == null) {
            message = StringUtils.abbreviate(rawBody, 200);
        }
        return new ExchangeApiException(name, status, code, message);
    }

    /**
     * Hook for providers that embed errors inside successful responses.
     */
    protected void checkPayload(JsonNode json) {
    }

    private JsonNode parse(int status, String body) {
        if (StringUtils.isBlank(body)) {
            return MissingNode.getInstance();
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExchangeApiException(name, status, null, "Unparseable response");
        }
    }

    private JsonNode parseQuietly(String body) {
        if (StringUtils.isBlank(body)) {
            return MissingNode.getInstance();
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            return MissingNode.getInstance();
        }
    }

    private ExchangeException connectivityError(HttpMethod method, String path, RuntimeException e) {
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof ExchangeException exchangeException) {
            return exchangeException;
        }
        if (cause instanceof TimeoutException) {
            return new ExchangeConnectivityException(name + " request timed out after " + timeout.toMillis()
                    + "ms: " + method.name() + " " + path, cause);
        }
        if (cause instanceof WebClientRequestException || cause instanceof IOException) {
            return new ExchangeConnectivityException(name + " is unreachable: " + method.name() + " " + path, cause);
        }
        return new ExchangeException(name + " request failed: " + method.name() + " " + path, cause);
    }

    protected static String form(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        params.forEach((key, value) -> {
            if (value != null) {
                joiner.add(URLEncoder.encode(key, StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(value, StandardCharsets.UTF_8));
            }
        });
        return joiner.toString();
    }

    protected static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return BigDecimal.ZERO;
        }
        String text = node.asText();
        if (StringUtils.isBlank(text)) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    protected static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    protected static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (StringUtils.isNotBlank(value)) {
                return value;
            }
        }
        return null;
    }

    protected static String plain(BigDecimal value) {
        return value == null ? null : value.stripTrailingZeros().toPlainString();
    }

    private record RawResponse(int status, String body) {
    }
}
