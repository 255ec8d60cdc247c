package com.crypto.connector.common.config;

import com.crypto.connector.common.auth.AuthStrategies;
import com.crypto.connector.common.auth.CdpJwtTokenFactory;
import com.crypto.connector.common.auth.JwtTokenFactory;
import com.crypto.connector.common.capability.ConnectionTemplateCatalog;
import com.crypto.connector.common.command.impl.CommandParser;
import com.crypto.connector.common.exchange.ConnectionRegistry;
import com.crypto.connector.common.exchange.ExchangeClientFactory;
import com.crypto.connector.common.exchange.impl.ClientSettings;
import com.crypto.connector.common.exchange.impl.ExchangeHttpClient;
import com.crypto.connector.common.properties.AppProperties;
import com.crypto.connector.common.properties.ConnectionsProperties;
import com.crypto.connector.common.security.AesGcmCredentialCodec;
import com.crypto.connector.common.security.Base64CredentialCodec;
import com.crypto.connector.common.security.CredentialCodec;
import com.crypto.connector.common.service.CommandExecutor;
import com.crypto.connector.common.service.ConnectionService;
import com.crypto.connector.common.service.ConnectionTester;
import com.crypto.connector.common.service.ConsolePrompt;
import com.crypto.connector.common.service.JLineConsolePrompt;
import com.crypto.connector.common.service.OrderService;
import com.crypto.connector.common.validation.CredentialFormatValidator;
import com.crypto.connector.common.validation.CredentialJsonParser;
import com.crypto.connector.repl.ReplRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties({AppProperties.class, ConnectionsProperties.class})
public class ApplicationConfiguration {
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public ClientSettings clientSettings(ObjectProvider<WebClient.Builder> webClientBuilder, AppProperties appProperties,
                                         ObjectMapper objectMapper, Clock clock) {
        return new ClientSettings(webClientBuilder.getIfAvailable(WebClient::builder),
                appProperties.getHttp().getTimeout(), objectMapper, clock);
    }

    @Bean
    public JwtTokenFactory jwtTokenFactory(Clock clock) {
        return new CdpJwtTokenFactory(clock);
    }

    @Bean
    public AuthStrategies authStrategies(Clock clock, JwtTokenFactory jwtTokenFactory) {
        return new AuthStrategies(clock, jwtTokenFactory);
    }

    @Bean
    public ExchangeClientFactory exchangeClientFactory(ClientSettings clientSettings, AuthStrategies authStrategies,
                                                       AppProperties appProperties) {
        return new ExchangeClientFactory(clientSettings, authStrategies, appProperties.getEndpoints());
    }

    @Bean
    public ExchangeHttpClient exchangeHttpClient(AppProperties appProperties) {
        return new ExchangeHttpClient(appProperties.getRetry().getMaxAttempts(),
                appProperties.getRetry().getInitialBackoff());
    }

    @Bean
    public CredentialCodec credentialCodec(AppProperties appProperties) {
        String key = appProperties.getCredentials().getKey();
        if (StringUtils.isBlank(key)) {
            LOG.warn("app.credentials.key is not set; stored credentials are only base64 encoded");
            return new Base64CredentialCodec();
        }
        return AesGcmCredentialCodec.fromBase64Key(key);
    }

    @Bean
    public ConnectionTemplateCatalog connectionTemplateCatalog() {
        return new ConnectionTemplateCatalog();
    }

    @Bean
    public ConnectionRegistry connectionRegistry() {
        return new ConnectionRegistry();
    }

    @Bean
    public ConnectionTester connectionTester(ExchangeClientFactory factory, ObjectMapper objectMapper) {
        return new ConnectionTester(factory, new CredentialFormatValidator(), new CredentialJsonParser(objectMapper));
    }

    @Bean
    public ConnectionService connectionService(ConnectionTemplateCatalog catalog, ConnectionTester tester,
                                               CredentialCodec codec, ConnectionRegistry registry,
                                               ExchangeClientFactory factory, AppProperties appProperties,
                                               ConnectionsProperties connectionsProperties, Clock clock) {
        ConnectionService service = new ConnectionService(catalog, tester, codec, registry, factory,
                appProperties.getOauth(), clock);
        int restored = service.restore(connectionsProperties);
        if (restored > 0) {
            LOG.info("Restored {} configured connection(s)", restored);
        }
        return service;
    }

    @Bean
    public OrderService orderService(ConnectionService connectionService, ExchangeHttpClient exchangeHttpClient,
                                     Clock clock) {
        return new OrderService(connectionService, exchangeHttpClient, clock);
    }

    @Bean
    @Lazy
    public ConsolePrompt consolePrompt() {
        return new JLineConsolePrompt();
    }

    @Bean
    public CommandExecutor commandExecutor(ConnectionTemplateCatalog catalog, ConnectionService connectionService,
                                           OrderService orderService, ExchangeHttpClient exchangeHttpClient,
                                           @Lazy ConsolePrompt consolePrompt) {
        return new CommandExecutor(catalog, connectionService, orderService, exchangeHttpClient, consolePrompt);
    }

    @Bean
    public CommandParser commandParser() {
        return new CommandParser();
    }

    @Bean
    public ReplRunner replRunner(CommandParser parser, CommandExecutor executor, @Lazy ConsolePrompt consolePrompt) {
        return new ReplRunner(parser, executor, consolePrompt);
    }
}
