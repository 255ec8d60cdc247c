package com.crypto.connector.common.config;

import com.crypto.connector.common.exchange.ConnectionRegistry;
import com.crypto.connector.common.exchange.ExchangeProvider;
import com.crypto.connector.common.model.ConnectionStatus;
import com.crypto.connector.common.security.AesGcmCredentialCodec;
import com.crypto.connector.common.security.Base64CredentialCodec;
import com.crypto.connector.common.security.CredentialCodec;
import com.crypto.connector.common.service.CommandExecutor;
import com.crypto.connector.common.service.ConnectionService;
import com.crypto.connector.repl.ReplRunner;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

class ApplicationConfigurationTest {
    private static final String AES_KEY = Base64.getEncoder().encodeToString(new byte[32]);

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(ApplicationConfiguration.class);

    @Test
    void wiresServicesWithBase64CodecByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(CommandExecutor.class);
            assertThat(context).hasSingleBean(ReplRunner.class);
            assertThat(context.getBean(CredentialCodec.class)).isInstanceOf(Base64CredentialCodec.class);
            assertThat(context.getBean(ConnectionService.class).list()).isEmpty();
        });
    }

    @Test
    void configuredKeySelectsAesGcm() {
        contextRunner.withPropertyValues("app.credentials.key=" + AES_KEY).run(context ->
                assertThat(context.getBean(CredentialCodec.class)).isInstanceOf(AesGcmCredentialCodec.class));
    }

    @Test
    void restoresConfiguredConnections() {
        contextRunner.withPropertyValues(
                "connections.entries.paper.provider=simulation",
                "connections.entries.paper.env=sandbox",
                "connections.entries.kraken-main.provider=kraken",
                "connections.entries.kraken-main.api-key=configured-key",
                "connections.entries.kraken-main.api-secret=configured-secret"
        ).run(context -> {
            ConnectionRegistry registry = context.getBean(ConnectionRegistry.class);
            assertThat(registry.list()).hasSize(2);
            assertThat(registry.require("paper").provider).isEqualTo(ExchangeProvider.SIMULATION);
            assertThat(registry.require("kraken-main").status).isEqualTo(ConnectionStatus.CONNECTED);
            assertThat(registry.require("kraken-main").encodedApiSecret).isNotEqualTo("configured-secret");
        });
    }

    @Test
    void rejectsInvalidRetrySettings() {
        contextRunner.withPropertyValues("app.retry.max-attempts=0").run(context ->
                assertThat(context).hasFailed());
    }
}
