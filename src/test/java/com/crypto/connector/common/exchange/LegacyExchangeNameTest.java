package com.crypto.connector.common.exchange;

import com.crypto.connector.common.model.CredentialValidationException;
import com.crypto.connector.common.model.Credentials;
import com.crypto.connector.common.model.ExchangeConnectionConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LegacyExchangeNameTest {
    private final Credentials creds = new Credentials("key", "secret", null);

    @Test
    void flatNamesMapToProviderAndFamily() {
        assertThat(LegacyExchangeName.from("binance-us")).isEqualTo(LegacyExchangeName.BINANCE_US);
        assertThat(LegacyExchangeName.from("binance")).isEqualTo(LegacyExchangeName.BINANCE_US);
        assertThat(LegacyExchangeName.from("COINBASE_PRO").apiFamily()).isEqualTo("advanced_trade");
        assertThat(LegacyExchangeName.from("coinbase_exchange").apiFamily()).isEqualTo("exchange");
        assertThatThrownBy(() -> LegacyExchangeName.from("ftx")).isInstanceOf(CredentialValidationException.class);
    }

    @Test
    void testnetFlagSelectsSandbox() {
        ExchangeConnectionConfig config = LegacyExchangeName.KRAKEN.toConfig(creds, true, null);

        assertThat(config.provider).isEqualTo(ExchangeProvider.KRAKEN);
        assertThat(config.apiFamily).isEqualTo("standard");
        assertThat(config.env).isEqualTo(ExchangeEnv.SANDBOX);
    }

    @Test
    void explicitFamilyOnlyOverridesCoinbase() {
        assertThat(LegacyExchangeName.COINBASE.toConfig(creds, false, "exchange").apiFamily).isEqualTo("exchange");
        assertThat(LegacyExchangeName.KRAKEN.toConfig(creds, false, "exchange").apiFamily).isEqualTo("standard");
    }

    @Test
    void reverseMappingPrefersFirstDeclaredName() {
        assertThat(LegacyExchangeName.of(ExchangeProvider.COINBASE, "advanced_trade")).isEqualTo(LegacyExchangeName.COINBASE);
        assertThat(LegacyExchangeName.of(ExchangeProvider.SIMULATION, "paper")).isNull();
    }
}
