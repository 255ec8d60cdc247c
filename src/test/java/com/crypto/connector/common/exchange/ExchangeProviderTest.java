package com.crypto.connector.common.exchange;

import com.crypto.connector.common.model.CredentialValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExchangeProviderTest {

    @Test
    void providerNamesAreForgiving() {
        assertThat(ExchangeProvider.from(" Coinbase ")).isEqualTo(ExchangeProvider.COINBASE);
        assertThat(ExchangeProvider.from("Binance.US")).isEqualTo(ExchangeProvider.BINANCE);
        assertThat(ExchangeProvider.from("paper")).isEqualTo(ExchangeProvider.SIMULATION);
        assertThatThrownBy(() -> ExchangeProvider.from("bitstamp"))
                .isInstanceOf(CredentialValidationException.class)
                .hasMessage("Unsupported provider: bitstamp");
    }

    @Test
    void familiesNormalizePerProvider() {
        assertThat(ExchangeProvider.COINBASE.normalizeFamily("Advanced Trade")).isEqualTo("advanced_trade");
        assertThat(ExchangeProvider.COINBASE.normalizeFamily("pro")).isEqualTo("exchange");
        assertThat(ExchangeProvider.KRAKEN.normalizeFamily("")).isEqualTo("standard");
        assertThat(ExchangeProvider.BINANCE.normalizeFamily(" US ")).isEqualTo("us");
    }

    @Test
    void environmentsAcceptCommonSpellings() {
        assertThat(ExchangeEnv.from("testnet")).isEqualTo(ExchangeEnv.SANDBOX);
        assertThat(ExchangeEnv.from("Live")).isEqualTo(ExchangeEnv.PROD);
        assertThat(ExchangeEnv.from(null)).isEqualTo(ExchangeEnv.PROD);
        assertThat(ExchangeEnv.fromTestnet(true)).isEqualTo(ExchangeEnv.SANDBOX);
        assertThatThrownBy(() -> ExchangeEnv.from("staging")).isInstanceOf(CredentialValidationException.class);
    }
}
