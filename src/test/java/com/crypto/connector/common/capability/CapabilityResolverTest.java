package com.crypto.connector.common.capability;

import com.crypto.connector.common.exchange.ExchangeEnv;
import com.crypto.connector.common.exchange.ExchangeProvider;
import com.crypto.connector.common.model.Capabilities;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CapabilityResolverTest {

    @Test
    void krakenCanDoEverythingButOnchain() {
        assertThat(CapabilityResolver.resolve(ExchangeProvider.KRAKEN, "standard", ExchangeEnv.PROD))
                .isEqualTo(new Capabilities(true, true, true, true, false));
    }

    @Test
    void coinbaseFamiliesDiffer() {
        Capabilities app = CapabilityResolver.resolve(ExchangeProvider.COINBASE, "app", ExchangeEnv.PROD);
        Capabilities tradeApi = CapabilityResolver.resolve(ExchangeProvider.COINBASE, "trade_api", ExchangeEnv.PROD);

        assertThat(app.tradeSpot).isFalse();
        assertThat(app.withdraw).isTrue();
        assertThat(tradeApi.read).isFalse();
        assertThat(tradeApi.onchain).isTrue();
    }

    @Test
    void familyAliasesAndDefaultsResolve() {
        Capabilities advanced = CapabilityResolver.resolve(ExchangeProvider.COINBASE, "advanced_trade", ExchangeEnv.PROD);

        assertThat(CapabilityResolver.resolve(ExchangeProvider.COINBASE, "Advanced-Trade", ExchangeEnv.PROD))
                .isEqualTo(advanced);
        assertThat(CapabilityResolver.resolve(ExchangeProvider.COINBASE, null, ExchangeEnv.PROD)).isEqualTo(advanced);
    }

    @Test
    void environmentDoesNotMatter() {
        assertThat(CapabilityResolver.resolve(ExchangeProvider.BINANCE, "us", ExchangeEnv.SANDBOX))
                .isEqualTo(CapabilityResolver.resolve(ExchangeProvider.BINANCE, "us", ExchangeEnv.PROD));
    }

    @Test
    void unknownCombinationsAreReadOnly() {
        assertThat(CapabilityResolver.resolve(ExchangeProvider.KRAKEN, "futures", ExchangeEnv.PROD))
                .isEqualTo(Capabilities.readOnly());
        assertThat(CapabilityResolver.resolve(ExchangeProvider.COINBASE, "no-such-family", ExchangeEnv.PROD))
                .isEqualTo(Capabilities.readOnly());
        assertThat(CapabilityResolver.resolve(null, "us", ExchangeEnv.PROD)).isEqualTo(Capabilities.readOnly());
    }
}
