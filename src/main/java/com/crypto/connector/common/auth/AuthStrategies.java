package com.crypto.connector.common.auth;

import com.crypto.connector.common.exchange.CoinbaseApiFamily;
import com.crypto.connector.common.exchange.ExchangeProvider;
import com.crypto.connector.common.model.Credentials;
import com.crypto.connector.common.model.ExchangeConnectionConfig;

import java.time.Clock;

/**
 * Picks the signing strategy for a connection from its provider and API family only.
 * Every call returns a new signer bound to that connection's credentials.
 */
public class AuthStrategies {
    private final Clock clock;
    private final JwtTokenFactory jwtTokenFactory;

    public AuthStrategies(Clock clock, JwtTokenFactory jwtTokenFactory) {
        this.clock = clock;
        this.jwtTokenFactory = jwtTokenFactory;
    }

    public static AuthType authType(ExchangeProvider provider, String apiFamily) {
        return switch (provider) {
            case KRAKEN, BINANCE -> AuthType.API_KEY;
            case SIMULATION -> AuthType.NONE;
            case COINBASE -> switch (CoinbaseApiFamily.from(apiFamily)) {
                case EXCHANGE -> AuthType.API_KEY;
                case APP -> AuthType.OAUTH;
                case ADVANCED_TRADE, SERVER_WALLET, TRADE_API -> AuthType.JWT_SERVICE;
            };
        };
    }

    public RequestSigner signerFor(ExchangeConnectionConfig config) {
        Credentials credentials = config.credentials;
        return switch (config.provider) {
            case KRAKEN -> new KrakenNonceSigner(credentials.apiKey, credentials.apiSecret, new NonceSource(clock));
            case BINANCE -> new BinanceQuerySigner(credentials.apiKey, credentials.apiSecret, clock);
            case SIMULATION -> new NoAuthSigner();
            case COINBASE -> switch (authType(config.provider, config.apiFamily)) {
                case API_KEY -> new CoinbaseHmacSigner(credentials.apiKey, credentials.apiSecret,
                        credentials.apiPassphrase, clock);
                case OAUTH -> new OAuthSigner(config.metadata(OAuthSigner.ACCESS_TOKEN_KEY));
                default -> new CdpJwtSigner(credentials.apiKey, credentials.apiSecret, jwtTokenFactory);
            };
        };
    }
}
