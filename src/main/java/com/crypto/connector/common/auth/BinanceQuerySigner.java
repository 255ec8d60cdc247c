package com.crypto.connector.common.auth;

import com.crypto.connector.common.model.CredentialValidationException;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.util.Map;

/**
 * Appends {@code timestamp} and a hex HMAC-SHA256 {@code signature} over the full query string.
 */
public class BinanceQuerySigner implements RequestSigner {
    private final String apiKey;
    private final String apiSecret;
    private final Clock clock;

    public BinanceQuerySigner(String apiKey, String apiSecret, Clock clock) {
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.clock = clock;
    }

    @Override
    public AuthType authType() {
        return AuthType.API_KEY;
    }

    @Override
    public SignedRequest sign(SignableRequest request) {
        if (StringUtils.isBlank(apiKey) || StringUtils.isBlank(apiSecret)) {
            throw new CredentialValidationException("Missing API credentials for binance");
        }
        String query = (request.query.isEmpty() ? "" : request.query + "&") + "timestamp=" + clock.millis();
        String signature = Hmacs.hmacSha256Hex(apiSecret, query);
        return new SignedRequest(query + "&signature=" + signature, Map.of("X-MBX-APIKEY", apiKey), request.body);
    }
}
