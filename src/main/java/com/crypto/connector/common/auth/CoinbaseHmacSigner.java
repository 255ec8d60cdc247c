package com.crypto.connector.common.auth;

import com.crypto.connector.common.model.CredentialValidationException;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CB-ACCESS header signing for the Coinbase Exchange API.
 * Prehash: timestamp + method + requestPath + body, signed with the base64-decoded secret.
 */
public class CoinbaseHmacSigner implements RequestSigner {
    private final String apiKey;
    private final String apiSecret;
    private final String passphrase;
    private final Clock clock;

    public CoinbaseHmacSigner(String apiKey, String apiSecret, String passphrase, Clock clock) {
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.passphrase = passphrase;
        this.clock = clock;
    }

    @Override
    public AuthType authType() {
        return AuthType.API_KEY;
    }

    @Override
    public SignedRequest sign(SignableRequest request) {
        if (StringUtils.isBlank(apiKey) || StringUtils.isBlank(apiSecret)) {
            throw new CredentialValidationException("Missing API credentials for coinbase");
        }
        String timestamp = String.valueOf(clock.instant().getEpochSecond());
        String prehash = timestamp + request.method.toUpperCase(Locale.ROOT) + request.pathWithQuery() + request.body;
        byte[] secret = Hmacs.decodeBase64Secret(apiSecret, "Coinbase");
        String signature = Base64.getEncoder().encodeToString(
                Hmacs.hmacSha256(secret, prehash.getBytes(StandardCharsets.UTF_8)));

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("CB-ACCESS-KEY", apiKey);
        headers.put("CB-ACCESS-SIGN", signature);
        headers.put("CB-ACCESS-TIMESTAMP", timestamp);
        if (StringUtils.isNotBlank(passphrase)) {
            headers.put("CB-ACCESS-PASSPHRASE", passphrase);
        }
        return new SignedRequest(request.query, headers, request.body);
    }
}
