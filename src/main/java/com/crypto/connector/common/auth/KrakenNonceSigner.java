package com.crypto.connector.common.auth;

import com.crypto.connector.common.model.CredentialValidationException;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Kraken private endpoint signing: the nonce is prepended to the form body and
 * {@code API-Sign = base64(HMAC-SHA512(base64(secret), path + SHA256(nonce + postData)))}.
 */
public class KrakenNonceSigner implements RequestSigner {
    private final String apiKey;
    private final String apiSecret;
    private final NonceSource nonces;

    public KrakenNonceSigner(String apiKey, String apiSecret, NonceSource nonces) {
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.nonces = nonces;
    }

    @Override
    public AuthType authType() {
        return AuthType.API_KEY;
    }

    @Override
    public SignedRequest sign(SignableRequest request) {
        if (StringUtils.isBlank(apiKey) || StringUtils.isBlank(apiSecret)) {
            throw new CredentialValidationException("Missing API credentials for kraken");
        }
        byte[] secret = Hmacs.decodeBase64Secret(apiSecret, "Kraken");
        String nonce = String.valueOf(nonces.next());
        String postData = "nonce=" + nonce + (request.body.isEmpty() ? "" : "&" + request.body);

        byte[] pathBytes = request.path.getBytes(StandardCharsets.UTF_8);
        byte[] digest = Hmacs.sha256((nonce + postData).getBytes(StandardCharsets.UTF_8));
        byte[] message = new byte[pathBytes.length + digest.length];
        System.arraycopy(pathBytes, 0, message, 0, pathBytes.length);
        System.arraycopy(digest, 0, message, pathBytes.length, digest.length);
        String signature = Base64.getEncoder().encodeToString(Hmacs.hmacSha512(secret, message));

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("API-Key", apiKey);
        headers.put("API-Sign", signature);
        return new SignedRequest(request.query, headers, postData);
    }
}
